package com.dnobretech.jarvisepubconverter.convert;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Decide o tratamento de cada entrada só pelo caminho (não olha o conteúdo).
 */
@Component
public class EntryClassifier {

    // documentos html, navegação (toc.ncx) e metadados do pacote (content.opf)
    public static final Set<String> TARGET_EXTENSIONS = Set.of("htm", "html", "xhtml", "ncx", "opf");

    public EntryKind classify(String path, boolean directory) {
        if (directory) return EntryKind.DIRECTORY;
        return TARGET_EXTENSIONS.contains(extensionOf(path))
                ? EntryKind.TEXT_TARGET
                : EntryKind.BINARY_PASSTHROUGH;
    }

    /**
     * Texto depois do último '.', em minúsculas; "" quando não há ponto.
     */
    public static String extensionOf(String path) {
        if (path == null) return "";
        int i = path.lastIndexOf('.');
        return i >= 0 ? path.substring(i + 1).toLowerCase(Locale.ROOT) : "";
    }
}
