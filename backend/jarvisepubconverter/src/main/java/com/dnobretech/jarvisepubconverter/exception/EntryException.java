package com.dnobretech.jarvisepubconverter.exception;

import lombok.Getter;

/**
 * Uma entrada não pôde ser lida, decodificada ou convertida. Aborta o arquivo inteiro.
 */
@Getter
public class EntryException extends ConversionException {

    private final String archiveName;
    private final String entryPath; // caminho original, antes da conversão do nome
    private final String detail;

    public EntryException(String archiveName, String entryPath, String detail, Throwable cause) {
        super(describe(archiveName, entryPath) + ": " + detail, cause);
        this.archiveName = archiveName;
        this.entryPath = entryPath;
        this.detail = detail;
    }

    /** Sem nome de arquivo: usado pelo passo de transformação, que só conhece a entrada. */
    public EntryException(String entryPath, String detail, Throwable cause) {
        this(null, entryPath, detail, cause);
    }

    /** Copia a falha acrescentando o nome do EPUB de onde a entrada veio. */
    public EntryException withArchive(String archiveName) {
        return new EntryException(archiveName, entryPath, detail, getCause());
    }

    private static String describe(String archiveName, String entryPath) {
        return archiveName == null
                ? "Entrada '" + entryPath + "'"
                : "Entrada '" + entryPath + "' de '" + archiveName + "'";
    }
}
