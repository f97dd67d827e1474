package com.dnobretech.jarvisepubconverter.convert;

import com.dnobretech.jarvisepubconverter.dto.ArchiveEntry;
import com.dnobretech.jarvisepubconverter.exception.EntryException;
import com.dnobretech.jarvisepubconverter.exception.ScriptConversionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Produz a entrada de saída (nome convertido + conteúdo) a partir de uma entrada já classificada.
 * Não escreve nada no ZIP de saída.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryTransformer {

    private final ScriptConverter converter;
    private final MetadataPatcher metadataPatcher;

    public ArchiveEntry transform(ArchiveEntry entry, EntryKind kind) {
        try {
            String newPath = converter.convertName(entry.path());
            log.debug("[entry] {} {} -> {}", kind, entry.path(), newPath);
            return switch (kind) {
                case DIRECTORY -> ArchiveEntry.directory(newPath);
                case TEXT_TARGET -> ArchiveEntry.file(newPath, convertText(entry));
                case BINARY_PASSTHROUGH -> ArchiveEntry.file(newPath, entry.content());
            };
        } catch (CharacterCodingException e) {
            throw new EntryException(entry.path(), "conteúdo não é UTF-8 válido", e);
        } catch (ScriptConversionException e) {
            throw new EntryException(entry.path(), "falha na conversão: " + e.getMessage(), e);
        }
    }

    private byte[] convertText(ArchiveEntry entry) throws CharacterCodingException {
        String text = decodeUtf8(entry.content());
        String converted = converter.convert(text);
        converted = metadataPatcher.patch(converted, EntryClassifier.extensionOf(entry.path()));
        return converted.getBytes(StandardCharsets.UTF_8);
    }

    // estrito: bytes inválidos viram erro em vez de U+FFFD
    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
