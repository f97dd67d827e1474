package com.dnobretech.jarvisepubconverter.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Corpo JSON dos erros da API. {@code archive} e {@code entry} só aparecem quando a falha
 * aponta um EPUB (e uma entrada dele) do lote.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        int status,
        String error,
        String message,
        String path,
        String archive,
        String entry,
        Instant timestamp
) {

    public static ApiError of(HttpStatus status, String message, String path) {
        return new ApiError(status.value(), status.getReasonPhrase(), message, path, null, null, Instant.now());
    }

    public static ApiError of(HttpStatus status, ConversionException ex, String path) {
        String archive = null;
        String entry = null;
        if (ex instanceof EntryException ee) {
            archive = ee.getArchiveName();
            entry = ee.getEntryPath();
        } else if (ex instanceof ArchiveException ae) {
            archive = ae.getArchiveName();
        }
        return new ApiError(status.value(), status.getReasonPhrase(), ex.getMessage(), path, archive, entry,
                Instant.now());
    }
}
