package com.dnobretech.jarvisepubconverter.exception;

import lombok.Getter;

/**
 * O container não pôde ser lido (ou regravado) como ZIP.
 */
@Getter
public class ArchiveException extends ConversionException {

    private final String archiveName;

    public ArchiveException(String archiveName, String message, Throwable cause) {
        super("Arquivo '" + archiveName + "': " + message, cause);
        this.archiveName = archiveName;
    }
}
