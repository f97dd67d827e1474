package com.dnobretech.jarvisepubconverter.exception;

/**
 * Base das falhas do pipeline de conversão. Nenhuma é repetida internamente.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
