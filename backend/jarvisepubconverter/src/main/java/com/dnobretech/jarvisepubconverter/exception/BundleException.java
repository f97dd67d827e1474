package com.dnobretech.jarvisepubconverter.exception;

/**
 * O ZIP externo (com todos os EPUBs convertidos) não pôde ser serializado.
 */
public class BundleException extends ConversionException {

    public BundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
