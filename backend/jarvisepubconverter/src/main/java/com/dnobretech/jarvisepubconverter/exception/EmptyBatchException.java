package com.dnobretech.jarvisepubconverter.exception;

public class EmptyBatchException extends ConversionException {

    public EmptyBatchException() {
        super("Nenhum arquivo enviado.");
    }
}
