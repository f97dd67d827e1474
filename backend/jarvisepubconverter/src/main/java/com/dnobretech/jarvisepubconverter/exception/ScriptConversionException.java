package com.dnobretech.jarvisepubconverter.exception;

public class ScriptConversionException extends ConversionException {

    public ScriptConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
