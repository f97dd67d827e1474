package com.dnobretech.jarvisepubconverter.dto;

/**
 * Um EPUB recebido no upload: nome exibido pelo cliente + bytes brutos do ZIP.
 */
public record InputArchive(String displayName, byte[] content) {

    public InputArchive {
        content = content != null ? content : new byte[0];
    }
}
