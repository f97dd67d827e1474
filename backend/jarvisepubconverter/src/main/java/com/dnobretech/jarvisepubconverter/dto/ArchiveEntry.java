package com.dnobretech.jarvisepubconverter.dto;

public record ArchiveEntry(
        String path,        // caminho completo dentro do ZIP, separado por '/'
        boolean directory,  // true = marcador de pasta, sem conteúdo
        byte[] content      // null quando directory
) {

    public static ArchiveEntry directory(String path) {
        return new ArchiveEntry(path, true, null);
    }

    public static ArchiveEntry file(String path, byte[] content) {
        return new ArchiveEntry(path, false, content != null ? content : new byte[0]);
    }
}
