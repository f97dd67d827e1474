package com.dnobretech.jarvisepubconverter.convert;

import com.dnobretech.jarvisepubconverter.dto.ArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Serializa entradas num ZIP em memória, na ordem recebida, todas com DEFLATE.
 * Usado tanto para cada EPUB convertido quanto para o pacote final.
 */
public final class ArchiveWriter {

    private ArchiveWriter() {
    }

    public static byte[] write(List<ArchiveEntry> entries, int sizeHint) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(Math.max(1024, sizeHint));
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(buf)) {
            zos.setMethod(ZipArchiveOutputStream.DEFLATED);
            for (ArchiveEntry entry : entries) {
                ZipArchiveEntry ze = new ZipArchiveEntry(entry.directory() ? asDirectoryName(entry.path()) : entry.path());
                zos.putArchiveEntry(ze);
                if (!entry.directory()) {
                    zos.write(entry.content());
                }
                zos.closeArchiveEntry();
            }
            zos.finish();
        }
        return buf.toByteArray();
    }

    // o ZIP só reconhece pasta pela barra final
    static String asDirectoryName(String path) {
        return path.endsWith("/") ? path : path + "/";
    }
}
