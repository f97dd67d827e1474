package com.dnobretech.jarvisepubconverter.convert;

import com.dnobretech.jarvisepubconverter.dto.ArchiveEntry;
import com.dnobretech.jarvisepubconverter.dto.InputArchive;
import com.dnobretech.jarvisepubconverter.exception.ArchiveException;
import com.dnobretech.jarvisepubconverter.exception.EntryException;
import com.dnobretech.jarvisepubconverter.util.FutureJoiner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * Converte um EPUB: lê todas as entradas, transforma em paralelo e regrava na ordem original.
 */
@Slf4j
@Component
public class EpubTranscoder {

    private final EntryClassifier classifier;
    private final EntryTransformer transformer;
    private final Executor entryExecutor;

    public EpubTranscoder(EntryClassifier classifier,
                          EntryTransformer transformer,
                          @Qualifier("entryExecutor") Executor entryExecutor) {
        this.classifier = classifier;
        this.transformer = transformer;
        this.entryExecutor = entryExecutor;
    }

    public byte[] transcode(InputArchive input) {
        long t0 = System.currentTimeMillis();
        String name = input.displayName();

        // 1) leitura sequencial (um único leitor sobre o canal)
        List<ArchiveEntry> entries = readEntries(input);

        // 2) classifica + transforma cada entrada fora da thread atual
        List<Callable<ArchiveEntry>> tasks = new ArrayList<>(entries.size());
        for (ArchiveEntry entry : entries) {
            tasks.add(() -> transformOne(entry));
        }

        List<ArchiveEntry> converted;
        try {
            converted = FutureJoiner.invokeAll(entryExecutor, tasks,
                    cause -> new ArchiveException(name, "conversão interrompida", cause));
        } catch (EntryException e) {
            log.warn("[transcode] {} abortado na entrada {}", name, e.getEntryPath());
            throw e.getArchiveName() == null ? e.withArchive(name) : e;
        }

        // 3) escrita sequencial, mesma ordem da leitura
        byte[] out;
        try {
            out = ArchiveWriter.write(converted, input.content().length);
        } catch (IOException e) {
            throw new ArchiveException(name, "não foi possível gravar o EPUB convertido", e);
        }

        log.info("[transcode] {}: {} entradas, {} -> {} bytes em {} ms",
                name, converted.size(), input.content().length, out.length, System.currentTimeMillis() - t0);
        return out;
    }

    private ArchiveEntry transformOne(ArchiveEntry entry) {
        EntryKind kind = classifier.classify(entry.path(), entry.directory());
        return transformer.transform(entry, kind);
    }

    List<ArchiveEntry> readEntries(InputArchive input) {
        String name = input.displayName();
        List<ArchiveEntry> out = new ArrayList<>();
        try (SeekableInMemoryByteChannel channel = new SeekableInMemoryByteChannel(input.content());
             ZipFile zip = new ZipFile(channel)) {
            for (ZipArchiveEntry ze : Collections.list(zip.getEntries())) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new ArchiveException(name, "leitura interrompida", null);
                }
                if (ze.isDirectory()) {
                    out.add(ArchiveEntry.directory(ze.getName()));
                    continue;
                }
                try (InputStream in = zip.getInputStream(ze)) {
                    out.add(ArchiveEntry.file(ze.getName(), in.readAllBytes()));
                } catch (IOException e) {
                    throw new EntryException(name, ze.getName(), "não foi possível ler a entrada", e);
                }
            }
        } catch (IOException e) {
            log.warn("[transcode] {} não é um ZIP legível: {}", name, e.getMessage());
            throw new ArchiveException(name, "não é um container ZIP válido", e);
        }
        log.debug("[transcode] {}: {} entradas lidas", name, out.size());
        return out;
    }
}
