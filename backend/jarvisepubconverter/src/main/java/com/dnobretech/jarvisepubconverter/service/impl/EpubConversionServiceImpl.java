package com.dnobretech.jarvisepubconverter.service.impl;

import com.dnobretech.jarvisepubconverter.convert.ArchiveWriter;
import com.dnobretech.jarvisepubconverter.convert.EpubTranscoder;
import com.dnobretech.jarvisepubconverter.convert.ScriptConverter;
import com.dnobretech.jarvisepubconverter.dto.ArchiveEntry;
import com.dnobretech.jarvisepubconverter.dto.InputArchive;
import com.dnobretech.jarvisepubconverter.dto.OuterBundle;
import com.dnobretech.jarvisepubconverter.exception.BundleException;
import com.dnobretech.jarvisepubconverter.exception.ConversionException;
import com.dnobretech.jarvisepubconverter.exception.EmptyBatchException;
import com.dnobretech.jarvisepubconverter.service.EpubConversionService;
import com.dnobretech.jarvisepubconverter.util.FutureJoiner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class EpubConversionServiceImpl implements EpubConversionService {

    static final String EPUB_SUFFIX = ".epub";
    static final String CONVERTED_MARKER = "-converted";
    static final String FALLBACK_BASE_NAME = "book";

    private final EpubTranscoder transcoder;
    private final ScriptConverter converter;
    private final Executor archiveExecutor;

    public EpubConversionServiceImpl(EpubTranscoder transcoder,
                                     ScriptConverter converter,
                                     @Qualifier("archiveExecutor") Executor archiveExecutor) {
        this.transcoder = transcoder;
        this.converter = converter;
        this.archiveExecutor = archiveExecutor;
    }

    // ===== Orquestração do lote =====
    @Override
    public OuterBundle processBatch(List<InputArchive> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new EmptyBatchException();
        }
        long t0 = System.currentTimeMillis();
        log.info("[batch] iniciando conversão de {} arquivo(s)", inputs.size());

        // 1) nomes de saída definidos antes, na ordem do upload
        List<String> names = outputFileNames(inputs);

        // 2) um EPUB por tarefa
        List<Callable<byte[]>> tasks = new ArrayList<>(inputs.size());
        for (InputArchive input : inputs) {
            tasks.add(() -> transcoder.transcode(input));
        }
        List<byte[]> converted;
        try {
            converted = FutureJoiner.invokeAll(archiveExecutor, tasks,
                    cause -> new ConversionException("Conversão do lote interrompida", cause));
        } catch (ConversionException e) {
            log.warn("[batch] lote abortado, nenhum pacote gerado: {}", e.getMessage());
            throw e;
        }

        // 3) pacote final, mesma ordem dos uploads
        List<ArchiveEntry> bundleEntries = new ArrayList<>(converted.size());
        long total = 0;
        for (int i = 0; i < converted.size(); i++) {
            bundleEntries.add(ArchiveEntry.file(names.get(i), converted.get(i)));
            total += converted.get(i).length;
        }
        byte[] bundle;
        try {
            bundle = ArchiveWriter.write(bundleEntries, (int) Math.min(total, Integer.MAX_VALUE - 8));
        } catch (IOException e) {
            throw new BundleException("Não foi possível gerar o pacote final", e);
        }

        log.info("[batch] {} arquivo(s) convertidos, pacote com {} bytes em {} ms",
                names.size(), bundle.length, System.currentTimeMillis() - t0);
        return new OuterBundle(bundle, List.copyOf(names));
    }

    @Override
    public String outputFileName(String displayName) {
        return outputFileName(convertedBase(displayName), 1);
    }

    // ===== Helpers =====

    // dois uploads com o mesmo nome não podem sobrescrever um ao outro no zip final
    private List<String> outputFileNames(List<InputArchive> inputs) {
        List<String> names = new ArrayList<>(inputs.size());
        Set<String> used = new HashSet<>();
        for (InputArchive input : inputs) {
            String base = convertedBase(input.displayName());
            String name = outputFileName(base, 1);
            for (int n = 2; !used.add(name); n++) {
                name = outputFileName(base, n);
            }
            names.add(name);
        }
        return names;
    }

    private String convertedBase(String displayName) {
        return converter.convertName(baseName(displayName));
    }

    // n > 1 = n-ésima ocorrência do mesmo nome no lote
    static String outputFileName(String convertedBase, int n) {
        String base = n > 1 ? convertedBase + " (" + n + ")" : convertedBase;
        return base + CONVERTED_MARKER + EPUB_SUFFIX;
    }

    static String baseName(String displayName) {
        if (displayName == null || displayName.isBlank()) return FALLBACK_BASE_NAME;
        String name = displayName.trim();
        if (name.toLowerCase(Locale.ROOT).endsWith(EPUB_SUFFIX)) {
            name = name.substring(0, name.length() - EPUB_SUFFIX.length());
        }
        return name.isEmpty() ? FALLBACK_BASE_NAME : name;
    }
}
