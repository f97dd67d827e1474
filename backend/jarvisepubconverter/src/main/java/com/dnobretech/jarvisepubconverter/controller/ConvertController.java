package com.dnobretech.jarvisepubconverter.controller;

import com.dnobretech.jarvisepubconverter.dto.InputArchive;
import com.dnobretech.jarvisepubconverter.dto.OuterBundle;
import com.dnobretech.jarvisepubconverter.service.EpubConversionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/convert")
public class ConvertController {

    static final String BUNDLE_FILE_NAME = "converted-files.zip";
    // nomes dos EPUBs dentro do zip, na ordem do upload, cada um codificado em UTF-8 (RFC 3986)
    public static final String CONVERTED_FILES_HEADER = "X-Converted-Files";

    private final EpubConversionService service;
    private final String engine;
    private final String variant;

    public ConvertController(EpubConversionService service,
                             @Value("${jarvis.convert.engine:local}") String engine,
                             @Value("${jarvis.convert.variant:TAIWAN}") String variant) {
        this.service = service;
        this.engine = engine;
        this.variant = variant;
    }

    /**
     * Converte um ou mais EPUBs (simplificado → tradicional) e devolve um zip com todos.
     *
     * @param files partes multipart repetidas com o nome "file"
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> convert(@RequestPart(value = "file", required = false) List<MultipartFile> files)
            throws IOException {
        List<InputArchive> inputs = new ArrayList<>();
        if (files != null) {
            for (MultipartFile f : files) {
                inputs.add(new InputArchive(f.getOriginalFilename(), f.getBytes()));
            }
        }
        log.info("Upload recebido: {} arquivo(s)", inputs.size());

        OuterBundle bundle = service.processBatch(inputs);
        log.info("Pacote pronto: {}", bundle.fileNames());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(BUNDLE_FILE_NAME).build().toString())
                .header(CONVERTED_FILES_HEADER, bundle.fileNames().stream()
                        .map(n -> UriUtils.encode(n, StandardCharsets.UTF_8))
                        .collect(Collectors.joining(",")))
                .contentType(MediaType.parseMediaType("application/zip"))
                .body(bundle.content());
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
                "ok", true,
                "engine", engine,
                "variant", variant
        ));
    }
}
