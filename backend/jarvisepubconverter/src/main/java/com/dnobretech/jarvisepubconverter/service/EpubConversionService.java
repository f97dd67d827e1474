package com.dnobretech.jarvisepubconverter.service;

import com.dnobretech.jarvisepubconverter.dto.InputArchive;
import com.dnobretech.jarvisepubconverter.dto.OuterBundle;

import java.util.List;

public interface EpubConversionService {

    /**
     * Converte todos os EPUBs e empacota o resultado num único ZIP.
     * Lote atômico: qualquer falha aborta tudo e nenhum pacote é gerado.
     */
    OuterBundle processBatch(List<InputArchive> inputs);

    /** "书名.epub" → "書名-converted.epub" */
    String outputFileName(String displayName);
}
