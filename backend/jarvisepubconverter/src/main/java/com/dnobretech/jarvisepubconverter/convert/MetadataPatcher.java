package com.dnobretech.jarvisepubconverter.convert;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Troca o idioma declarado no content.opf depois da conversão.
 * <p>
 * Substituição literal e exata da primeira ocorrência de {@code <dc:language>zh-CN</dc:language>};
 * qualquer variação de espaços, aspas ou atributos não casa e o texto volta intacto.
 */
@Component
public class MetadataPatcher {

    static final String METADATA_EXTENSION = "opf";

    private final String sourceTag;
    private final String targetTag;

    public MetadataPatcher(@Value("${jarvis.convert.source-language:zh-CN}") String sourceLanguage,
                           @Value("${jarvis.convert.target-language:zh-TW}") String targetLanguage) {
        this.sourceTag = languageTag(sourceLanguage);
        this.targetTag = languageTag(targetLanguage);
    }

    public String patch(String convertedText, String extension) {
        if (convertedText == null || !METADATA_EXTENSION.equals(extension)) return convertedText;
        int at = convertedText.indexOf(sourceTag);
        if (at < 0) return convertedText;
        return convertedText.substring(0, at) + targetTag + convertedText.substring(at + sourceTag.length());
    }

    private static String languageTag(String language) {
        return "<dc:language>" + language + "</dc:language>";
    }
}
