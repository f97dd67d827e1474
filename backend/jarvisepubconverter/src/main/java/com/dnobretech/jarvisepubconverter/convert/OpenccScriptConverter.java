package com.dnobretech.jarvisepubconverter.convert;

import com.dnobretech.jarvisepubconverter.exception.ScriptConversionException;
import com.github.houbb.opencc4j.core.impl.ZhConvertBootstrap;
import com.github.houbb.opencc4j.support.datamap.impl.DataMaps;
import com.github.houbb.opencc4j.support.segment.impl.Segments;
import com.github.houbb.opencc4j.util.ZhConverterUtil;
import com.github.houbb.opencc4j.util.ZhTwConverterUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversão local com as tabelas do OpenCC (opencc4j). Engine padrão.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "jarvis.convert.engine", havingValue = "local", matchIfMissing = true)
public class OpenccScriptConverter implements ScriptConverter {

    // s2tw: sem segmentação por frase, só tabela de caracteres + variantes de Taiwan
    private static final ZhConvertBootstrap TAIWAN_CHARS = ZhConvertBootstrap.newInstance()
            .segment(Segments.chars())
            .dataMap(DataMaps.taiwan());

    private final ScriptVariant variant;

    // prefixos de pasta se repetem em quase todas as entradas
    private final Map<String, String> nameCache = new ConcurrentHashMap<>();

    public OpenccScriptConverter(@Value("${jarvis.convert.variant:TAIWAN}") ScriptVariant variant) {
        this.variant = variant;
        log.info("[opencc] conversão local, variante {}", variant);
    }

    @Override
    public String convert(String text) {
        if (text == null || text.isEmpty()) return text;
        try {
            return switch (variant) {
                case TAIWAN -> TAIWAN_CHARS.toTraditional(text);
                case TAIWAN_PHRASES -> ZhTwConverterUtil.toTraditional(text);
                case TRADITIONAL -> ZhConverterUtil.toTraditional(text);
            };
        } catch (RuntimeException e) {
            throw new ScriptConversionException("opencc falhou (" + variant + ")", e);
        }
    }

    @Override
    public String convertName(String path) {
        if (path == null || path.isEmpty()) return path;
        return nameCache.computeIfAbsent(path, this::convert);
    }
}
