package com.dnobretech.jarvisepubconverter.convert;

import com.dnobretech.jarvisepubconverter.client.ConvertClient;
import com.dnobretech.jarvisepubconverter.exception.ScriptConversionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delega a conversão ao worker HTTP por trás de {@link ConvertClient}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "jarvis.convert.engine", havingValue = "remote")
public class RemoteScriptConverter implements ScriptConverter {

    private final ConvertClient client;
    private final ScriptVariant variant;
    private final Map<String, String> nameCache = new ConcurrentHashMap<>();

    public RemoteScriptConverter(ConvertClient client,
                                 @Value("${jarvis.convert.variant:TAIWAN}") ScriptVariant variant) {
        this.client = client;
        this.variant = variant;
        log.info("[opencc] conversão remota, variante {}", variant);
    }

    @Override
    public String convert(String text) {
        if (text == null || text.isBlank()) return text;
        ConvertClient.ConvertOut out;
        try {
            out = client.convert(text, variant.name());
        } catch (RuntimeException e) {
            throw new ScriptConversionException("worker de conversão indisponível: " + e.getMessage(), e);
        }
        if (out == null || out.getConverted() == null) {
            throw new ScriptConversionException("worker de conversão devolveu resposta vazia", null);
        }
        return out.getConverted();
    }

    @Override
    public String convertName(String path) {
        if (path == null || path.isBlank()) return path;
        String cached = nameCache.get(path);
        if (cached != null) return cached;
        // fora do computeIfAbsent: a chamada HTTP não deve segurar o lock do mapa
        String converted = convert(path);
        nameCache.putIfAbsent(path, converted);
        return converted;
    }
}
