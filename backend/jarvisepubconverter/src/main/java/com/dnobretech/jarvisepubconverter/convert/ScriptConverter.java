package com.dnobretech.jarvisepubconverter.convert;

/**
 * Conversão de escrita (simplificado → tradicional) aplicada a conteúdo e a nomes de entradas.
 * <p>
 * Implementações devem ser determinísticas dentro de uma execução: mesma entrada, mesma saída.
 * Falhas são reportadas com {@link com.dnobretech.jarvisepubconverter.exception.ScriptConversionException}.
 */
public interface ScriptConverter {

    String convert(String text);

    /**
     * Converte um caminho de entrada ("OEBPS/章节/第一章.xhtml"). Separadores '/' são preservados.
     */
    String convertName(String path);
}
