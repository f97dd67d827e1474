package com.dnobretech.jarvisepubconverter.convert;

/**
 * Variante de escrita tradicional usada na conversão.
 */
public enum ScriptVariant {
    /** Caractere a caractere com as variantes de Taiwan (s2tw do OpenCC): 里→裡, 着→著. Vocabulário intacto. */
    TAIWAN,
    /** Como {@link #TAIWAN}, mas também troca vocabulário (s2twp): 软件→軟體, 网络→網路. */
    TAIWAN_PHRASES,
    /** Tradicional genérico, sem variantes regionais (s2t). */
    TRADITIONAL
}
