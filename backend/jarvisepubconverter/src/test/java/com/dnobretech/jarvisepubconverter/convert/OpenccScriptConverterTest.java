package com.dnobretech.jarvisepubconverter.convert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OpenccScriptConverter Tests")
class OpenccScriptConverterTest {

    @ParameterizedTest
    @EnumSource(ScriptVariant.class)
    @DisplayName("Should convert simplified characters to traditional")
    void shouldConvertToTraditional(ScriptVariant variant) {
        OpenccScriptConverter converter = new OpenccScriptConverter(variant);

        assertThat(converter.convert("简体中文")).isEqualTo("簡體中文");
    }

    @Test
    @DisplayName("Should use Taiwan variant characters without rewriting vocabulary by default")
    void shouldConvertTaiwanCharactersOnly() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TAIWAN);

        assertThat(converter.convert("软件 网络 鼠标 里面 着 为")).isEqualTo("軟件 網絡 鼠標 裡面 著 為");
    }

    @Test
    @DisplayName("Should rewrite Taiwan vocabulary only when phrases are enabled")
    void shouldRewriteVocabularyWithPhrases() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TAIWAN_PHRASES);

        assertThat(converter.convert("软件 网络")).isEqualTo("軟體 網路");
    }

    @Test
    @DisplayName("Should not apply Taiwan variants on generic traditional")
    void shouldSkipTaiwanVariantsOnTraditional() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TRADITIONAL);

        assertThat(converter.convert("软件 着 为")).isEqualTo("軟件 着 爲");
    }

    @Test
    @DisplayName("Should keep markup and ascii untouched")
    void shouldKeepMarkup() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TRADITIONAL);

        assertThat(converter.convert("<p class=\"x\">简体</p>")).isEqualTo("<p class=\"x\">簡體</p>");
    }

    @Test
    @DisplayName("Should convert names keeping separators")
    void shouldConvertNames() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TRADITIONAL);

        assertThat(converter.convertName("OEBPS/简体/")).isEqualTo("OEBPS/簡體/");
    }

    @Test
    @DisplayName("Should be deterministic within a run")
    void shouldBeDeterministic() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TAIWAN);

        assertThat(converter.convertName("简体.html")).isEqualTo(converter.convertName("简体.html"));
        assertThat(converter.convert("简体")).isEqualTo(converter.convert("简体"));
    }

    @Test
    @DisplayName("Should pass empty input through")
    void shouldPassEmptyInput() {
        OpenccScriptConverter converter = new OpenccScriptConverter(ScriptVariant.TAIWAN);

        assertThat(converter.convert("")).isEmpty();
        assertThat(converter.convertName(null)).isNull();
    }

}
