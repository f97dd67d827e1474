package com.dnobretech.jarvisepubconverter.convert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MetadataPatcher Tests")
class MetadataPatcherTest {

    private final MetadataPatcher patcher = new MetadataPatcher("zh-CN", "zh-TW");

    @Test
    @DisplayName("Should rewrite the exact language tag in opf documents")
    void shouldRewriteExactTag() {
        String opf = "<metadata>\n  <dc:title>書</dc:title>\n  <dc:language>zh-CN</dc:language>\n</metadata>";

        String patched = patcher.patch(opf, "opf");

        assertThat(patched)
            .isEqualTo("<metadata>\n  <dc:title>書</dc:title>\n  <dc:language>zh-TW</dc:language>\n</metadata>");
    }

    @Test
    @DisplayName("Should leave text untouched when the exact tag is absent")
    void shouldLeaveTextWithoutTagUntouched() {
        String opf = "<metadata><dc:language>en</dc:language></metadata>";

        assertThat(patcher.patch(opf, "opf")).isSameAs(opf);
    }

    @Test
    @DisplayName("Should not tolerate formatting variations")
    void shouldNotTolerateVariations() {
        String spaced = "<dc:language> zh-CN </dc:language>";
        String attributed = "<dc:language xml:lang=\"en\">zh-CN</dc:language>";
        String lowercase = "<dc:language>zh-cn</dc:language>";

        assertThat(patcher.patch(spaced, "opf")).isEqualTo(spaced);
        assertThat(patcher.patch(attributed, "opf")).isEqualTo(attributed);
        assertThat(patcher.patch(lowercase, "opf")).isEqualTo(lowercase);
    }

    @Test
    @DisplayName("Should only patch opf documents")
    void shouldOnlyPatchOpf() {
        String html = "<p><dc:language>zh-CN</dc:language></p>";

        assertThat(patcher.patch(html, "xhtml")).isEqualTo(html);
        assertThat(patcher.patch(html, "ncx")).isEqualTo(html);
    }

    @Test
    @DisplayName("Should replace only the first occurrence")
    void shouldReplaceFirstOccurrenceOnly() {
        String opf = "<dc:language>zh-CN</dc:language><dc:language>zh-CN</dc:language>";

        assertThat(patcher.patch(opf, "opf"))
            .isEqualTo("<dc:language>zh-TW</dc:language><dc:language>zh-CN</dc:language>");
    }

    @Test
    @DisplayName("Should honour configured languages")
    void shouldHonourConfiguredLanguages() {
        MetadataPatcher hk = new MetadataPatcher("zh-Hans", "zh-HK");

        assertThat(hk.patch("<dc:language>zh-Hans</dc:language>", "opf"))
            .isEqualTo("<dc:language>zh-HK</dc:language>");
    }

}
