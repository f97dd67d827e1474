package com.dnobretech.jarvisepubconverter;

import com.dnobretech.jarvisepubconverter.convert.OpenccScriptConverter;
import com.dnobretech.jarvisepubconverter.convert.ScriptConverter;
import com.dnobretech.jarvisepubconverter.service.EpubConversionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class JarvisEpubConverterApplicationTests {

    @Autowired
    private ScriptConverter converter;

    @Autowired
    private EpubConversionService service;

    @Test
    void contextLoadsWithLocalEngine() {
        assertThat(converter).isInstanceOf(OpenccScriptConverter.class);
        assertThat(service.outputFileName("简体.epub")).isEqualTo("簡體-converted.epub");
    }

}
