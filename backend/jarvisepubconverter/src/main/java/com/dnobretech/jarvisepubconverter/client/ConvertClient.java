package com.dnobretech.jarvisepubconverter.client;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Cliente do worker HTTP de conversão (OpenCC remoto). Só existe com {@code jarvis.convert.engine=remote}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "jarvis.convert.engine", havingValue = "remote")
public class ConvertClient {

    private final WebClient web;
    private final long timeoutSeconds;
    private final int retries;

    public ConvertClient(WebClient.Builder builder,
                         @Value("${jarvis.convert.base-url:http://127.0.0.1:8020}") String baseUrl,  // ex.: worker opencc
                         @Value("${jarvis.convert.timeout-seconds:60}") long timeoutSeconds,
                         @Value("${jarvis.convert.retries:2}") int retries,
                         @Value("${jarvis.convert.max-in-memory-size:67108864}") int maxInMemorySize) { // 64 MB
        // capítulos inteiros vão e voltam no corpo JSON; o limite padrão (256 KB) não comporta
        this.web = builder.baseUrl(baseUrl)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemorySize))
                        .build())
                .build();
        this.timeoutSeconds = timeoutSeconds;
        this.retries = retries;
    }

    @Data
    public static class ConvertIn {
        private String text;
        private String variant;
        public ConvertIn() {}
        public ConvertIn(String text, String variant) {
            this.text = text; this.variant = variant;
        }
    }

    @Data
    public static class ConvertOut {
        private String converted;
    }

    public ConvertOut convert(String text, String variant) {
        return web.post()
                .uri("/convert")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(new ConvertIn(text, variant))
                .retrieve()
                .bodyToMono(ConvertOut.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .retryWhen(
                        Retry.backoff(retries, Duration.ofMillis(300))
                                .maxBackoff(Duration.ofSeconds(2))
                )
                .block();
    }
}
