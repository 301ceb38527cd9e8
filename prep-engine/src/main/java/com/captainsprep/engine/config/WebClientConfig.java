package com.captainsprep.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;
    private static final String UNCONFIGURED_LLM_URL = "http://localhost:1234";

    @Bean
    public WebClient qdrantWebClient(@Value("${prep.qdrant.base-url:http://localhost:6333}") String baseUrl,
                                     @Value("${prep.qdrant.api-key:}") String apiKey) {
        WebClient.Builder builder = baseBuilder(baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("api-key", apiKey);
        }
        return builder.build();
    }

    @Bean
    public WebClient embeddingsWebClient(@Value("${prep.embeddings.base-url:http://localhost:9000}") String baseUrl) {
        return baseBuilder(baseUrl).build();
    }

    @Bean
    public WebClient llmWebClient(@Value("${prep.llm.base-url:}") String baseUrl,
                                  @Value("${prep.llm.api-key:}") String apiKey,
                                  @Value("${prep.llm.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder builder = baseBuilder(baseUrl.isBlank() ? UNCONFIGURED_LLM_URL : baseUrl);
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient.Builder baseBuilder(String baseUrl) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
        return WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(strategies);
    }
}
