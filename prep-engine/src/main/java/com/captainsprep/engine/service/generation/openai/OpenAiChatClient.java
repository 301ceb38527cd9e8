package com.captainsprep.engine.service.generation.openai;

import com.captainsprep.engine.service.generation.GenerationUnavailableException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private static final StreamEvent DONE = new StreamEvent("[DONE]", true);

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${prep.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public Duration timeout() {
        return timeout;
    }

    public Flux<StreamEvent> stream(Request request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", Boolean.TRUE);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }

        return webClient.post()
                .uri("/v1/chat/completions")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .timeout(timeout)
                .map(event -> event.data() == null ? "" : event.data())
                .filter(data -> !data.isBlank())
                .map(data -> {
                    String trimmed = data.trim();
                    return "[DONE]".equals(trimmed) ? DONE : new StreamEvent(trimmed, false);
                })
                .onErrorMap(WebClientResponseException.class, this::logAndWrap)
                .onErrorMap(ex -> ex instanceof GenerationUnavailableException
                        ? ex
                        : new GenerationUnavailableException("Failed to stream chat completion", ex));
    }

    private GenerationUnavailableException logAndWrap(WebClientResponseException exception) {
        log.warn("LLM chat completion returned {}: {}", exception.getStatusCode(), exception.getResponseBodyAsString());
        return new GenerationUnavailableException("Chat completion returned " + exception.getStatusCode().value(), exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens) {
    }

    public record Message(String role, String content) {
    }

    public record StreamEvent(String data, boolean done) {
    }
}
