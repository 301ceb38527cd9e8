package com.captainsprep.engine.service.generation.openai;

import com.captainsprep.engine.service.generation.GenerationUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiChatClientTest {

    private static final OpenAiChatClient.Request REQUEST = new OpenAiChatClient.Request("test-model",
            List.of(new OpenAiChatClient.Message("user", "hi")), 0.4, 64);

    @Test
    void streamsServerSentEventsUntilDone() {
        String body = "data: {\"choices\":[{\"delta\":{\"content\":\"Hello\"}}]}\n\n"
                + "data: [DONE]\n\n";
        OpenAiChatClient client = new OpenAiChatClient(webClient(HttpStatus.OK, body), 5);

        StepVerifier.create(client.stream(REQUEST))
                .assertNext(event -> {
                    assertThat(event.done()).isFalse();
                    assertThat(event.data()).contains("Hello");
                })
                .assertNext(event -> assertThat(event.done()).isTrue())
                .verifyComplete();
    }

    @Test
    void httpErrorsBecomeGenerationUnavailable() {
        OpenAiChatClient client = new OpenAiChatClient(webClient(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"quota\"}"), 5);

        StepVerifier.create(client.stream(REQUEST))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(GenerationUnavailableException.class)
                        .hasMessage("Chat completion returned 429"))
                .verify();
    }

    private static WebClient webClient(HttpStatus status, String body) {
        return WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, status.is2xxSuccessful()
                                ? MediaType.TEXT_EVENT_STREAM_VALUE
                                : MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
    }
}
