package com.captainsprep.engine.service.vectorstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Calls the embeddings service's {@code /embed} endpoint, splitting large inputs into
 * sequential requests of at most {@code prep.embeddings.batch-size} texts.
 */
@Component
@Profile("!inmemory")
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final int batchSize;
    private final Duration timeout;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                     @Value("${prep.embeddings.batch-size:64}") int batchSize,
                                     @Value("${prep.embeddings.timeout-seconds:30}") long timeoutSeconds) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.batchSize = Math.max(1, batchSize);
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new VectorStoreException("No texts provided for embedding");
        }
        List<EmbedResponse> responses = Flux.fromIterable(partition(texts))
                .concatMap(this::request)
                .collectList()
                .block();
        if (responses == null || responses.isEmpty()) {
            throw new VectorStoreException("Embeddings service returned no response");
        }
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        responses.forEach(response -> vectors.addAll(response.vectors()));
        if (vectors.size() != texts.size()) {
            throw new VectorStoreException("Embeddings service returned " + vectors.size()
                    + " vectors for " + texts.size() + " texts");
        }
        EmbedResponse first = responses.get(0);
        log.debug("Embedded {} texts in {} requests with model {}", texts.size(), responses.size(), first.model());
        return new EmbeddingBatch(vectors, first.model(), first.dimensions());
    }

    private Mono<EmbedResponse> request(List<String> batch) {
        return embeddingsWebClient.post()
                .uri("/embed")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new EmbedRequest(batch))
                .retrieve()
                .bodyToMono(EmbedResponse.class)
                .timeout(timeout)
                .filter(response -> response.vectors() != null)
                .switchIfEmpty(Mono.error(() -> new VectorStoreException("Embeddings service returned no vectors")))
                .onErrorMap(ex -> !(ex instanceof VectorStoreException), ex -> {
                    log.error("Embeddings service call failed: {}", ex.getMessage());
                    return new VectorStoreException("Failed to compute embeddings", ex);
                });
    }

    private List<List<String>> partition(List<String> texts) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += batchSize) {
            batches.add(texts.subList(start, Math.min(texts.size(), start + batchSize)));
        }
        return batches;
    }

    record EmbedRequest(List<String> texts) {}

    record EmbedResponse(List<List<Double>> vectors, String model, int dimensions) {}
}
