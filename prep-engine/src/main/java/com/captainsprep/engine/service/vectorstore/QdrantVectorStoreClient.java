package com.captainsprep.engine.service.vectorstore;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Qdrant collection configured with cosine distance. Qdrant reports cosine similarity, which is
 * converted back to a distance ({@code 1 - similarity}) so callers see the store contract.
 */
@Component
@Profile("!inmemory")
public class QdrantVectorStoreClient implements VectorStoreClient {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreClient.class);

    static final String TEXT_FIELD = "text";

    private final WebClient qdrantWebClient;
    private final EmbeddingsClient embeddingsClient;
    private final String collection;
    private final String vectorName;

    public QdrantVectorStoreClient(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                   EmbeddingsClient embeddingsClient,
                                   @Value("${prep.qdrant.collection:prep_chunks_v1}") String collection,
                                   @Value("${prep.qdrant.vector-name:text_embeddings}") String vectorName) {
        this.qdrantWebClient = qdrantWebClient;
        this.embeddingsClient = embeddingsClient;
        this.collection = collection;
        this.vectorName = vectorName;
    }

    @Override
    public void upsert(List<String> ids, List<String> texts, List<Map<String, Object>> metadata) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        if (texts == null || texts.size() != ids.size() || metadata == null || metadata.size() != ids.size()) {
            throw new VectorStoreException("ids, texts and metadata must have the same size");
        }
        List<List<Double>> vectors = embeddingsClient.embed(texts).vectors();
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            Map<String, Object> payload = new HashMap<>(metadata.get(i));
            payload.put(TEXT_FIELD, texts.get(i));
            points.add(new Point(pointId(ids.get(i)), Map.of(vectorName, vectors.get(i)), payload));
        }
        try {
            qdrantWebClient.put()
                    .uri("/collections/{collection}/points?wait=true", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new UpsertRequest(points))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .onErrorResume(throwable -> {
                        log.error("Failed to upsert into Qdrant: {}", throwable.getMessage());
                        return Mono.error(new VectorStoreException("Failed to upsert into Qdrant", throwable));
                    })
                    .block();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            throw new VectorStoreException("Failed to upsert into Qdrant", e);
        }
    }

    @Override
    public List<VectorMatch> query(String queryText, int topK, MetadataFilter filter) {
        List<Double> vector = embeddingsClient.embed(List.of(queryText)).vectors().get(0);
        SearchRequest request = new SearchRequest(new NamedVector(vectorName, vector), topK, toQdrantFilter(filter), true);
        try {
            SearchResponse response = qdrantWebClient.post()
                    .uri("/collections/{collection}/points/search", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .onErrorResume(throwable -> Mono.error(new VectorStoreException("Qdrant search failed", throwable)))
                    .block();
            if (response == null || response.result() == null) {
                return Collections.emptyList();
            }
            return response.result().stream().map(ScoredPoint::toMatch).toList();
        } catch (VectorStoreException ex) {
            throw ex;
        } catch (Exception e) {
            throw new VectorStoreException("Qdrant search failed", e);
        }
    }

    private QueryFilter toQdrantFilter(MetadataFilter filter) {
        if (filter == null || filter.anyOf().isEmpty()) {
            return null;
        }
        return new QueryFilter(List.of(new FieldCondition(filter.key(), new Match(List.copyOf(filter.anyOf())))));
    }

    private String pointId(String id) {
        return UUID.nameUUIDFromBytes(id.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private record Point(String id, Map<String, List<Double>> vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<Point> points) {}

    private record NamedVector(String name, List<Double> vector) {}

    private record SearchRequest(NamedVector vector,
                                 int limit,
                                 QueryFilter filter,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    private record QueryFilter(List<FieldCondition> must) {}

    private record FieldCondition(String key, Match match) {}

    private record Match(List<String> any) {}

    private record SearchResponse(List<ScoredPoint> result) {}

    private record ScoredPoint(String id, double score, Map<String, Object> payload) {
        VectorMatch toMatch() {
            Map<String, Object> metadata = payload == null ? new HashMap<>() : new HashMap<>(payload);
            Object text = metadata.remove(TEXT_FIELD);
            return new VectorMatch(text == null ? "" : text.toString(), metadata, Math.max(0d, 1d - score));
        }
    }
}
