package com.captainsprep.engine.service.retrieval;

import com.captainsprep.engine.model.RetrievedChunk;
import com.captainsprep.engine.service.ingestion.DefaultIngestionService;
import com.captainsprep.engine.service.vectorstore.MetadataFilter;
import com.captainsprep.engine.service.vectorstore.VectorMatch;
import com.captainsprep.engine.service.vectorstore.VectorStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class VectorStoreRetriever implements Retriever {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreRetriever.class);

    private final VectorStoreClient vectorStoreClient;

    public VectorStoreRetriever(VectorStoreClient vectorStoreClient) {
        this.vectorStoreClient = vectorStoreClient;
    }

    @Override
    public List<RetrievedChunk> retrieve(String query, Set<String> scope, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return Collections.emptyList();
        }
        if (scope != null && scope.isEmpty()) {
            return Collections.emptyList();
        }
        MetadataFilter filter = scope == null ? null : MetadataFilter.anyOf(DefaultIngestionService.DOCUMENT_ID, scope);
        try {
            List<VectorMatch> matches = vectorStoreClient.query(query, topK, filter);
            if (matches == null) {
                return Collections.emptyList();
            }
            return matches.stream().limit(topK).map(this::toChunk).toList();
        } catch (Exception e) {
            log.warn("Vector store query failed, continuing without context: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private RetrievedChunk toChunk(VectorMatch match) {
        Map<String, Object> metadata = match.metadata();
        return new RetrievedChunk(
                stringValue(metadata.get(DefaultIngestionService.DOCUMENT_ID), null),
                stringValue(metadata.get(DefaultIngestionService.FILENAME), "Unknown"),
                intValue(metadata.get(DefaultIngestionService.CHUNK_INDEX)),
                match.text() == null ? "" : match.text(),
                similarity(match.distance())
        );
    }

    static Double similarity(Double distance) {
        if (distance == null || distance.isNaN()) {
            return null;
        }
        return Math.max(0d, Math.min(1d, 1d - distance));
    }

    private static String stringValue(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }

    private static int intValue(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString());
            } catch (NumberFormatException ignored) {
                return -1;
            }
        }
        return -1;
    }
}
