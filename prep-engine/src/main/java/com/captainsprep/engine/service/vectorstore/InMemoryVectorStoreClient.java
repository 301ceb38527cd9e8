package com.captainsprep.engine.service.vectorstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Offline vector store that ranks by term overlap. Distance is {@code 1 - jaccard(query, text)},
 * so it lives in [0, 1] like a cosine distance.
 */
@Component
@Profile("inmemory")
public class InMemoryVectorStoreClient implements VectorStoreClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStoreClient.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    @Override
    public synchronized void upsert(List<String> ids, List<String> texts, List<Map<String, Object>> metadata) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        if (texts == null || texts.size() != ids.size() || metadata == null || metadata.size() != ids.size()) {
            throw new VectorStoreException("ids, texts and metadata must have the same size");
        }
        for (int i = 0; i < ids.size(); i++) {
            entries.put(ids.get(i), new Entry(texts.get(i), Map.copyOf(metadata.get(i)), terms(texts.get(i))));
        }
        log.debug("Stored {} entries in memory ({} total)", ids.size(), entries.size());
    }

    @Override
    public synchronized List<VectorMatch> query(String queryText, int topK, MetadataFilter filter) {
        Set<String> queryTerms = terms(queryText);
        return entries.values().stream()
                .filter(entry -> filter == null || filter.anyOf().isEmpty() || filter.matches(entry.metadata().get(filter.key())))
                .map(entry -> new VectorMatch(entry.text(), entry.metadata(), 1d - jaccard(queryTerms, entry.terms())))
                .filter(match -> match.distance() < 1d)
                .sorted(Comparator.comparingDouble(VectorMatch::distance))
                .limit(Math.max(0, topK))
                .toList();
    }

    private static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0d;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> terms(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(term -> term.length() > 2)
                .collect(Collectors.toSet());
    }

    private record Entry(String text, Map<String, Object> metadata, Set<String> terms) {}
}
