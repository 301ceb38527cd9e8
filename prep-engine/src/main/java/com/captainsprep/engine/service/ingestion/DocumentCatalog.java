package com.captainsprep.engine.service.ingestion;

import com.captainsprep.engine.model.Document;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of ingested documents, keyed by document id. Documents are immutable so entries are
 * never replaced.
 */
@Component
public class DocumentCatalog {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Map<String, Long> ingestionOrder = new ConcurrentHashMap<>();

    public void register(Document document) {
        if (documents.putIfAbsent(document.id(), document) != null) {
            throw new IllegalStateException("Document " + document.id() + " is already registered");
        }
        ingestionOrder.put(document.id(), System.nanoTime());
    }

    public Optional<Document> find(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public List<DocumentSummary> summaries() {
        return documents.values().stream()
                .sorted((left, right) -> Long.compare(ingestionOrder.get(left.id()), ingestionOrder.get(right.id())))
                .map(document -> new DocumentSummary(document.id(), document.name(), document.chunks().size()))
                .toList();
    }
}
