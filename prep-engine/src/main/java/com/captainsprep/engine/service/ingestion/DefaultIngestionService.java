package com.captainsprep.engine.service.ingestion;

import com.captainsprep.engine.model.Chunk;
import com.captainsprep.engine.model.Document;
import com.captainsprep.engine.service.vectorstore.VectorStoreClient;
import com.captainsprep.engine.service.vectorstore.VectorStoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    public static final String DOCUMENT_ID = "document_id";
    public static final String FILENAME = "filename";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String START_CHAR = "start_char";
    public static final String END_CHAR = "end_char";

    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final VectorStoreClient vectorStoreClient;
    private final DocumentCatalog catalog;
    private final MeterRegistry meterRegistry;
    private final Counter ingestionCounter;
    private final Timer ingestionTimer;

    public DefaultIngestionService(DocumentTextExtractor textExtractor,
                                   TextChunker textChunker,
                                   VectorStoreClient vectorStoreClient,
                                   DocumentCatalog catalog,
                                   MeterRegistry meterRegistry) {
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.vectorStoreClient = vectorStoreClient;
        this.catalog = catalog;
        this.meterRegistry = meterRegistry;
        this.ingestionCounter = meterRegistry.counter("prep.ingest.documents");
        this.ingestionTimer = meterRegistry.timer("prep.ingest.duration");
    }

    @Override
    public Document ingestDocument(IngestDocumentCommand command) {
        if (command == null || command.bytes() == null || command.bytes().length == 0) {
            throw new IngestionException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
        }
        DocumentTextExtractor.ExtractedDocument extracted;
        try (InputStream inputStream = new ByteArrayInputStream(command.bytes())) {
            extracted = textExtractor.extract(command.filename(), inputStream);
        } catch (IOException e) {
            throw new IngestionException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read uploaded file", e);
        }
        String name = command.filename() == null || command.filename().isBlank() ? extracted.title() : command.filename();
        return ingestInternal(name, extracted.text());
    }

    @Override
    public Document ingestText(IngestTextCommand command) {
        if (command == null || command.text() == null || command.text().isBlank()) {
            throw new IngestionException(HttpStatus.BAD_REQUEST, "Text payload must not be empty");
        }
        String name = command.name() == null || command.name().isBlank() ? "Document" : command.name().trim();
        return ingestInternal(name, command.text());
    }

    @Override
    public List<DocumentSummary> listDocuments() {
        return catalog.summaries();
    }

    private Document ingestInternal(String name, String text) {
        if (text == null || text.isBlank()) {
            throw new IngestionException(HttpStatus.BAD_REQUEST, "No content was extracted from the document");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            String documentId = UUID.randomUUID().toString();
            List<Chunk> chunks = textChunker.chunk(text).stream()
                    .map(chunk -> chunk.withDocumentId(documentId))
                    .toList();
            index(documentId, name, chunks);
            Document document = new Document(documentId, name, chunks);
            catalog.register(document);
            ingestionCounter.increment();
            log.info("Ingested document {} ({}) with {} chunks", documentId, name, chunks.size());
            return document;
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    private void index(String documentId, String name, List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<String> ids = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Map<String, Object>> metadata = new ArrayList<>();
        for (Chunk chunk : chunks) {
            ids.add(documentId + "_chunk_" + chunk.index());
            texts.add(chunk.text());
            metadata.add(Map.of(
                    DOCUMENT_ID, documentId,
                    FILENAME, name,
                    CHUNK_INDEX, chunk.index(),
                    START_CHAR, chunk.start(),
                    END_CHAR, chunk.end()
            ));
        }
        try {
            vectorStoreClient.upsert(ids, texts, metadata);
        } catch (VectorStoreException e) {
            throw new IngestionException(HttpStatus.BAD_GATEWAY, "Failed to index document chunks", e);
        }
    }
}
