package com.captainsprep.engine.service.ingestion;

import com.captainsprep.engine.model.Document;

import java.util.List;

public interface IngestionService {

    Document ingestDocument(IngestDocumentCommand command);

    Document ingestText(IngestTextCommand command);

    List<DocumentSummary> listDocuments();
}
