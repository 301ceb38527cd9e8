package com.captainsprep.engine.service.ingestion;

public record IngestDocumentCommand(String filename, byte[] bytes) {
}
