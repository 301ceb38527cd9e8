package com.captainsprep.engine.service.ingestion;

public record IngestTextCommand(String name, String text) {
}
