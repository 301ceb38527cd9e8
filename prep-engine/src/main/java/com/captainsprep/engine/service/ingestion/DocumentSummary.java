package com.captainsprep.engine.service.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DocumentSummary(@JsonProperty("document_id") String documentId,
                              @JsonProperty("filename") String filename,
                              @JsonProperty("chunks_count") int chunksCount) {
}
