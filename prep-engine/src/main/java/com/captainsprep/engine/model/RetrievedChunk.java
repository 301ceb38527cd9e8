package com.captainsprep.engine.model;

public record RetrievedChunk(
        String documentId,
        String source,
        int chunkIndex,
        String text,
        Double score
) {
}
