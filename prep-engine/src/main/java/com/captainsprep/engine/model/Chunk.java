package com.captainsprep.engine.model;

/**
 * A segment of a document's text. {@code start} and {@code end} delimit the half-open span
 * the chunk was cut from; {@code text} is that span trimmed.
 */
public record Chunk(String documentId,
                    int index,
                    int start,
                    int end,
                    String text) {

    public Chunk withDocumentId(String value) {
        return new Chunk(value, index, start, end, text);
    }
}
