package com.captainsprep.engine.service.ingestion;

import com.captainsprep.engine.model.Chunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts text into fixed-size windows, preferring to end each window just after a sentence
 * boundary. Chunks carry their raw {@code [start, end)} span so consecutive spans overlap by at
 * most {@code overlap} characters and together cover the whole text.
 */
@Component
public class SentenceBoundaryTextChunker implements TextChunker {

    private static final List<String> SENTENCE_BOUNDARIES = List.of(". ", ".\n", "! ", "? ");

    private final int chunkSize;
    private final int overlap;

    public SentenceBoundaryTextChunker(@Value("${prep.ingest.chunk-size:1000}") int chunkSize,
                                       @Value("${prep.ingest.overlap:200}") int overlap) {
        validate(chunkSize, overlap);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    @Override
    public List<Chunk> chunk(String text) {
        return chunk(text, chunkSize, overlap);
    }

    @Override
    public List<Chunk> chunk(String text, int chunkSize, int overlap) {
        validate(chunkSize, overlap);
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        int length = text.length();
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = start + chunkSize;
            if (end < length) {
                end = boundaryCut(text, start, end, overlap);
            } else {
                end = length;
            }
            String chunkText = text.substring(start, end).trim();
            if (!chunkText.isEmpty()) {
                chunks.add(new Chunk(null, chunks.size(), start, end, chunkText));
            }
            if (end >= length) {
                break;
            }
            start = end - overlap;
        }
        return List.copyOf(chunks);
    }

    private int boundaryCut(String text, int start, int rawEnd, int overlap) {
        String window = text.substring(start, rawEnd);
        int best = -1;
        for (String boundary : SENTENCE_BOUNDARIES) {
            int position = window.lastIndexOf(boundary);
            if (position >= 0) {
                best = Math.max(best, position + boundary.length());
            }
        }
        // a cut this close to the window start would not move the next window forward
        if (best <= overlap) {
            return rawEnd;
        }
        return start + best;
    }

    private static void validate(int chunkSize, int overlap) {
        if (overlap < 0 || chunkSize <= overlap) {
            throw new IllegalArgumentException("chunk size must exceed overlap and overlap must be non-negative (chunkSize="
                    + chunkSize + ", overlap=" + overlap + ")");
        }
    }
}
