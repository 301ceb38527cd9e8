package com.captainsprep.engine.service.retrieval;

import com.captainsprep.engine.model.Citation;
import com.captainsprep.engine.model.RetrievalContext;
import com.captainsprep.engine.model.RetrievedChunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns ranked retrieval results into a prompt-ready context block. Citation numbers follow the
 * retriever's ranking, starting at 1, and each chunk appears in the context as {@code [n] text}.
 */
@Service
public class RagContextService {

    static final String ELLIPSIS = "...";

    private final Retriever retriever;
    private final int defaultTopK;
    private final int excerptLength;

    public RagContextService(Retriever retriever,
                             @Value("${prep.rag.top-k:5}") int defaultTopK,
                             @Value("${prep.rag.excerpt-length:200}") int excerptLength) {
        this.retriever = retriever;
        this.defaultTopK = Math.max(1, defaultTopK);
        this.excerptLength = Math.max(1, excerptLength);
    }

    public List<RetrievedChunk> retrieve(String query, Set<String> scope, int topK) {
        return retriever.retrieve(query, scope, topK);
    }

    public RetrievalContext buildContext(String query, Set<String> scope) {
        return buildContext(query, scope, defaultTopK);
    }

    public RetrievalContext buildContext(String query, Set<String> scope, int topK) {
        return assemble(retriever.retrieve(query, scope, topK));
    }

    public RetrievalContext assemble(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return RetrievalContext.empty();
        }
        List<String> parts = new ArrayList<>();
        List<Citation> citations = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            int number = i + 1;
            parts.add("[" + number + "] " + chunk.text());
            citations.add(new Citation(number, chunk.source(), excerpt(chunk.text()), chunk.score()));
        }
        return new RetrievalContext(String.join("\n\n", parts), citations);
    }

    private String excerpt(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= excerptLength) {
            return text;
        }
        return text.substring(0, excerptLength) + ELLIPSIS;
    }
}
