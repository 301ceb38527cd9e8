package com.captainsprep.engine.service.retrieval;

import com.captainsprep.engine.model.RetrievedChunk;

import java.util.List;
import java.util.Set;

public interface Retriever {

    /**
     * Chunks relevant to {@code query}, best first.
     *
     * @param scope document ids to search within; {@code null} searches every document and an
     *              empty set matches nothing
     */
    List<RetrievedChunk> retrieve(String query, Set<String> scope, int topK);
}
