package com.captainsprep.engine.service.vectorstore;

import java.util.List;
import java.util.Map;

public interface VectorStoreClient {

    void upsert(List<String> ids, List<String> texts, List<Map<String, Object>> metadata);

    /**
     * Nearest neighbours of {@code queryText}, closest first. Distances are non-negative.
     */
    List<VectorMatch> query(String queryText, int topK, MetadataFilter filter);
}
