package com.captainsprep.engine.service.vectorstore;

import java.util.Map;

public record VectorMatch(String text, Map<String, Object> metadata, Double distance) {

    public VectorMatch {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
