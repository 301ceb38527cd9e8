package com.captainsprep.engine.service.vectorstore;

import java.util.List;

public interface EmbeddingsClient {

    EmbeddingBatch embed(List<String> texts);

    record EmbeddingBatch(List<List<Double>> vectors, String model, int dimensions) {}
}
