package com.captainsprep.engine.service.ingestion;

import com.captainsprep.engine.model.Chunk;

import java.util.List;

public interface TextChunker {

    List<Chunk> chunk(String text);

    List<Chunk> chunk(String text, int chunkSize, int overlap);
}
