package com.captainsprep.engine.model;

import java.util.List;

public record Document(String id,
                       String name,
                       List<Chunk> chunks) {

    public Document {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }
}
