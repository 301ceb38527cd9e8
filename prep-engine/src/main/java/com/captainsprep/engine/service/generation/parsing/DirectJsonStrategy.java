package com.captainsprep.engine.service.generation.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

public class DirectJsonStrategy implements ResponseParsingStrategy {

    private final ObjectMapper objectMapper;

    public DirectJsonStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "direct-json";
    }

    @Override
    public Optional<ObjectNode> parse(String response) {
        return JsonNodes.readObject(objectMapper, response);
    }
}
