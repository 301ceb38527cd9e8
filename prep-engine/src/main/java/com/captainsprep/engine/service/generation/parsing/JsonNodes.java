package com.captainsprep.engine.service.generation.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

final class JsonNodes {

    private JsonNodes() {
    }

    static Optional<ObjectNode> readObject(ObjectMapper objectMapper, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate.trim());
            if (node instanceof ObjectNode object) {
                return Optional.of(object);
            }
            if (node != null && node.isArray() && node.size() > 0 && node.get(0) instanceof ObjectNode first) {
                return Optional.of(first);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
