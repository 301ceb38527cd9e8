package com.captainsprep.engine.service.generation.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Scans for balanced {@code {...}} substrings and returns the first one that parses and carries
 * every expected key. Braces inside JSON strings are ignored while balancing.
 */
public class BraceObjectStrategy implements ResponseParsingStrategy {

    private final ObjectMapper objectMapper;
    private final List<String> expectedKeys;

    public BraceObjectStrategy(ObjectMapper objectMapper, List<String> expectedKeys) {
        this.objectMapper = objectMapper;
        this.expectedKeys = List.copyOf(expectedKeys);
    }

    @Override
    public String name() {
        return "brace-object";
    }

    @Override
    public Optional<ObjectNode> parse(String response) {
        if (response == null) {
            return Optional.empty();
        }
        int from = response.indexOf('{');
        while (from >= 0) {
            int to = matchingBrace(response, from);
            if (to > from) {
                Optional<ObjectNode> parsed = JsonNodes.readObject(objectMapper, response.substring(from, to + 1))
                        .filter(this::hasExpectedKeys);
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
            from = response.indexOf('{', from + 1);
        }
        return Optional.empty();
    }

    private boolean hasExpectedKeys(ObjectNode node) {
        return expectedKeys.stream().allMatch(node::has);
    }

    private static int matchingBrace(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
