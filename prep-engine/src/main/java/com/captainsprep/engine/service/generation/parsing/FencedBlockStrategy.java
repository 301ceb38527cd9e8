package com.captainsprep.engine.service.generation.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the body of the first Markdown code fence, with or without a {@code json} tag.
 */
public class FencedBlockStrategy implements ResponseParsingStrategy {

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*([\\s\\S]*?)\\s*```");

    private final ObjectMapper objectMapper;

    public FencedBlockStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "fenced-block";
    }

    @Override
    public Optional<ObjectNode> parse(String response) {
        if (response == null || !response.contains("```")) {
            return Optional.empty();
        }
        Matcher matcher = FENCE.matcher(response);
        while (matcher.find()) {
            Optional<ObjectNode> parsed = JsonNodes.readObject(objectMapper, matcher.group(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }
}
