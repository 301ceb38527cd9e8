package com.captainsprep.engine.service.generation.parsing;

import com.captainsprep.engine.service.generation.ParseFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tries each strategy in order and returns the first object recovered.
 */
public class StructuredResponseParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredResponseParser.class);

    private static final int EXCERPT_LENGTH = 200;

    private final List<ResponseParsingStrategy> strategies;

    public StructuredResponseParser(List<ResponseParsingStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one parsing strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Direct JSON, then fenced block, then the first brace-delimited object holding
     * {@code expectedKeys}.
     */
    public static StructuredResponseParser forJson(ObjectMapper objectMapper, List<String> expectedKeys) {
        return new StructuredResponseParser(jsonStrategies(objectMapper, expectedKeys));
    }

    /**
     * The JSON cascade followed by {@code LABEL: value} lines.
     */
    public static StructuredResponseParser forJsonOrLabels(ObjectMapper objectMapper,
                                                          List<String> expectedKeys,
                                                          Map<String, String> labelToField) {
        List<ResponseParsingStrategy> strategies = new ArrayList<>(jsonStrategies(objectMapper, expectedKeys));
        strategies.add(new LabelledFieldsStrategy(objectMapper, labelToField, expectedKeys));
        return new StructuredResponseParser(strategies);
    }

    private static List<ResponseParsingStrategy> jsonStrategies(ObjectMapper objectMapper, List<String> expectedKeys) {
        return List.of(
                new DirectJsonStrategy(objectMapper),
                new FencedBlockStrategy(objectMapper),
                new BraceObjectStrategy(objectMapper, expectedKeys)
        );
    }

    public ObjectNode parse(String response) {
        for (ResponseParsingStrategy strategy : strategies) {
            Optional<ObjectNode> parsed = strategy.parse(response);
            if (parsed.isPresent()) {
                log.debug("Parsed model response with strategy {}", strategy.name());
                return parsed.get();
            }
        }
        throw new ParseFailureException("Could not parse structured output from response: " + excerpt(response), response);
    }

    private static String excerpt(String response) {
        if (response == null) {
            return "<null>";
        }
        return response.length() <= EXCERPT_LENGTH ? response : response.substring(0, EXCERPT_LENGTH);
    }
}
