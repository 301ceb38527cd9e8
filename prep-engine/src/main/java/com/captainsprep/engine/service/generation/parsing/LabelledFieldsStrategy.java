package com.captainsprep.engine.service.generation.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code LABEL: value} lines. A value continues over following unlabelled lines until the
 * next known label. Succeeds only when every required field was found with a non-blank value.
 */
public class LabelledFieldsStrategy implements ResponseParsingStrategy {

    private final ObjectMapper objectMapper;
    private final Map<String, String> labelToField;
    private final List<String> requiredFields;

    public LabelledFieldsStrategy(ObjectMapper objectMapper, Map<String, String> labelToField, List<String> requiredFields) {
        this.objectMapper = objectMapper;
        Map<String, String> normalised = new LinkedHashMap<>();
        labelToField.forEach((label, field) -> normalised.put(label.toUpperCase(Locale.ROOT), field));
        this.labelToField = Map.copyOf(normalised);
        this.requiredFields = List.copyOf(requiredFields);
    }

    @Override
    public String name() {
        return "labelled-fields";
    }

    @Override
    public Optional<ObjectNode> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        String currentField = null;
        List<String> currentContent = new ArrayList<>();
        for (String rawLine : response.strip().split("\\r?\\n")) {
            String line = stripMarkup(rawLine);
            String field = labelledField(line);
            if (field != null) {
                flush(values, currentField, currentContent);
                currentField = field;
                currentContent = new ArrayList<>();
                currentContent.add(line.substring(line.indexOf(':') + 1).trim());
            } else if (currentField != null && !line.isBlank()) {
                currentContent.add(line.trim());
            }
        }
        flush(values, currentField, currentContent);
        boolean complete = requiredFields.stream().allMatch(field -> values.containsKey(field) && !values.get(field).isBlank());
        if (!complete) {
            return Optional.empty();
        }
        ObjectNode node = objectMapper.createObjectNode();
        values.forEach(node::put);
        return Optional.of(node);
    }

    private String labelledField(String line) {
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        return labelToField.get(line.substring(0, colon).trim().toUpperCase(Locale.ROOT));
    }

    private static void flush(Map<String, String> values, String field, List<String> content) {
        if (field != null) {
            values.put(field, String.join(" ", content).trim());
        }
    }

    private static String stripMarkup(String line) {
        return line.replace("**", "").trim();
    }
}
