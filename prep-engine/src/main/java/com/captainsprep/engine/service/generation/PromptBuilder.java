package com.captainsprep.engine.service.generation;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the user side of a prompt from a task description, a reference context block,
 * optional few-shot examples and an output instruction. Oversized context is cut at
 * {@code maxContextChars} and marked with {@value #TRIMMED_MARKER}.
 */
public final class PromptBuilder {

    public static final String TRIMMED_MARKER = "...[TRIMMED]";

    public static final String JSON_ONLY_INSTRUCTION =
            "CRITICAL: Return exactly one valid JSON object. No markdown, no prose before or after it.";

    private final int maxContextChars;
    private String task;
    private String contextHeading = "REFERENCE MATERIAL:";
    private String context;
    private String emptyContextNote;
    private String examples;
    private final List<String> instructions = new ArrayList<>();

    private PromptBuilder(int maxContextChars) {
        if (maxContextChars <= 0) {
            throw new IllegalArgumentException("maxContextChars must be positive");
        }
        this.maxContextChars = maxContextChars;
    }

    public static PromptBuilder withContextLimit(int maxContextChars) {
        return new PromptBuilder(maxContextChars);
    }

    public static String trimContext(String context, int maxContextChars) {
        if (context == null) {
            return "";
        }
        if (context.length() <= maxContextChars) {
            return context;
        }
        return context.substring(0, maxContextChars) + TRIMMED_MARKER;
    }

    public PromptBuilder task(String value) {
        this.task = value;
        return this;
    }

    public PromptBuilder context(String heading, String value, String whenEmpty) {
        this.contextHeading = heading;
        this.context = value;
        this.emptyContextNote = whenEmpty;
        return this;
    }

    public PromptBuilder examples(String value) {
        this.examples = value;
        return this;
    }

    public PromptBuilder instruction(String value) {
        if (value != null && !value.isBlank()) {
            instructions.add(value);
        }
        return this;
    }

    public PromptBuilder jsonOnly(String schemaExample) {
        instructions.add(JSON_ONLY_INSTRUCTION + "\n" + schemaExample);
        return this;
    }

    public String build() {
        StringBuilder builder = new StringBuilder();
        if (task != null && !task.isBlank()) {
            builder.append(task.trim()).append("\n\n");
        }
        String trimmed = trimContext(context, maxContextChars);
        if (!trimmed.isBlank()) {
            builder.append(contextHeading).append('\n').append(trimmed).append("\n\n");
        } else if (emptyContextNote != null) {
            builder.append(contextHeading).append('\n').append(emptyContextNote).append("\n\n");
        }
        if (examples != null && !examples.isBlank()) {
            builder.append(examples.trim()).append("\n\n");
        }
        for (String instruction : instructions) {
            builder.append(instruction.trim()).append("\n\n");
        }
        return builder.toString().trim();
    }
}
