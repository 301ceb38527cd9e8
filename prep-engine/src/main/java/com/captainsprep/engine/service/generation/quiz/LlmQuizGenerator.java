package com.captainsprep.engine.service.generation.quiz;

import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.service.generation.ItemGenerator;
import com.captainsprep.engine.service.generation.PromptBuilder;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.generation.TextPrompt;
import com.captainsprep.engine.service.generation.parsing.StructuredResponseParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

public class LlmQuizGenerator implements ItemGenerator<QuizQuestion> {

    static final List<String> EXPECTED_KEYS = List.of("question", "options");

    private final TextGenerator textGenerator;
    private final FewShotExampleLibrary examples;
    private final StructuredResponseParser parser;
    private final int maxContextChars;
    private final double temperature;
    private final int maxTokens;

    public LlmQuizGenerator(TextGenerator textGenerator,
                            FewShotExampleLibrary examples,
                            ObjectMapper objectMapper,
                            int maxContextChars,
                            double temperature,
                            int maxTokens) {
        this.textGenerator = textGenerator;
        this.examples = examples;
        this.parser = StructuredResponseParser.forJson(objectMapper, EXPECTED_KEYS);
        this.maxContextChars = maxContextChars;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public QuizQuestion generate(String topic, String context) {
        String userPrompt = PromptBuilder.withContextLimit(maxContextChars)
                .task(QuizPrompts.task(topic))
                .context("MANUAL TEXT:", context, null)
                .examples(examples == null ? null : examples.examplesFor(topic))
                .jsonOnly(QuizPrompts.SCHEMA_EXAMPLE)
                .build();
        String response = textGenerator.generate(new TextPrompt(QuizPrompts.SYSTEM_INSTRUCTION, userPrompt, temperature, maxTokens));
        ObjectNode node = parser.parse(response);
        return QuizValidator.validate(toQuestion(node), response);
    }

    private static QuizQuestion toQuestion(ObjectNode node) {
        List<String> options = null;
        JsonNode optionsNode = node.get("options");
        if (optionsNode != null && optionsNode.isArray()) {
            options = new ArrayList<>();
            for (JsonNode option : optionsNode) {
                options.add(option.asText().trim());
            }
        }
        return new QuizQuestion(
                text(node, "question"),
                options,
                text(node, "correct_answer"),
                text(node, "explanation"),
                text(node, "subject")
        );
    }

    private static String text(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText().trim();
    }
}
