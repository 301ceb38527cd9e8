package com.captainsprep.engine.service.generation.flashcard;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.service.generation.ItemGenerator;
import com.captainsprep.engine.service.generation.ParseFailureException;
import com.captainsprep.engine.service.generation.PromptBuilder;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.generation.TextPrompt;
import com.captainsprep.engine.service.generation.parsing.StructuredResponseParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Generates one flashcard of a fixed card type. {@code topic} selects the subject template.
 * Responses may be JSON or the labelled-line format the templates ask for.
 */
public class LlmFlashcardGenerator implements ItemGenerator<Flashcard> {

    static final String FRONT = "front_content";
    static final String BACK = "back_content";

    private static final String SYSTEM_INSTRUCTION =
            "You are a veteran Fire Captain writing concise study flashcards for firefighter exam candidates.";

    private final TextGenerator textGenerator;
    private final FlashcardPromptCatalog catalog;
    private final CardType cardType;
    private final StructuredResponseParser parser;
    private final int maxContextChars;
    private final double temperature;
    private final int maxTokens;

    public LlmFlashcardGenerator(TextGenerator textGenerator,
                                 FlashcardPromptCatalog catalog,
                                 ObjectMapper objectMapper,
                                 CardType cardType,
                                 int maxContextChars,
                                 double temperature,
                                 int maxTokens) {
        this.textGenerator = textGenerator;
        this.catalog = catalog;
        this.cardType = cardType;
        this.parser = StructuredResponseParser.forJsonOrLabels(objectMapper, List.of(FRONT, BACK), labels(cardType));
        this.maxContextChars = maxContextChars;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public CardType cardType() {
        return cardType;
    }

    @Override
    public Flashcard generate(String topic, String context) {
        String userPrompt = PromptBuilder.withContextLimit(maxContextChars)
                .task(catalog.template(cardType, topic))
                .context("REFERENCE MATERIAL:", context, null)
                .build();
        String response = textGenerator.generate(new TextPrompt(SYSTEM_INSTRUCTION, userPrompt, temperature, maxTokens));
        ObjectNode node = parser.parse(response);
        String front = text(node, FRONT);
        String back = text(node, BACK);
        if (front == null || front.isBlank() || back == null || back.isBlank()) {
            throw new ParseFailureException("Flashcard is missing its front or back", response);
        }
        return new Flashcard(front, back, text(node, "hint"), text(node, "source"), topic, cardType);
    }

    static Map<String, String> labels(CardType cardType) {
        return Map.of(
                cardType.frontLabel(), FRONT,
                cardType.backLabel(), BACK,
                "HINT", "hint",
                "SOURCE", "source"
        );
    }

    private static String text(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText().trim();
    }
}
