package com.captainsprep.engine.service.generation.flashcard;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.service.generation.ItemGenerator;

public class MockFlashcardGenerator implements ItemGenerator<Flashcard> {

    private static final String SOURCE = "Mock Response";

    private final CardType cardType;

    public MockFlashcardGenerator(CardType cardType) {
        this.cardType = cardType;
    }

    @Override
    public Flashcard generate(String topic, String context) {
        String subject = topic == null || topic.isBlank() ? "fire service" : topic.trim();
        return switch (cardType) {
            case TERM_DEFINITION -> new Flashcard(
                    "Chain of command (" + subject + ")",
                    "The order of authority through which orders flow and issues are escalated, starting at the lowest level.",
                    null, SOURCE, topic, cardType);
            case SCENARIO_ACTION -> new Flashcard(
                    "A crew member on your shift keeps leaving " + subject + " chores for others to finish.",
                    "Talk with them privately first and offer to work through the chores together before involving a supervisor.",
                    null, SOURCE, topic, cardType);
            case FILL_BLANK -> new Flashcard(
                    "A standard 200 foot pre-connect is made of ___ sections of 50 foot hose (" + subject + ").",
                    "Four sections, because 200 divided by 50 equals 4.",
                    null, SOURCE, topic, cardType);
        };
    }
}
