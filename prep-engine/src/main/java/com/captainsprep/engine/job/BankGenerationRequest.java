package com.captainsprep.engine.job;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.ContentKind;

import java.util.List;

public record BankGenerationRequest(ContentKind kind,
                                    List<String> subjects,
                                    List<CardType> cardTypes,
                                    int countPerCombination,
                                    boolean dryRun) {

    public BankGenerationRequest {
        if (kind != ContentKind.QUIZ_QUESTION && kind != ContentKind.FLASHCARD) {
            throw new IllegalArgumentException("Bank generation supports quiz questions and flashcards, not " + kind);
        }
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("At least one subject is required");
        }
        if (countPerCombination <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
        subjects = List.copyOf(subjects);
        cardTypes = cardTypes == null || cardTypes.isEmpty() ? List.of(CardType.values()) : List.copyOf(cardTypes);
    }
}
