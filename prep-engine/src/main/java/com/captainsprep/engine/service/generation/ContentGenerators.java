package com.captainsprep.engine.service.generation;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.model.QuizQuestion;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The orchestrators for every content kind, wired against one text generation backend (or
 * none, in which case every orchestrator answers from its mock producer).
 */
public class ContentGenerators {

    private final TextGenerator textGenerator;
    private final GenerationOrchestrator<QuizQuestion> quiz;
    private final GenerationOrchestrator<String> tutor;
    private final Map<CardType, GenerationOrchestrator<Flashcard>> flashcards;

    public ContentGenerators(TextGenerator textGenerator,
                             GenerationOrchestrator<QuizQuestion> quiz,
                             GenerationOrchestrator<String> tutor,
                             Map<CardType, GenerationOrchestrator<Flashcard>> flashcards) {
        this.textGenerator = textGenerator;
        this.quiz = quiz;
        this.tutor = tutor;
        this.flashcards = new EnumMap<>(flashcards);
        for (CardType type : CardType.values()) {
            if (!this.flashcards.containsKey(type)) {
                throw new IllegalArgumentException("Missing flashcard generator for " + type.code());
            }
        }
    }

    public Optional<TextGenerator> textGenerator() {
        return Optional.ofNullable(textGenerator);
    }

    public boolean mockMode() {
        return textGenerator == null;
    }

    public GenerationOrchestrator<QuizQuestion> quiz() {
        return quiz;
    }

    public GenerationOrchestrator<String> tutor() {
        return tutor;
    }

    public GenerationOrchestrator<Flashcard> flashcards(CardType cardType) {
        return flashcards.get(cardType);
    }
}
