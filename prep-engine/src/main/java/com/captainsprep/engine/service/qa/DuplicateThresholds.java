package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.ContentKind;

public record DuplicateThresholds(double quiz, double flashcard, double review) {

    public static final DuplicateThresholds DEFAULTS = new DuplicateThresholds(0.85, 0.80, 0.92);

    public DuplicateThresholds {
        validate(quiz);
        validate(flashcard);
        validate(review);
    }

    public double forKind(ContentKind kind) {
        return switch (kind) {
            case QUIZ_QUESTION -> quiz;
            case FLASHCARD -> flashcard;
            case REVIEW_GRADE -> review;
        };
    }

    private static void validate(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Duplicate threshold must be in (0, 1]: " + threshold);
        }
    }
}
