package com.captainsprep.engine.model;

public enum ContentKind {
    QUIZ_QUESTION,
    FLASHCARD,
    REVIEW_GRADE
}
