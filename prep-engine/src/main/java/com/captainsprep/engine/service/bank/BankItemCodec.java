package com.captainsprep.engine.service.bank;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.model.ReviewGrade;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

class BankItemCodec {

    private final ObjectMapper objectMapper;

    BankItemCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(GeneratedItem item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bank item", e);
        }
    }

    GeneratedItem read(ContentKind kind, String json) {
        try {
            return objectMapper.readValue(json, typeOf(kind));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored " + kind + " item", e);
        }
    }

    private static Class<? extends GeneratedItem> typeOf(ContentKind kind) {
        return switch (kind) {
            case QUIZ_QUESTION -> QuizQuestion.class;
            case FLASHCARD -> Flashcard.class;
            case REVIEW_GRADE -> ReviewGrade.class;
        };
    }
}
