package com.captainsprep.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record QuizQuestion(
        @JsonProperty("question") String question,
        @JsonProperty("options") List<String> options,
        @JsonProperty("correct_answer") String correctAnswer,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("subject") String subject
) implements GeneratedItem {

    public static final int OPTION_COUNT = 4;

    public QuizQuestion {
        options = options == null ? null : Collections.unmodifiableList(new ArrayList<>(options));
    }

    public QuizQuestion withSubject(String value) {
        return new QuizQuestion(question, options, correctAnswer, explanation, value);
    }

    @Override
    @JsonIgnore
    public ContentKind kind() {
        return ContentKind.QUIZ_QUESTION;
    }

    @Override
    @JsonIgnore
    public String front() {
        return question;
    }

    @Override
    @JsonIgnore
    public String back() {
        return explanation;
    }

    @Override
    @JsonIgnore
    public String itemType() {
        return "multiple_choice";
    }
}
