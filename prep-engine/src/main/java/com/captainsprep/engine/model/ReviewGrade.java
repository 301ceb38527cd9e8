package com.captainsprep.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public record ReviewGrade(
        @JsonProperty("question") String question,
        @JsonProperty("grade") String grade,
        @JsonProperty("feedback") String feedback,
        @JsonProperty("textbook_answer") String textbookAnswer,
        @JsonProperty("citations") List<Citation> citations
) implements GeneratedItem {

    public static final Set<String> GRADES = Set.of("correct", "partial", "incorrect");

    public ReviewGrade {
        grade = grade == null ? null : grade.trim().toLowerCase(Locale.ROOT);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public ReviewGrade withCitations(List<Citation> value) {
        return new ReviewGrade(question, grade, feedback, textbookAnswer, value);
    }

    @Override
    @JsonIgnore
    public ContentKind kind() {
        return ContentKind.REVIEW_GRADE;
    }

    @Override
    @JsonIgnore
    public String front() {
        return question;
    }

    @Override
    @JsonIgnore
    public String back() {
        return textbookAnswer;
    }

    @Override
    @JsonIgnore
    public String subject() {
        return null;
    }

    @Override
    @JsonIgnore
    public String itemType() {
        return grade;
    }
}
