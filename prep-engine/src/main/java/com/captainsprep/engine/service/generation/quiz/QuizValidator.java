package com.captainsprep.engine.service.generation.quiz;

import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.service.generation.ParseFailureException;

public final class QuizValidator {

    private QuizValidator() {
    }

    public static QuizQuestion validate(QuizQuestion question, String rawResponse) {
        if (isBlank(question.question())) {
            throw new ParseFailureException("Quiz question is missing the question text", rawResponse);
        }
        if (question.options() == null || question.options().size() != QuizQuestion.OPTION_COUNT) {
            throw new ParseFailureException("Quiz question must have exactly " + QuizQuestion.OPTION_COUNT + " options", rawResponse);
        }
        if (question.options().stream().anyMatch(QuizValidator::isBlank)) {
            throw new ParseFailureException("Quiz question has an empty option", rawResponse);
        }
        if (!question.options().contains(question.correctAnswer())) {
            throw new ParseFailureException("Quiz correct_answer is not one of the options", rawResponse);
        }
        if (isBlank(question.explanation())) {
            throw new ParseFailureException("Quiz question is missing the explanation", rawResponse);
        }
        return question;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
