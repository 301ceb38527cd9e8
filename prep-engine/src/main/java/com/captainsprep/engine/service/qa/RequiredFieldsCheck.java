package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.model.ReviewGrade;

import java.util.List;
import java.util.Optional;

public class RequiredFieldsCheck implements QaCheck {

    @Override
    public String name() {
        return "Required Fields";
    }

    @Override
    public Optional<QaIssue> check(GeneratedItem candidate, List<? extends GeneratedItem> pool) {
        if (candidate instanceof QuizQuestion quiz) {
            return checkQuiz(quiz);
        }
        if (candidate instanceof Flashcard card) {
            if (card.cardType() == null) {
                return issue("Missing card type");
            }
            return firstMissing("front_content", card.frontContent(), "back_content", card.backContent());
        }
        if (candidate instanceof ReviewGrade review) {
            if (review.grade() == null || !ReviewGrade.GRADES.contains(review.grade())) {
                return issue("Invalid grade: " + review.grade());
            }
            return firstMissing("question", review.question(), "feedback", review.feedback(),
                    "textbook_answer", review.textbookAnswer());
        }
        return issue("Unsupported item: " + (candidate == null ? "null" : candidate.getClass().getSimpleName()));
    }

    private Optional<QaIssue> checkQuiz(QuizQuestion quiz) {
        Optional<QaIssue> missing = firstMissing("question", quiz.question(), "correct_answer", quiz.correctAnswer(),
                "explanation", quiz.explanation());
        if (missing.isPresent()) {
            return missing;
        }
        if (quiz.options() == null || quiz.options().size() != QuizQuestion.OPTION_COUNT) {
            int count = quiz.options() == null ? 0 : quiz.options().size();
            return issue("options must contain " + QuizQuestion.OPTION_COUNT + " entries, found " + count);
        }
        if (quiz.options().stream().anyMatch(option -> option == null || option.isBlank())) {
            return issue("Missing or empty field: options");
        }
        return Optional.empty();
    }

    private Optional<QaIssue> firstMissing(String... namesAndValues) {
        for (int i = 0; i < namesAndValues.length; i += 2) {
            String value = namesAndValues[i + 1];
            if (value == null || value.isBlank()) {
                return issue("Missing or empty field: " + namesAndValues[i]);
            }
        }
        return Optional.empty();
    }
}
