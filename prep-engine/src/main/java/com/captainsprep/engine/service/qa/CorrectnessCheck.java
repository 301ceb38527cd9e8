package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;

import java.util.List;
import java.util.Optional;

public class CorrectnessCheck implements QaCheck {

    @Override
    public String name() {
        return "Correctness";
    }

    @Override
    public Optional<QaIssue> check(GeneratedItem candidate, List<? extends GeneratedItem> pool) {
        if (!(candidate instanceof QuizQuestion quiz)) {
            return Optional.empty();
        }
        if (quiz.options() == null || !quiz.options().contains(quiz.correctAnswer())) {
            return issue("answer not in options");
        }
        return Optional.empty();
    }
}
