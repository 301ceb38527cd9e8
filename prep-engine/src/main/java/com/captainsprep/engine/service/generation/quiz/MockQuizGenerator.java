package com.captainsprep.engine.service.generation.quiz;

import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.service.generation.ItemGenerator;

import java.util.List;

/**
 * Deterministic stand-in used when no language model is configured or a call fails.
 */
public class MockQuizGenerator implements ItemGenerator<QuizQuestion> {

    static final String CORRECT_OPTION = "Discuss the issue privately with the coworker first";

    @Override
    public QuizQuestion generate(String topic, String context) {
        String subject = topic == null || topic.isBlank() ? "station life" : topic.trim();
        return new QuizQuestion(
                "When dealing with '" + subject + "' in the fire station, what is the BEST first step?",
                List.of(
                        "Immediately report to the Station Captain",
                        CORRECT_OPTION,
                        "File a formal written complaint",
                        "Ignore the situation and focus on your own work"
                ),
                CORRECT_OPTION,
                "[Mock response, configure the language model for generated questions] "
                        + "The frictionless approach resolves conflicts privately at the lowest level before escalating.",
                null
        );
    }
}
