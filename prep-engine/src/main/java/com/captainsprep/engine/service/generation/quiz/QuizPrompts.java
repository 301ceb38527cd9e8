package com.captainsprep.engine.service.generation.quiz;

final class QuizPrompts {

    static final String SYSTEM_INSTRUCTION = """
            You are a veteran Fire Captain and test designer creating original exam questions
            that help candidates pass written firefighter exams.

            QUESTION GENERATION RULES:
            1. Create ORIGINAL questions. Use the provided material as a style reference only:
               vary the numbers, swap equipment types, change the scenario and the names.
               Do not copy questions verbatim from the reference material.
            2. Human Relations: the correct answer resolves issues privately at the lowest level.
            3. Math: use round numbers that work without a calculator.
            4. Subject areas: Human Relations, Mechanical Aptitude, Reading Ability, Math.
            5. Return ONLY valid JSON with keys question, options (list of 4), correct_answer, explanation.
            """;

    static final String SCHEMA_EXAMPLE =
            "{\"question\": \"...\", \"options\": [\"A\", \"B\", \"C\", \"D\"], \"correct_answer\": \"...\", \"explanation\": \"...\"}";

    private QuizPrompts() {
    }

    static String task(String topic) {
        return "Based on the following Fire Service manual text, generate a challenging multiple-choice question about '"
                + topic + "'.";
    }
}
