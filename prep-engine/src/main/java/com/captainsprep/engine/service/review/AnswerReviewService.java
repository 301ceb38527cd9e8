package com.captainsprep.engine.service.review;

import com.captainsprep.engine.model.RetrievalContext;
import com.captainsprep.engine.model.ReviewGrade;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.generation.GenerationUnavailableException;
import com.captainsprep.engine.service.generation.ParseFailureException;
import com.captainsprep.engine.service.generation.PromptBuilder;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.generation.TextPrompt;
import com.captainsprep.engine.service.generation.parsing.StructuredResponseParser;
import com.captainsprep.engine.service.retrieval.RagContextService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Grades a candidate's free-text answer against retrieved training material. Output that cannot
 * be parsed is returned as an {@code incorrect} grade carrying the raw text as feedback.
 */
@Service
public class AnswerReviewService {

    private static final Logger log = LoggerFactory.getLogger(AnswerReviewService.class);

    static final String FALLBACK_TEXTBOOK_ANSWER = "Please check the source materials for the correct answer.";
    static final String UNAVAILABLE_FEEDBACK =
            "[Mock response, configure the language model for graded feedback] Compare your answer with the cited material below.";

    private static final String PREAMBLE = """
            You are a veteran Fire Captain with 20 years of experience helping a firefighter candidate
            prepare for their written certification exam. Grade the candidate's answer and give
            constructive feedback.

            RULES:
            1. ONLY use information from the provided context.
            2. Be encouraging but accurate.
            3. Grade as "correct", "partial", or "incorrect".
            4. Say what was good and what was missing.
            5. Always provide the textbook-correct answer.""";

    private static final String SCHEMA_EXAMPLE =
            "{\"grade\": \"correct | partial | incorrect\", \"feedback\": \"...\", \"textbook_answer\": \"...\"}";

    private final ContentGenerators generators;
    private final RagContextService ragContextService;
    private final StructuredResponseParser parser;
    private final int topK;
    private final int maxContextChars;
    private final double temperature;
    private final int maxTokens;

    public AnswerReviewService(ContentGenerators generators,
                               RagContextService ragContextService,
                               ObjectMapper objectMapper,
                               @Value("${prep.review.top-k:5}") int topK,
                               @Value("${prep.generation.max-context-chars:8000}") int maxContextChars,
                               @Value("${prep.review.temperature:0.3}") double temperature,
                               @Value("${prep.llm.max-output-tokens:1024}") int maxTokens) {
        this.generators = generators;
        this.ragContextService = ragContextService;
        this.parser = StructuredResponseParser.forJson(objectMapper, List.of("grade", "feedback"));
        this.topK = Math.max(1, topK);
        this.maxContextChars = maxContextChars;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public ReviewGrade review(String question, String userAnswer, Set<String> scope) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        String answer = userAnswer == null ? "" : userAnswer.trim();
        RetrievalContext context = ragContextService.buildContext(question + " " + answer, scope, topK);
        ReviewGrade grade = grade(question.trim(), answer, context.context());
        return grade.withCitations(context.citations());
    }

    private ReviewGrade grade(String question, String answer, String context) {
        TextGenerator textGenerator = generators.textGenerator().orElse(null);
        if (textGenerator == null) {
            return new ReviewGrade(question, "partial", UNAVAILABLE_FEEDBACK, FALLBACK_TEXTBOOK_ANSWER, List.of());
        }
        String prompt = PromptBuilder.withContextLimit(maxContextChars)
                .task(PREAMBLE)
                .context("CONTEXT FROM TRAINING MATERIALS:", context, "[No relevant context found in uploaded documents]")
                .instruction("EXAM QUESTION:\n" + question)
                .instruction("CANDIDATE'S ANSWER:\n" + answer)
                .jsonOnly(SCHEMA_EXAMPLE)
                .build();
        String response;
        try {
            response = textGenerator.generate(new TextPrompt(null, prompt, temperature, maxTokens));
        } catch (GenerationUnavailableException ex) {
            log.warn("Answer review unavailable: {}", ex.getMessage());
            return new ReviewGrade(question, "partial", UNAVAILABLE_FEEDBACK, FALLBACK_TEXTBOOK_ANSWER, List.of());
        }
        try {
            return toGrade(question, parser.parse(response));
        } catch (ParseFailureException ex) {
            log.warn("Answer review response could not be parsed, returning raw feedback");
            return new ReviewGrade(question, "incorrect", response, FALLBACK_TEXTBOOK_ANSWER, List.of());
        }
    }

    static ReviewGrade toGrade(String question, ObjectNode node) {
        String grade = text(node, "grade", "incorrect");
        if (!ReviewGrade.GRADES.contains(grade.trim().toLowerCase(Locale.ROOT))) {
            grade = "incorrect";
        }
        return new ReviewGrade(
                question,
                grade,
                text(node, "feedback", "Unable to parse feedback"),
                text(node, "textbook_answer", "Unable to parse textbook answer"),
                List.of());
    }

    private static String text(ObjectNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText().trim();
    }
}
