package com.captainsprep.engine.config;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.generation.GenerationOrchestrator;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.generation.flashcard.FlashcardPromptCatalog;
import com.captainsprep.engine.service.generation.flashcard.LlmFlashcardGenerator;
import com.captainsprep.engine.service.generation.flashcard.MockFlashcardGenerator;
import com.captainsprep.engine.service.generation.openai.OpenAiChatClient;
import com.captainsprep.engine.service.generation.openai.OpenAiTextGenerator;
import com.captainsprep.engine.service.generation.quiz.FewShotExampleLibrary;
import com.captainsprep.engine.service.generation.quiz.LlmQuizGenerator;
import com.captainsprep.engine.service.generation.quiz.MockQuizGenerator;
import com.captainsprep.engine.service.generation.tutor.LlmTutorGenerator;
import com.captainsprep.engine.service.generation.tutor.MockTutorGenerator;
import com.captainsprep.engine.service.retrieval.RagContextService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses between the OpenAI-compatible backend and the mock producers. Without a base URL and
 * API key every orchestrator is built in mock-only mode.
 */
@Configuration
public class GenerationBackendConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationBackendConfig.class);

    @Bean
    public ContentGenerators contentGenerators(OpenAiChatClient chatClient,
                                               ObjectMapper objectMapper,
                                               FewShotExampleLibrary fewShotExamples,
                                               FlashcardPromptCatalog flashcardPrompts,
                                               RagContextService ragContextService,
                                               MeterRegistry meterRegistry,
                                               @Value("${prep.llm.base-url:}") String baseUrl,
                                               @Value("${prep.llm.api-key:}") String apiKey,
                                               @Value("${prep.llm.model:gpt-4o-mini}") String model,
                                               @Value("${prep.llm.max-output-tokens:1024}") int maxTokens,
                                               @Value("${prep.generation.max-context-chars:8000}") int maxContextChars,
                                               @Value("${prep.generation.tutor-max-context-chars:15000}") int tutorMaxContextChars,
                                               @Value("${prep.generation.quiz-temperature:0.4}") double quizTemperature,
                                               @Value("${prep.generation.flashcard-temperature:0.7}") double flashcardTemperature,
                                               @Value("${prep.generation.tutor-temperature:0.7}") double tutorTemperature) {
        List<String> missing = new ArrayList<>();
        if (baseUrl == null || baseUrl.isBlank()) {
            missing.add("prep.llm.base-url");
        }
        if (apiKey == null || apiKey.isBlank()) {
            missing.add("prep.llm.api-key");
        }
        TextGenerator textGenerator = null;
        if (missing.isEmpty()) {
            textGenerator = new OpenAiTextGenerator(chatClient, objectMapper, model);
            log.info("Content generation uses model {} at {}", model, baseUrl);
        } else {
            log.info("Content generation runs on mock producers, missing settings: {}", String.join(", ", missing));
        }

        GenerationOrchestrator<QuizQuestion> quiz = new GenerationOrchestrator<>(
                "quiz",
                textGenerator == null ? null
                        : new LlmQuizGenerator(textGenerator, fewShotExamples, objectMapper, maxContextChars, quizTemperature, maxTokens),
                new MockQuizGenerator(),
                ragContextService,
                meterRegistry);
        GenerationOrchestrator<String> tutor = new GenerationOrchestrator<>(
                "tutor",
                textGenerator == null ? null
                        : new LlmTutorGenerator(textGenerator, tutorMaxContextChars, tutorTemperature, maxTokens),
                new MockTutorGenerator(),
                ragContextService,
                meterRegistry);
        Map<CardType, GenerationOrchestrator<Flashcard>> flashcards = new EnumMap<>(CardType.class);
        for (CardType type : CardType.values()) {
            flashcards.put(type, new GenerationOrchestrator<>(
                    "flashcard-" + type.code(),
                    textGenerator == null ? null
                            : new LlmFlashcardGenerator(textGenerator, flashcardPrompts, objectMapper, type,
                            maxContextChars, flashcardTemperature, maxTokens),
                    new MockFlashcardGenerator(type),
                    ragContextService,
                    meterRegistry));
        }
        return new ContentGenerators(textGenerator, quiz, tutor, flashcards);
    }
}
