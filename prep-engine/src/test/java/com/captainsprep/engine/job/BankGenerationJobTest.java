package com.captainsprep.engine.job;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.service.bank.InMemoryContentBank;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.generation.GenerationOrchestrator;
import com.captainsprep.engine.service.generation.flashcard.FlashcardPromptCatalog;
import com.captainsprep.engine.service.generation.flashcard.MockFlashcardGenerator;
import com.captainsprep.engine.service.generation.quiz.MockQuizGenerator;
import com.captainsprep.engine.service.generation.tutor.MockTutorGenerator;
import com.captainsprep.engine.service.qa.BatchQaEngine;
import com.captainsprep.engine.service.qa.DuplicateThresholds;
import com.captainsprep.engine.service.qa.Pacer;
import com.captainsprep.engine.service.qa.QaPipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BankGenerationJobTest {

    private InMemoryContentBank contentBank;
    private BankGenerationJob job;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        EnumMap<CardType, GenerationOrchestrator<Flashcard>> flashcards = new EnumMap<>(CardType.class);
        for (CardType type : CardType.values()) {
            flashcards.put(type, new GenerationOrchestrator<>("flashcard-" + type.code(), null,
                    new MockFlashcardGenerator(type), null, meterRegistry));
        }
        ContentGenerators generators = new ContentGenerators(null,
                new GenerationOrchestrator<>("quiz", null, new MockQuizGenerator(), null, meterRegistry),
                new GenerationOrchestrator<>("tutor", null, new MockTutorGenerator(), null, meterRegistry),
                flashcards);
        BatchQaEngine qaEngine = new BatchQaEngine(
                new QaPipeline(QaPipeline.standardChecks(5, DuplicateThresholds.DEFAULTS)),
                meterRegistry, 5, Duration.ZERO, Duration.ZERO, Pacer.NONE, Schedulers.immediate());
        contentBank = new InMemoryContentBank();
        job = new BankGenerationJob(generators, qaEngine, contentBank, new FlashcardPromptCatalog());
    }

    @Test
    void repeatedMockQuestionsAreRejectedAsDuplicates() {
        BankGenerationReport report = job.run(new BankGenerationRequest(ContentKind.QUIZ_QUESTION,
                List.of("math", "human-relations"), null, 2, false));

        assertThat(report.byCombination()).containsOnlyKeys("math", "human-relations");
        assertThat(report.byCombination().get("math")).isEqualTo(new BankGenerationReport.ComboSummary(1, 3));
        assertThat(report.totalGenerated()).isEqualTo(8);
        assertThat(report.totalPassed()).isEqualTo(2);
        assertThat(report.totalFailed()).isEqualTo(6);
        assertThat(report.failures()).allSatisfy(failure -> {
            assertThat(failure.issues()).hasSize(1);
            assertThat(failure.issues().get(0)).startsWith("Duplicate Check:");
        });

        List<GeneratedItem> stored = contentBank.listExisting(ContentKind.QUIZ_QUESTION, "math");
        assertThat(stored).singleElement()
                .isInstanceOfSatisfying(QuizQuestion.class, question -> assertThat(question.subject()).isEqualTo("math"));
    }

    @Test
    void existingBankItemsBlockRegeneration() {
        contentBank.add(new MockQuizGenerator().generate("math", "").withSubject("math"));

        BankGenerationReport report = job.run(new BankGenerationRequest(ContentKind.QUIZ_QUESTION,
                List.of("math"), null, 1, false));

        assertThat(report.totalPassed()).isZero();
        assertThat(contentBank.listExisting(ContentKind.QUIZ_QUESTION, "math")).hasSize(1);
    }

    @Test
    void flashcardRunsOnlyApplicableCardTypesAndDryRunWritesNothing() {
        BankGenerationReport report = job.run(new BankGenerationRequest(ContentKind.FLASHCARD,
                List.of("math"), List.of(CardType.FILL_BLANK, CardType.SCENARIO_ACTION), 1, true));

        assertThat(report.dryRun()).isTrue();
        assertThat(report.byCombination()).containsOnlyKeys("math/fill_blank");
        assertThat(report.totalPassed()).isEqualTo(1);
        assertThat(contentBank.listExisting(ContentKind.FLASHCARD, null)).isEmpty();
    }

    @Test
    void requestValidatesItsInput() {
        assertThatThrownBy(() -> new BankGenerationRequest(ContentKind.REVIEW_GRADE, List.of("math"), null, 1, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BankGenerationRequest(ContentKind.FLASHCARD, List.of(), null, 1, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BankGenerationRequest(ContentKind.FLASHCARD, List.of("math"), null, 0, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new BankGenerationRequest(ContentKind.FLASHCARD, List.of("math"), null, 1, false).cardTypes())
                .containsExactly(CardType.values());
    }
}
