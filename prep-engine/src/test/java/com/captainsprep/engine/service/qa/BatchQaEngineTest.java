package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchQaEngineTest {

    private static final List<String> OPTIONS = List.of("2", "3", "4", "5");

    private static final List<String> QUESTIONS = List.of(
            "How many 50 foot sections of hose make up a standard 200 foot pre-connect?",
            "A coworker repeatedly skips kitchen duty; what should you do first?",
            "Which simple machine best describes a Halligan bar used to force a door?",
            "What does the acronym NFPA stand for in fire service standards?",
            "If a pump discharges 150 GPM for four minutes, how much water flows?",
            "Which gear turns faster when a small gear drives a much larger one?"
    );

    private SimpleMeterRegistry meterRegistry;
    private BatchQaEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engine = engineWithBatchSize(1);
    }

    @Test
    void skipsNearDuplicatesUntilTargetIsReached() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger fresh = new AtomicInteger();
        List<String> issued = new ArrayList<>();
        CandidateSupplier<QuizQuestion> supplier = () -> {
            int call = calls.incrementAndGet();
            String text = call % 3 == 0
                    ? issued.get(issued.size() - 1).replace("?", "s?")
                    : QUESTIONS.get(fresh.getAndIncrement());
            issued.add(text);
            return question(text, "4");
        };

        QaRunResult<QuizQuestion> result = engine.fillToTarget(5, supplier, List.of(), 10);

        assertThat(result.accepted()).hasSize(5);
        assertThat(result.reachedTarget(5)).isTrue();
        assertThat(result.accepted()).extracting(QuizQuestion::question).doesNotHaveDuplicates();
        assertThat(result.stats().attempts()).isEqualTo(7);
        assertThat(result.stats().passed()).isEqualTo(5);
        assertThat(result.stats().failed()).isEqualTo(2);
        assertThat(result.stats().failures())
                .allSatisfy(failure -> assertThat(failure.issues())
                        .containsExactly("Duplicate Check: Duplicate detected (similarity: 99%)"));
        assertThat(meterRegistry.get("prep.qa.candidates").tag("outcome", "accepted").counter().count()).isEqualTo(5.0);
        assertThat(meterRegistry.get("prep.qa.candidates").tag("outcome", "rejected").counter().count()).isEqualTo(2.0);
    }

    @Test
    void failedCallDoesNotCancelConcurrentSiblings() {
        BatchQaEngine concurrent = new BatchQaEngine(
                new QaPipeline(QaPipeline.standardChecks(5, DuplicateThresholds.DEFAULTS)),
                meterRegistry, 3, Duration.ofMillis(20), Duration.ZERO, Pacer.NONE, Schedulers.boundedElastic());
        AtomicInteger calls = new AtomicInteger();
        List<String> threads = new CopyOnWriteArrayList<>();

        QaRunResult<QuizQuestion> result = concurrent.fillToTarget(3, () -> {
            threads.add(Thread.currentThread().getName());
            int call = calls.incrementAndGet();
            if (call == 2) {
                throw new IllegalStateException("boom");
            }
            return question(QUESTIONS.get(call), "4");
        }, List.of(), 3);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(threads).allSatisfy(name -> assertThat(name).startsWith("boundedElastic"));
        assertThat(result.accepted()).hasSize(2);
        assertThat(result.accepted()).extracting(QuizQuestion::question)
                .containsExactlyInAnyOrder(QUESTIONS.get(1), QUESTIONS.get(3));
        assertThat(result.stats().attempts()).isEqualTo(3);
        assertThat(result.stats().passed()).isEqualTo(2);
        assertThat(result.stats().failures()).singleElement()
                .satisfies(failure -> {
                    assertThat(failure.candidate()).isNull();
                    assertThat(failure.issues()).containsExactly("Generation: boom");
                });
    }

    @Test
    void rejectsAnswerMissingFromOptions() {
        QaRunResult<QuizQuestion> result = engine.fillToTarget(1, () -> question(QUESTIONS.get(0), "E"), List.of(), 1);

        assertThat(result.accepted()).isEmpty();
        assertThat(result.stats().failures()).singleElement()
                .satisfies(failure -> {
                    assertThat(failure.candidate()).isNotNull();
                    assertThat(failure.issues()).containsExactly("Correctness: answer not in options");
                });
    }

    @Test
    void stopsAtAttemptBudgetWhenEverythingIsRejected() {
        BatchQaEngine batched = engineWithBatchSize(2);
        AtomicInteger calls = new AtomicInteger();

        QaRunResult<QuizQuestion> result = batched.fillToTarget(3, () -> {
            calls.incrementAndGet();
            return question(QUESTIONS.get(1), "E");
        }, List.of(), 4);

        assertThat(calls.get()).isEqualTo(4);
        assertThat(result.accepted()).isEmpty();
        assertThat(result.reachedTarget(3)).isFalse();
        assertThat(result.stats().attempts()).isEqualTo(4);
        assertThat(result.stats().generated()).isEqualTo(4);
        assertThat(result.stats().failed()).isEqualTo(4);
    }

    @Test
    void defaultBudgetIsTwiceTheTarget() {
        AtomicInteger calls = new AtomicInteger();

        engine.fillToTarget(3, () -> {
            calls.incrementAndGet();
            return question(QUESTIONS.get(2), "E");
        }, List.of());

        assertThat(calls.get()).isEqualTo(6);
    }

    @Test
    void supplierExceptionsAreRecordedAsGenerationFailures() {
        QaRunResult<QuizQuestion> result = engine.fillToTarget(2, () -> {
            throw new IllegalStateException("quota exceeded");
        }, List.of(), 3);

        assertThat(result.accepted()).isEmpty();
        assertThat(result.stats().attempts()).isEqualTo(3);
        assertThat(result.stats().generated()).isZero();
        assertThat(result.stats().failed()).isEqualTo(3);
        assertThat(result.stats().failures())
                .allSatisfy(failure -> {
                    assertThat(failure.candidate()).isNull();
                    assertThat(failure.issues()).containsExactly("Generation: quota exceeded");
                });
        assertThat(meterRegistry.get("prep.qa.candidates").tag("outcome", "failed").counter().count()).isEqualTo(3.0);
    }

    @Test
    void existingItemsCountAsDuplicates() {
        List<GeneratedItem> existing = List.of(question(QUESTIONS.get(3), "4"));
        AtomicInteger calls = new AtomicInteger();

        QaRunResult<QuizQuestion> result = engine.fillToTarget(1,
                () -> question(QUESTIONS.get(3 + calls.getAndIncrement()), "4"), existing, 2);

        assertThat(result.accepted()).extracting(QuizQuestion::question).containsExactly(QUESTIONS.get(4));
        assertThat(result.stats().failures()).singleElement()
                .satisfies(failure -> assertThat(failure.issues().get(0)).startsWith("Duplicate Check:"));
    }

    @Test
    void acceptedItemsSatisfyEveryCheck() {
        AtomicInteger calls = new AtomicInteger();
        QaPipeline pipeline = new QaPipeline(QaPipeline.standardChecks(5, DuplicateThresholds.DEFAULTS));

        QaRunResult<QuizQuestion> result = engineWithBatchSize(3).fillToTarget(4,
                () -> question(QUESTIONS.get(calls.getAndIncrement() % QUESTIONS.size()), "4"), List.of(), 8);

        assertThat(result.accepted()).hasSize(4);
        for (int i = 0; i < result.accepted().size(); i++) {
            QuizQuestion accepted = result.accepted().get(i);
            assertThat(accepted.options()).hasSize(4).contains(accepted.correctAnswer());
            assertThat(pipeline.evaluate(accepted, result.accepted().subList(0, i))).isEmpty();
        }
    }

    @Test
    void persistenceFailureRejectsTheCandidate() {
        AtomicInteger calls = new AtomicInteger();
        List<QuizQuestion> stored = new ArrayList<>();

        QaRunResult<QuizQuestion> result = engine.fillToTarget(1,
                () -> question(QUESTIONS.get(calls.getAndIncrement()), "4"), List.of(), 3,
                item -> {
                    if (stored.isEmpty() && calls.get() == 1) {
                        throw new IllegalStateException("disk full");
                    }
                    stored.add(item);
                });

        assertThat(result.accepted()).extracting(QuizQuestion::question).containsExactly(QUESTIONS.get(1));
        assertThat(stored).containsExactlyElementsOf(result.accepted());
        assertThat(result.stats().failures()).singleElement()
                .satisfies(failure -> assertThat(failure.issues()).containsExactly("Persistence: disk full"));
    }

    @Test
    void zeroTargetDoesNothing() {
        AtomicInteger calls = new AtomicInteger();

        QaRunResult<QuizQuestion> result = engine.fillToTarget(0, () -> {
            calls.incrementAndGet();
            return question(QUESTIONS.get(0), "4");
        }, List.of());

        assertThat(calls.get()).isZero();
        assertThat(result.accepted()).isEmpty();
        assertThat(result.stats().attempts()).isZero();
    }

    private BatchQaEngine engineWithBatchSize(int batchSize) {
        QaPipeline pipeline = new QaPipeline(QaPipeline.standardChecks(5, DuplicateThresholds.DEFAULTS));
        return new BatchQaEngine(pipeline, meterRegistry, batchSize, Duration.ZERO, Duration.ZERO,
                Pacer.NONE, Schedulers.immediate());
    }

    private static QuizQuestion question(String text, String answer) {
        return new QuizQuestion(text, OPTIONS, answer,
                "Work it through step by step using the numbers given.", "math");
    }
}
