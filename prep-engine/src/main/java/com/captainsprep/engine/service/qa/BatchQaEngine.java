package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives repeated generation toward a target number of accepted items. Each round issues up to
 * {@code batchSize} generation calls concurrently, then runs every returned candidate through
 * the {@link QaPipeline} in completion order. The run ends when the target is met or the attempt
 * budget is spent, whichever comes first.
 */
@Component
public class BatchQaEngine {

    private static final Logger log = LoggerFactory.getLogger(BatchQaEngine.class);

    private final QaPipeline pipeline;
    private final int batchSize;
    private final Duration attemptDelay;
    private final Duration batchDelay;
    private final Pacer pacer;
    private final Scheduler scheduler;
    private final Counter acceptedCounter;
    private final Counter rejectedCounter;
    private final Counter failedCounter;
    private final Timer runTimer;

    @Autowired
    public BatchQaEngine(QaPipeline pipeline,
                         MeterRegistry meterRegistry,
                         @Value("${prep.qa.batch-size:5}") int batchSize,
                         @Value("${prep.qa.attempt-delay-ms:500}") long attemptDelayMs,
                         @Value("${prep.qa.batch-delay-ms:2000}") long batchDelayMs) {
        this(pipeline, meterRegistry, batchSize, Duration.ofMillis(attemptDelayMs), Duration.ofMillis(batchDelayMs),
                Pacer.SLEEPING, Schedulers.boundedElastic());
    }

    public BatchQaEngine(QaPipeline pipeline,
                         MeterRegistry meterRegistry,
                         int batchSize,
                         Duration attemptDelay,
                         Duration batchDelay,
                         Pacer pacer,
                         Scheduler scheduler) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.pipeline = pipeline;
        this.batchSize = batchSize;
        this.attemptDelay = attemptDelay.isNegative() ? Duration.ZERO : attemptDelay;
        this.batchDelay = batchDelay.isNegative() ? Duration.ZERO : batchDelay;
        this.pacer = pacer;
        this.scheduler = scheduler;
        this.acceptedCounter = candidates(meterRegistry, "accepted");
        this.rejectedCounter = candidates(meterRegistry, "rejected");
        this.failedCounter = candidates(meterRegistry, "failed");
        this.runTimer = Timer.builder("prep.qa.run.duration")
                .description("Time taken by one fill-to-target run")
                .register(meterRegistry);
    }

    public <T extends GeneratedItem> QaRunResult<T> fillToTarget(int target,
                                                                 CandidateSupplier<T> supplier,
                                                                 List<? extends GeneratedItem> existing) {
        return fillToTarget(target, supplier, existing, 2 * target, item -> {
        });
    }

    public <T extends GeneratedItem> QaRunResult<T> fillToTarget(int target,
                                                                 CandidateSupplier<T> supplier,
                                                                 List<? extends GeneratedItem> existing,
                                                                 int maxAttempts) {
        return fillToTarget(target, supplier, existing, maxAttempts, item -> {
        });
    }

    /**
     * @param onAccepted invoked for each accepted item before it joins the duplicate pool; an
     *                   exception rejects the item with a {@code Persistence} issue
     */
    public <T extends GeneratedItem> QaRunResult<T> fillToTarget(int target,
                                                                 CandidateSupplier<T> supplier,
                                                                 List<? extends GeneratedItem> existing,
                                                                 int maxAttempts,
                                                                 Consumer<? super T> onAccepted) {
        if (target < 0 || maxAttempts < 0) {
            throw new IllegalArgumentException("target and maxAttempts must not be negative");
        }
        Timer.Sample sample = Timer.start();
        List<T> accepted = new ArrayList<>();
        List<GeneratedItem> pool = new ArrayList<>(existing == null ? List.of() : existing);
        GenerationStats stats = new GenerationStats();
        int attempts = 0;
        try {
            while (accepted.size() < target && attempts < maxAttempts) {
                int size = Math.min(batchSize, Math.min(target - accepted.size(), maxAttempts - attempts));
                attempts += size;
                stats.recordAttempts(size);
                for (Attempt<T> attempt : runBatch(supplier, size)) {
                    if (attempt.error() != null) {
                        recordGenerationFailure(stats, attempt.error());
                        continue;
                    }
                    evaluate(attempt.candidate(), pool, accepted, stats, onAccepted);
                }
                if (accepted.size() < target && attempts < maxAttempts) {
                    pacer.pause(batchDelay);
                }
            }
        } finally {
            sample.stop(runTimer);
        }
        log.info("QA run finished: {} accepted of target {}, {} attempts, {} failed",
                accepted.size(), target, stats.attempts(), stats.failed());
        return new QaRunResult<>(accepted, stats);
    }

    private <T extends GeneratedItem> List<Attempt<T>> runBatch(CandidateSupplier<T> supplier, int size) {
        List<Attempt<T>> attempts = Flux.range(0, size)
                .flatMap(index -> call(supplier, index), size)
                .collectList()
                .block();
        return attempts == null ? List.of() : attempts;
    }

    private <T> Mono<Attempt<T>> call(CandidateSupplier<T> supplier, int index) {
        Mono<Attempt<T>> call = Mono.fromCallable(() -> Attempt.<T>success(supplier.next()))
                .subscribeOn(scheduler)
                .onErrorResume(ex -> Mono.just(Attempt.<T>failure(ex)));
        if (index > 0 && !attemptDelay.isZero()) {
            return call.delaySubscription(attemptDelay.multipliedBy(index));
        }
        return call;
    }

    private <T extends GeneratedItem> void evaluate(T candidate,
                                                    List<GeneratedItem> pool,
                                                    List<T> accepted,
                                                    GenerationStats stats,
                                                    Consumer<? super T> onAccepted) {
        if (candidate == null) {
            recordGenerationFailure(stats, new IllegalStateException("supplier returned no candidate"));
            return;
        }
        List<QaIssue> issues = pipeline.evaluate(candidate, pool);
        if (issues.isEmpty()) {
            try {
                onAccepted.accept(candidate);
            } catch (RuntimeException ex) {
                log.warn("Accepted candidate could not be stored: {}", ex.getMessage());
                issues = List.of(new QaIssue("Persistence", String.valueOf(ex.getMessage())));
            }
        }
        if (issues.isEmpty()) {
            accepted.add(candidate);
            pool.add(candidate);
            stats.recordPassed();
            acceptedCounter.increment();
            log.debug("Accepted candidate: {}", abbreviate(candidate.front()));
            return;
        }
        List<String> messages = issues.stream().map(QaIssue::toString).toList();
        stats.recordRejected(new FailureRecord(candidate, messages));
        rejectedCounter.increment();
        log.warn("Rejected candidate '{}': {}", abbreviate(candidate.front()), String.join(", ", messages));
    }

    private void recordGenerationFailure(GenerationStats stats, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        stats.recordGenerationFailure(new FailureRecord(null, List.of(new QaIssue("Generation", message).toString())));
        failedCounter.increment();
        log.warn("Candidate generation failed: {}", message);
    }

    private static Counter candidates(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("prep.qa.candidates")
                .tag("outcome", outcome)
                .description("Candidates processed by the QA engine")
                .register(meterRegistry);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }

    private record Attempt<T>(T candidate, Throwable error) {

        static <T> Attempt<T> success(T candidate) {
            return new Attempt<>(candidate, null);
        }

        static <T> Attempt<T> failure(Throwable error) {
            return new Attempt<>(null, error);
        }
    }
}
