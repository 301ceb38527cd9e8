package com.captainsprep.engine.job;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.Flashcard;
import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;
import com.captainsprep.engine.service.bank.ContentBank;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.generation.GenerationOrchestrator;
import com.captainsprep.engine.service.generation.flashcard.FlashcardPromptCatalog;
import com.captainsprep.engine.service.qa.BatchQaEngine;
import com.captainsprep.engine.service.qa.FailureRecord;
import com.captainsprep.engine.service.qa.QaRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fills the content bank for each requested subject (and, for flashcards, each card type the
 * subject supports) up to the requested count, and summarises the QA outcome.
 */
@Service
public class BankGenerationJob {

    private static final Logger log = LoggerFactory.getLogger(BankGenerationJob.class);

    private final ContentGenerators generators;
    private final BatchQaEngine qaEngine;
    private final ContentBank contentBank;
    private final FlashcardPromptCatalog flashcardPrompts;

    public BankGenerationJob(ContentGenerators generators,
                             BatchQaEngine qaEngine,
                             ContentBank contentBank,
                             FlashcardPromptCatalog flashcardPrompts) {
        this.generators = generators;
        this.qaEngine = qaEngine;
        this.contentBank = contentBank;
        this.flashcardPrompts = flashcardPrompts;
    }

    public BankGenerationReport run(BankGenerationRequest request) {
        log.info("Generating {} {} items per combination for subjects {}{}",
                request.countPerCombination(), request.kind(), request.subjects(), request.dryRun() ? " (dry run)" : "");
        Map<String, BankGenerationReport.ComboSummary> byCombination = new LinkedHashMap<>();
        List<FailureRecord> failures = new ArrayList<>();
        int generated = 0;
        int passed = 0;
        int failed = 0;
        for (String subject : request.subjects()) {
            for (Combination combination : combinations(request, subject)) {
                QaRunResult<? extends GeneratedItem> result = combination.run(request);
                byCombination.put(combination.key(), new BankGenerationReport.ComboSummary(
                        result.accepted().size(), result.stats().failed()));
                failures.addAll(result.stats().failures());
                generated += result.stats().generated();
                passed += result.stats().passed();
                failed += result.stats().failed();
                log.info("{}: {} passed, {} failed", combination.key(), result.accepted().size(), result.stats().failed());
            }
        }
        return new BankGenerationReport(OffsetDateTime.now(), request.kind(), request.dryRun(),
                generated, passed, failed, byCombination, failures);
    }

    private List<Combination> combinations(BankGenerationRequest request, String subject) {
        if (request.kind() == ContentKind.QUIZ_QUESTION) {
            return List.of(new Combination(subject, null));
        }
        List<CardType> applicable = flashcardPrompts.cardTypesFor(subject).stream()
                .filter(request.cardTypes()::contains)
                .toList();
        if (applicable.isEmpty()) {
            log.warn("No requested card type applies to subject {}", subject);
        }
        return applicable.stream().map(type -> new Combination(subject, type)).toList();
    }

    private <T extends GeneratedItem> Consumer<T> committer(boolean dryRun) {
        if (dryRun) {
            return item -> {
            };
        }
        return contentBank::add;
    }

    private final class Combination {

        private final String subject;
        private final CardType cardType;

        private Combination(String subject, CardType cardType) {
            this.subject = subject;
            this.cardType = cardType;
        }

        String key() {
            return cardType == null ? subject : subject + "/" + cardType.code();
        }

        QaRunResult<? extends GeneratedItem> run(BankGenerationRequest request) {
            int target = request.countPerCombination();
            if (cardType == null) {
                GenerationOrchestrator<QuizQuestion> quiz = generators.quiz();
                List<GeneratedItem> existing = contentBank.listExisting(ContentKind.QUIZ_QUESTION, subject);
                return qaEngine.fillToTarget(target,
                        () -> quiz.generateGrounded(subject, null).withSubject(subject),
                        existing, 2 * target, committer(request.dryRun()));
            }
            GenerationOrchestrator<Flashcard> flashcards = generators.flashcards(cardType);
            List<GeneratedItem> existing = contentBank.listExisting(ContentKind.FLASHCARD, subject).stream()
                    .filter(item -> cardType.code().equals(item.itemType()))
                    .toList();
            return qaEngine.fillToTarget(target,
                    () -> flashcards.generate(subject, "").withSubject(subject),
                    existing, 2 * target, committer(request.dryRun()));
        }
    }
}
