package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every check against a candidate and collects all issues; an empty list means the
 * candidate passed.
 */
@Component
public class QaPipeline {

    private final List<QaCheck> checks;

    @Autowired
    public QaPipeline(@Value("${prep.qa.min-words:5}") int minWords,
                      @Value("${prep.qa.threshold.quiz:0.85}") double quizThreshold,
                      @Value("${prep.qa.threshold.flashcard:0.80}") double flashcardThreshold,
                      @Value("${prep.qa.threshold.review:0.92}") double reviewThreshold) {
        this(standardChecks(minWords, new DuplicateThresholds(quizThreshold, flashcardThreshold, reviewThreshold)));
    }

    public QaPipeline(List<QaCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public static List<QaCheck> standardChecks(int minWords, DuplicateThresholds thresholds) {
        return List.of(
                new RequiredFieldsCheck(),
                new ContentLengthCheck(minWords),
                new CorrectnessCheck(),
                new FuzzyDuplicateCheck(thresholds)
        );
    }

    public List<QaIssue> evaluate(GeneratedItem candidate, List<? extends GeneratedItem> pool) {
        List<QaIssue> issues = new ArrayList<>();
        for (QaCheck check : checks) {
            check.check(candidate, pool).ifPresent(issues::add);
        }
        return issues;
    }
}
