package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rejects a candidate whose front text is more similar than the kind's threshold to any item in
 * the pool.
 */
public class FuzzyDuplicateCheck implements QaCheck {

    private final DuplicateThresholds thresholds;

    public FuzzyDuplicateCheck(DuplicateThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String name() {
        return "Duplicate Check";
    }

    @Override
    public Optional<QaIssue> check(GeneratedItem candidate, List<? extends GeneratedItem> pool) {
        String front = candidate.front();
        if (front == null || front.isBlank() || pool == null) {
            return Optional.empty();
        }
        double threshold = thresholds.forKind(candidate.kind());
        for (GeneratedItem existing : pool) {
            if (existing == null || existing.front() == null) {
                continue;
            }
            double ratio = SimilarityRatio.ratio(front, existing.front());
            if (ratio > threshold) {
                return issue(String.format(Locale.ROOT, "Duplicate detected (similarity: %.0f%%)", ratio * 100));
            }
        }
        return Optional.empty();
    }
}
