package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;

import java.util.List;
import java.util.Optional;

public interface QaCheck {

    String name();

    /**
     * @param pool items the candidate must not duplicate (bank items plus items accepted so far)
     */
    Optional<QaIssue> check(GeneratedItem candidate, List<? extends GeneratedItem> pool);

    default Optional<QaIssue> issue(String message) {
        return Optional.of(new QaIssue(name(), message));
    }
}
