package com.captainsprep.engine.model;

/**
 * Common shape of everything the generation pipeline produces. The front side is what a
 * learner is shown first, the back side is the answer or explanation.
 */
public interface GeneratedItem {

    ContentKind kind();

    String front();

    String back();

    String subject();

    /**
     * Question or card type used for pattern signatures, may be {@code null}.
     */
    String itemType();
}
