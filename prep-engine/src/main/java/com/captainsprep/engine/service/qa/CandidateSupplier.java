package com.captainsprep.engine.service.qa;

/**
 * Produces one fresh candidate per call. May throw; a throwing call counts as a failed attempt.
 */
@FunctionalInterface
public interface CandidateSupplier<T> {

    T next();
}
