package com.captainsprep.engine.service.generation;

/**
 * Produces one item about {@code topic}, grounded on {@code context} (which may be empty).
 */
@FunctionalInterface
public interface ItemGenerator<T> {

    T generate(String topic, String context);
}
