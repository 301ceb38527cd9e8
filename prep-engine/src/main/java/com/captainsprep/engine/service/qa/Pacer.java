package com.captainsprep.engine.service.qa;

import java.time.Duration;

@FunctionalInterface
public interface Pacer {

    Pacer NONE = delay -> {
    };

    Pacer SLEEPING = delay -> {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing generation", e);
        }
    };

    void pause(Duration delay);
}
