package com.captainsprep.engine.service.qa;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters for one QA run. Not thread-safe; the engine updates it from a single thread.
 */
public class GenerationStats {

    private int attempts;
    private int generated;
    private int passed;
    private int failed;
    private final List<FailureRecord> failures = new ArrayList<>();

    void recordAttempts(int count) {
        attempts += count;
    }

    void recordPassed() {
        generated++;
        passed++;
    }

    void recordRejected(FailureRecord record) {
        generated++;
        failed++;
        failures.add(record);
    }

    void recordGenerationFailure(FailureRecord record) {
        failed++;
        failures.add(record);
    }

    @JsonProperty("total_attempts")
    public int attempts() {
        return attempts;
    }

    @JsonProperty("total_generated")
    public int generated() {
        return generated;
    }

    @JsonProperty("total_passed")
    public int passed() {
        return passed;
    }

    @JsonProperty("total_failed")
    public int failed() {
        return failed;
    }

    @JsonProperty("failures")
    public List<FailureRecord> failures() {
        return Collections.unmodifiableList(failures);
    }
}
