package com.captainsprep.engine.service.qa;

import java.util.List;

public record QaRunResult<T>(List<T> accepted, GenerationStats stats) {

    public QaRunResult {
        accepted = List.copyOf(accepted);
    }

    public boolean reachedTarget(int target) {
        return accepted.size() >= target;
    }
}
