package com.captainsprep.engine.service.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SeenPatternStats(@JsonProperty("user_id") String userId,
                               @JsonProperty("questions_seen") int questionsSeen,
                               @JsonProperty("unique_patterns") int uniquePatterns,
                               @JsonProperty("session_duration_minutes") long sessionDurationMinutes) {
}
