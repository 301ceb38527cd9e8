package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A rejected attempt. {@code candidate} is {@code null} when generation itself failed.
 */
public record FailureRecord(@JsonProperty("item") GeneratedItem candidate,
                            @JsonProperty("issues") List<String> issues) {

    public FailureRecord {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
