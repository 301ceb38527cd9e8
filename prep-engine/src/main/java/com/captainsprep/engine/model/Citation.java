package com.captainsprep.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Citation(@JsonProperty("id") int id,
                       @JsonProperty("source") String source,
                       @JsonProperty("excerpt") String excerpt,
                       @JsonProperty("relevance_score") Double relevanceScore) {
}
