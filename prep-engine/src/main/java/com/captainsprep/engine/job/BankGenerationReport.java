package com.captainsprep.engine.job;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.service.qa.FailureRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public record BankGenerationReport(@JsonProperty("generated_at") OffsetDateTime generatedAt,
                                   @JsonProperty("kind") ContentKind kind,
                                   @JsonProperty("dry_run") boolean dryRun,
                                   @JsonProperty("total_generated") int totalGenerated,
                                   @JsonProperty("total_passed") int totalPassed,
                                   @JsonProperty("total_failed") int totalFailed,
                                   @JsonProperty("by_combo") Map<String, ComboSummary> byCombination,
                                   @JsonProperty("failures") List<FailureRecord> failures) {

    public BankGenerationReport {
        byCombination = Map.copyOf(byCombination);
        failures = List.copyOf(failures);
    }

    public record ComboSummary(@JsonProperty("generated") int accepted,
                               @JsonProperty("failed") int failed) {
    }
}
