package com.upgradegate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Approve/deny outcome with its rationale. Never mutated; re-evaluating
 * produces a new instance.
 *
 * <p>{@code conditions} always carries the rule evaluation's per-condition
 * evidence, also on gate verdicts, so a decision can be reconstructed without
 * re-querying telemetry.</p>
 */
public record Verdict(
    @JsonProperty("approve") boolean approve,
    @JsonProperty("reason") String reason,
    @JsonProperty("target_version") String targetVersion,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("source") VerdictSource source,
    @JsonProperty("conditions") List<ConditionOutcome> conditions,
    @JsonProperty("additional_checks") List<String> additionalChecks
) {

    public Verdict {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(source, "source");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        additionalChecks = additionalChecks == null ? List.of() : List.copyOf(additionalChecks);
    }

    /** A denial that keeps this verdict's target and evidence. */
    public Verdict deny(String denialReason, VerdictSource denialSource) {
        return new Verdict(false, denialReason, targetVersion, 0.0, denialSource, conditions, List.of());
    }

    public List<ConditionOutcome> failedConditions() {
        return conditions.stream().filter(c -> !c.passed()).toList();
    }
}
