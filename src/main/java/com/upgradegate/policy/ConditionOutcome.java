package com.upgradegate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One line of a verdict's rationale: what was measured, against which
 * threshold, and whether it passed.
 */
public record ConditionOutcome(
    @JsonProperty("condition") String conditionId,
    @JsonProperty("label") String label,
    @JsonProperty("measured") String measured,
    @JsonProperty("threshold") String threshold,
    @JsonProperty("passed") boolean passed
) {

    public String line() {
        return label + " " + measured + " " + (passed ? "PASS" : "FAIL") + " (" + threshold + ")";
    }

    static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
