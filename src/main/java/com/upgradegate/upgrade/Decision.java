package com.upgradegate.upgrade;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.Verdict;

/**
 * Everything one evaluation produced: the inputs it used, the rule verdict and
 * the final verdict after the safety gate.
 *
 * @param riskScore advisory only, never changes {@code verdict}
 */
public record Decision(
    @JsonProperty("device") Device device,
    @JsonProperty("policy") Policy policy,
    @JsonProperty("health") HealthSnapshot health,
    @JsonProperty("rule_verdict") Verdict ruleVerdict,
    @JsonProperty("verdict") Verdict verdict,
    @JsonProperty("risk_score") int riskScore
) {
}
