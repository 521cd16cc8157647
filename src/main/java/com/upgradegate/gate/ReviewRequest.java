package com.upgradegate.gate;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.Verdict;

/**
 * Everything the reviewer sees: the device, its resolved policy, the health
 * snapshot and the rule verdict it is asked to confirm or veto.
 */
public record ReviewRequest(
    @JsonProperty("device") Device device,
    @JsonProperty("policy") Policy policy,
    @JsonProperty("health") HealthSnapshot health,
    @JsonProperty("rule_verdict") Verdict ruleVerdict,
    @JsonProperty("model") String model
) {
}
