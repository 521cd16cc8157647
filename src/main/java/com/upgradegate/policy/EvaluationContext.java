package com.upgradegate.policy;

import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;

import java.time.Instant;

public record EvaluationContext(Device device, Policy policy, HealthSnapshot health, Instant evaluatedAt) {
}
