package com.upgradegate.policy;

import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rule-based evaluator: runs every registered condition and approves only
 * when all of them pass.
 *
 * <p>Unlike first-failure arbitration, all conditions are evaluated so the
 * reason lists each one with its measured value, threshold and PASS/FAIL
 * marker. Downstream audit and operators rely on that format.</p>
 */
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    static final double RULE_CONFIDENCE = 0.8;

    private final List<UpgradeCondition> conditions;
    private final Clock clock;

    public PolicyEvaluator(List<UpgradeCondition> conditions, Clock clock) {
        this.conditions = List.copyOf(conditions);
        this.clock = clock;
    }

    public static List<UpgradeCondition> standardConditions() {
        return List.of(
            new CpuCondition(),
            new MemoryCondition(),
            new CriticalErrorsCondition(),
            new MaintenanceWindowCondition()
        );
    }

    public Verdict evaluate(Device device, Policy policy, HealthSnapshot health) {
        EvaluationContext context = new EvaluationContext(device, policy, health, clock.instant());

        List<ConditionOutcome> outcomes = new ArrayList<>(conditions.size());
        for (UpgradeCondition condition : conditions) {
            outcomes.add(condition.evaluate(context));
        }

        boolean approve = outcomes.stream().allMatch(ConditionOutcome::passed);
        String lines = outcomes.stream().map(ConditionOutcome::line).collect(Collectors.joining("; "));
        String reason = approve ? "All conditions met: " + lines : "Conditions failed: " + lines;

        if (approve) {
            log.info("Device {} passed all {} conditions (policy origin={})",
                device.id(), outcomes.size(), policy.origin().getValue());
        } else {
            log.info("Device {} failed conditions {}", device.id(),
                outcomes.stream().filter(o -> !o.passed()).map(ConditionOutcome::conditionId).toList());
        }

        return new Verdict(approve, reason, device.upgradeTarget(), RULE_CONFIDENCE,
            VerdictSource.RULE, outcomes, List.of());
    }
}
