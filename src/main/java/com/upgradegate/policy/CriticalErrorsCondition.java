package com.upgradegate.policy;

/**
 * Critical errors in the window must stay within {@code max_critical_errors},
 * or be zero when the policy blocks on any critical error. A count that could
 * not be read always fails.
 */
public class CriticalErrorsCondition implements UpgradeCondition {

    @Override
    public String conditionId() {
        return "critical_errors";
    }

    @Override
    public ConditionOutcome evaluate(EvaluationContext context) {
        Policy policy = context.policy();
        Integer count = context.health().criticalErrors();

        int allowed = policy.blockIfCriticalErrors() ? 0 : policy.maxCriticalErrors();
        String threshold = policy.blockIfCriticalErrors()
            ? "max: 0, blocking on any critical error"
            : "max: " + allowed;

        if (count == null) {
            return new ConditionOutcome(conditionId(), "Critical errors", "absent (count unavailable)",
                threshold, false);
        }
        return new ConditionOutcome(conditionId(), "Critical errors", String.valueOf(count),
            threshold, count <= allowed);
    }
}
