package com.upgradegate.policy;

/**
 * Minimum free memory over the window must be at least {@code min_free_mem_percent}.
 * An absent reading is judged as 0%.
 */
public class MemoryCondition implements UpgradeCondition {

    static final double WORST_CASE_FREE_MEM_PERCENT = 0.0;

    @Override
    public String conditionId() {
        return "memory";
    }

    @Override
    public ConditionOutcome evaluate(EvaluationContext context) {
        Double reading = context.health().memFreeMin();
        double free = reading != null ? reading : WORST_CASE_FREE_MEM_PERCENT;
        double minimum = context.policy().minFreeMemPercent();

        String measured = reading != null
            ? ConditionOutcome.number(free) + "%"
            : "absent (treated as " + ConditionOutcome.number(WORST_CASE_FREE_MEM_PERCENT) + "%)";

        return new ConditionOutcome(conditionId(), "Memory", measured,
            "min: " + ConditionOutcome.number(minimum) + "%", free >= minimum);
    }
}
