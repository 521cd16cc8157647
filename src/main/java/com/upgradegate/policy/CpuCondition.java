package com.upgradegate.policy;

/**
 * Average CPU over the window must not exceed {@code max_cpu_percent}.
 * An absent reading is judged as 100%.
 */
public class CpuCondition implements UpgradeCondition {

    static final double WORST_CASE_CPU_PERCENT = 100.0;

    @Override
    public String conditionId() {
        return "cpu";
    }

    @Override
    public ConditionOutcome evaluate(EvaluationContext context) {
        Double reading = context.health().cpuAvg();
        double cpu = reading != null ? reading : WORST_CASE_CPU_PERCENT;
        double limit = context.policy().maxCpuPercent();

        String measured = reading != null
            ? ConditionOutcome.number(cpu) + "%"
            : "absent (treated as " + ConditionOutcome.number(WORST_CASE_CPU_PERCENT) + "%)";

        return new ConditionOutcome(conditionId(), "CPU", measured,
            "limit: " + ConditionOutcome.number(limit) + "%", cpu <= limit);
    }
}
