package com.upgradegate.policy;

import com.upgradegate.health.HealthSnapshot;

/**
 * Advisory 0-100 risk score (higher is riskier). Recorded with each decision
 * for operators; it does not influence the verdict.
 */
public class RiskScorer {

    public int score(HealthSnapshot health) {
        double cpu = health.cpuAvg() != null ? health.cpuAvg() : CpuCondition.WORST_CASE_CPU_PERCENT;
        double mem = health.memFreeMin() != null ? health.memFreeMin() : MemoryCondition.WORST_CASE_FREE_MEM_PERCENT;
        int errors = health.criticalErrors() != null ? health.criticalErrors() : Integer.MAX_VALUE;

        int risk = 0;

        if (cpu > 85) {
            risk += 40;
        } else if (cpu > 75) {
            risk += 25;
        } else if (cpu > 60) {
            risk += 10;
        }

        if (mem < 20) {
            risk += 35;
        } else if (mem < 30) {
            risk += 20;
        } else if (mem < 40) {
            risk += 10;
        }

        if (errors > 5) {
            risk += 25;
        } else if (errors > 2) {
            risk += 15;
        } else if (errors > 0) {
            risk += 10;
        }

        return Math.min(risk, 100);
    }
}
