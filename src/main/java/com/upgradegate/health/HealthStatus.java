package com.upgradegate.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse, advisory health classification for dashboards and alerts.
 * Independent of the upgrade verdict.
 */
public enum HealthStatus {
    HEALTHY,
    CAUTION,
    WARNING,
    CRITICAL,
    UNKNOWN;

    static final double WARNING_CPU = 80.0;
    static final double WARNING_MEM = 20.0;
    static final double CAUTION_CPU = 70.0;
    static final double CAUTION_MEM = 30.0;

    public static HealthStatus classify(Double cpuAvg, Double memFreeMin, Integer criticalErrors) {
        if (cpuAvg == null || memFreeMin == null || criticalErrors == null) {
            return UNKNOWN;
        }
        if (criticalErrors > 0) {
            return CRITICAL;
        }
        if (cpuAvg > WARNING_CPU || memFreeMin < WARNING_MEM) {
            return WARNING;
        }
        if (cpuAvg > CAUTION_CPU || memFreeMin < CAUTION_MEM) {
            return CAUTION;
        }
        return HEALTHY;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
