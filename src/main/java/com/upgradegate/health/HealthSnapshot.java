package com.upgradegate.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Aggregated telemetry for one device over one window.
 *
 * <p>{@code cpuAvg}, {@code memFreeMin} and {@code criticalErrors} are null
 * when the value could not be obtained. Consumers substitute the least
 * favourable value themselves; the snapshot records only what was measured.</p>
 */
public record HealthSnapshot(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("window") Duration window,
    @JsonProperty("cpu_avg") Double cpuAvg,
    @JsonProperty("mem_free_min") Double memFreeMin,
    @JsonProperty("critical_errors") Integer criticalErrors,
    @JsonProperty("status") HealthStatus status
) {

    public static HealthSnapshot of(String deviceId, Duration window,
                                    Double cpuAvg, Double memFreeMin, Integer criticalErrors) {
        return new HealthSnapshot(deviceId, window, cpuAvg, memFreeMin, criticalErrors,
            HealthStatus.classify(cpuAvg, memFreeMin, criticalErrors));
    }

    public boolean complete() {
        return cpuAvg != null && memFreeMin != null && criticalErrors != null;
    }
}
