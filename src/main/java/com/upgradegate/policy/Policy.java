package com.upgradegate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.upgradegate.inventory.MaintenanceWindow;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Fully resolved thresholds for one device. Immutable for the duration of an evaluation.
 */
public record Policy(
    @JsonProperty("vendor") String vendor,
    @JsonProperty("model") String model,
    @JsonProperty("origin") Origin origin,
    @JsonProperty("max_cpu_percent") double maxCpuPercent,
    @JsonProperty("min_free_mem_percent") double minFreeMemPercent,
    @JsonProperty("max_critical_errors") int maxCriticalErrors,
    @JsonProperty("block_if_critical_errors") boolean blockIfCriticalErrors,
    @JsonProperty("require_maintenance_window") boolean requireMaintenanceWindow,
    @JsonProperty("upgrade_window") MaintenanceWindow upgradeWindow,
    @JsonProperty("window") Duration window,
    @JsonProperty("required_pre_checks") List<String> requiredPreChecks
) {

    /** Where the thresholds came from. */
    public enum Origin {
        INVENTORY,
        VENDOR_RULE,
        DEFAULTS;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Policy {
        requiredPreChecks = requiredPreChecks == null ? List.of() : List.copyOf(requiredPreChecks);
    }
}
