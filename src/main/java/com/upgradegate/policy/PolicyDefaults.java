package com.upgradegate.policy;

import com.upgradegate.inventory.MaintenanceWindow;

import java.time.Duration;
import java.util.List;

/**
 * Global thresholds used when no vendor/model row sets a value.
 *
 * @param upgradeWindow global window applied to devices without their own, or null
 */
public record PolicyDefaults(
    double maxCpuPercent,
    double minFreeMemPercent,
    int maxCriticalErrors,
    boolean blockIfCriticalErrors,
    Duration window,
    boolean requireMaintenanceWindow,
    List<String> preChecks,
    MaintenanceWindow upgradeWindow
) {

    public PolicyDefaults {
        preChecks = preChecks == null ? List.of() : List.copyOf(preChecks);
    }
}
