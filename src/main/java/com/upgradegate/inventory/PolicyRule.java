package com.upgradegate.inventory;

import java.util.Locale;

/**
 * A vendor/model policy row. Threshold fields are nullable; a null means
 * "use the global default".
 */
public record PolicyRule(
    String vendor,
    String model,
    Double maxCpuPercent,
    Double minFreeMemPercent,
    Integer maxCriticalErrors,
    Boolean blockIfCriticalErrors,
    boolean compatibilityCheck,
    Integer minimumMemoryMb,
    Integer bootflashRequirementMb
) {

    public static PolicyRule thresholds(String vendor, String model, Double maxCpuPercent, Double minFreeMemPercent) {
        return new PolicyRule(vendor, model, maxCpuPercent, minFreeMemPercent, null, null, false, null, null);
    }

    /** Exact, case-insensitive vendor and model match. */
    public boolean matchesExactly(String deviceVendor, String deviceModel) {
        return vendor.equalsIgnoreCase(deviceVendor) && model.equalsIgnoreCase(deviceModel);
    }

    /** Case-insensitive vendor match with a model substring match in either direction. */
    public boolean matchesLoosely(String deviceVendor, String deviceModel) {
        if (!vendor.equalsIgnoreCase(deviceVendor)) {
            return false;
        }
        String ruleModel = model.toLowerCase(Locale.ROOT);
        String candidate = deviceModel.toLowerCase(Locale.ROOT);
        return candidate.contains(ruleModel) || ruleModel.contains(candidate);
    }
}
