package com.upgradegate.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A managed router as known to the inventory. Read-only to the decision core.
 */
public record Device(
    @JsonProperty("id") String id,
    @JsonProperty("hostname") String hostname,
    @JsonProperty("mgmt_address") String mgmtAddress,
    @JsonProperty("vendor") String vendor,
    @JsonProperty("model") String model,
    @JsonProperty("current_version") String currentVersion,
    @JsonProperty("target_version") String targetVersion,
    @JsonProperty("maintenance_window") MaintenanceWindow maintenanceWindow,
    @JsonProperty("notes") String notes
) {

    public Device {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(currentVersion, "current_version");
    }

    /**
     * The configured target, or the current version when no target is set.
     * The latter is a no-op upgrade and is still a valid request.
     */
    public String upgradeTarget() {
        return targetVersion != null && !targetVersion.isBlank() ? targetVersion : currentVersion;
    }
}
