package com.upgradegate.automation;

import java.util.Map;
import java.util.Objects;

/**
 * @param extraVars additional playbook variables, e.g. the pre-checks to run
 */
public record AutomationRequest(String deviceId, String targetVersion, AutomationMode mode, Map<String, Object> extraVars) {

    public AutomationRequest {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(targetVersion, "targetVersion");
        Objects.requireNonNull(mode, "mode");
        extraVars = extraVars == null ? Map.of() : Map.copyOf(extraVars);
    }
}
