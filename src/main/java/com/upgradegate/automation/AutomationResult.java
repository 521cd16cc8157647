package com.upgradegate.automation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the backend reported. {@code detail} is kept verbatim (exit status,
 * stdout, stderr or backend-specific fields) and is present on failure too.
 */
public record AutomationResult(boolean success, Map<String, Object> detail) {

    public AutomationResult {
        // detail values may be null
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static AutomationResult succeeded(Map<String, Object> detail) {
        return new AutomationResult(true, detail);
    }

    public static AutomationResult failed(Map<String, Object> detail) {
        return new AutomationResult(false, detail);
    }
}
