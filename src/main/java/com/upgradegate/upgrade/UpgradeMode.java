package com.upgradegate.upgrade;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum UpgradeMode {
    /** Stop after a successful precheck. */
    PLAN_ONLY("plan_only"),
    EXECUTE("execute");

    private final String value;

    UpgradeMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UpgradeMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown upgrade mode: " + raw
                + " (expected plan_only or execute)"));
    }
}
