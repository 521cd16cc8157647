package com.upgradegate.automation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AutomationMode {
    /** Dry run; must not change the device. */
    CHECK,
    APPLY,
    ROLLBACK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
