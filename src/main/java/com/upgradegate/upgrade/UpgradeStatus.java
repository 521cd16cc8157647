package com.upgradegate.upgrade;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UpgradeStatus {
    PENDING(false),
    DENIED(true),
    PRECHECK(false),
    PRECHECK_FAILED(true),
    /** Plan-only attempt whose precheck passed; nothing was executed. */
    PLANNED(true),
    RUNNING(false),
    SUCCESS(true),
    FAILED(true);

    private final boolean terminal;

    UpgradeStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
