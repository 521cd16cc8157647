package com.upgradegate.upgrade;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.upgradegate.upgrade.UpgradeStatus.DENIED;
import static com.upgradegate.upgrade.UpgradeStatus.FAILED;
import static com.upgradegate.upgrade.UpgradeStatus.PENDING;
import static com.upgradegate.upgrade.UpgradeStatus.PLANNED;
import static com.upgradegate.upgrade.UpgradeStatus.PRECHECK;
import static com.upgradegate.upgrade.UpgradeStatus.PRECHECK_FAILED;
import static com.upgradegate.upgrade.UpgradeStatus.RUNNING;
import static com.upgradegate.upgrade.UpgradeStatus.SUCCESS;

/**
 * Each kind of attempt owns its transition graph. Upgrades can only reach
 * {@code running} through a successful {@code precheck}; rollbacks are
 * operator-initiated and go straight to {@code running}, or to {@code failed}
 * when they could not be started.
 */
public enum AttemptKind {
    UPGRADE(Map.of(
        PENDING, EnumSet.of(DENIED, PRECHECK),
        PRECHECK, EnumSet.of(PRECHECK_FAILED, RUNNING, PLANNED),
        RUNNING, EnumSet.of(SUCCESS, FAILED)
    )),
    ROLLBACK(Map.of(
        PENDING, EnumSet.of(RUNNING, FAILED),
        RUNNING, EnumSet.of(SUCCESS, FAILED)
    ));

    private final Map<UpgradeStatus, Set<UpgradeStatus>> transitions;

    AttemptKind(Map<UpgradeStatus, Set<UpgradeStatus>> transitions) {
        this.transitions = transitions;
    }

    public boolean allows(UpgradeStatus from, UpgradeStatus to) {
        return transitions.getOrDefault(from, Set.of()).contains(to);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
