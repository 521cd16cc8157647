package com.upgradegate.upgrade;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.upgradegate.policy.Verdict;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Current state of one attempt. Instances are immutable; a transition
 * returns a new record and the audit store keeps the latest one.
 *
 * @param mode   requested mode for upgrades, null for rollbacks
 * @param detail failure or backend detail attached by the latest transition
 */
public record UpgradeRecord(
    @JsonProperty("attempt_id") String attemptId,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("kind") AttemptKind kind,
    @JsonProperty("mode") UpgradeMode mode,
    @JsonProperty("verdict") Verdict verdict,
    @JsonProperty("status") UpgradeStatus status,
    @JsonProperty("target_version") String targetVersion,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("detail") Map<String, Object> detail
) {

    public UpgradeRecord {
        Objects.requireNonNull(attemptId, "attemptId");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static UpgradeRecord pending(String attemptId, String deviceId, AttemptKind kind, UpgradeMode mode,
                                        Verdict verdict, Instant createdAt) {
        return new UpgradeRecord(attemptId, deviceId, kind, mode, verdict, UpgradeStatus.PENDING,
            verdict != null ? verdict.targetVersion() : null, createdAt, createdAt, null, Map.of());
    }

    /**
     * @throws IllegalStateException if the kind's graph does not allow the move,
     *                               which includes leaving a terminal status
     */
    public UpgradeRecord transitionTo(UpgradeStatus next, Instant at, Map<String, Object> transitionDetail) {
        if (!kind.allows(status, next)) {
            throw new IllegalStateException("attempt " + attemptId + " (" + kind.getValue() + ") cannot move from "
                + status.getValue() + " to " + next.getValue());
        }
        return new UpgradeRecord(attemptId, deviceId, kind, mode, verdict, next, targetVersion, createdAt, at,
            next.isTerminal() ? at : null, transitionDetail);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
