package com.upgradegate.audit;

import com.upgradegate.policy.Verdict;
import com.upgradegate.upgrade.AttemptKind;
import com.upgradegate.upgrade.UpgradeMode;
import com.upgradegate.upgrade.UpgradeRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for attempts and the append-only event log.
 * Implementations report failures as {@link AuditStoreException}.
 */
public interface AuditStore {

    /** Stores a new attempt in {@code pending} and returns it with its assigned id. */
    UpgradeRecord createAttempt(String deviceId, AttemptKind kind, UpgradeMode mode, Verdict verdict, Instant createdAt);

    /**
     * Overwrites the attempt's current state.
     *
     * @throws IllegalStateException if the stored status cannot move to the new one
     */
    void updateStatus(UpgradeRecord record);

    AuditEvent appendEvent(String deviceId, String attemptId, String eventName,
                           Map<String, Object> payload, Instant occurredAt);

    Optional<UpgradeRecord> findAttempt(String attemptId);

    /** Attempts for a device, oldest first. */
    List<UpgradeRecord> attempts(String deviceId);

    /** The device's latest {@code limit} events, in sequence order. */
    List<AuditEvent> events(String deviceId, int limit);

    long latestSequence();
}
