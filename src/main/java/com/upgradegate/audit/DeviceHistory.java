package com.upgradegate.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.upgradegate.upgrade.UpgradeRecord;

import java.util.List;

/**
 * Read-only view of a device's upgrade history, rebuilt from the audit store.
 * {@code historyVersion} is the highest event sequence consumed.
 */
public record DeviceHistory(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("history_version") long historyVersion,
    @JsonProperty("attempts") List<UpgradeRecord> attempts,
    @JsonProperty("in_flight") List<UpgradeRecord> inFlight,
    @JsonProperty("last_decision") DecisionSnapshot lastDecision,
    @JsonProperty("event_count") int eventCount
) {

    public record DecisionSnapshot(
        @JsonProperty("sequence") long sequence,
        @JsonProperty("attempt_id") String attemptId,
        @JsonProperty("occurred_at") String occurredAt,
        @JsonProperty("approve") boolean approve,
        @JsonProperty("source") String source,
        @JsonProperty("reason") String reason,
        @JsonProperty("risk_score") Integer riskScore
    ) {}
}
