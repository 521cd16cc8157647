package com.upgradegate.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Write-once audit entry. {@code sequence} orders events globally.
 *
 * @param attemptId null for events not tied to an attempt, such as standalone decisions
 */
public record AuditEvent(
    @JsonProperty("sequence") long sequence,
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("attempt_id") String attemptId,
    @JsonProperty("event") String eventName,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("occurred_at") Instant occurredAt
) {
}
