package com.upgradegate.audit;

import com.upgradegate.upgrade.UpgradeRecord;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds per-device history from the audit store by a full scan of the
 * device's events.
 */
@Service
public class DeviceHistoryService {

    static final int SCAN_LIMIT = 10000;

    private final AuditStore store;

    public DeviceHistoryService(AuditStore store) {
        this.store = store;
    }

    public Optional<DeviceHistory> history(String deviceId) {
        List<AuditEvent> events = store.events(deviceId, SCAN_LIMIT);
        List<UpgradeRecord> attempts = store.attempts(deviceId);
        if (events.isEmpty() && attempts.isEmpty()) {
            return Optional.empty();
        }

        long version = 0;
        DeviceHistory.DecisionSnapshot lastDecision = null;
        for (AuditEvent event : events) {
            version = Math.max(version, event.sequence());
            if (AuditRecorder.DECISION_RECORDED.equals(event.eventName())) {
                lastDecision = snapshot(event);
            }
        }

        List<UpgradeRecord> inFlight = attempts.stream().filter(a -> !a.isTerminal()).toList();
        return Optional.of(new DeviceHistory(deviceId, version, attempts, inFlight, lastDecision, events.size()));
    }

    /** The attempt for this device that has not reached a terminal status, if any. */
    public Optional<UpgradeRecord> activeAttempt(String deviceId) {
        return store.attempts(deviceId).stream().filter(a -> !a.isTerminal()).findFirst();
    }

    public List<UpgradeRecord> attempts(String deviceId) {
        return store.attempts(deviceId);
    }

    public List<AuditEvent> events(String deviceId, int limit) {
        return store.events(deviceId, limit);
    }

    private static DeviceHistory.DecisionSnapshot snapshot(AuditEvent event) {
        Map<String, Object> payload = event.payload();
        Object risk = payload.get("risk_score");
        return new DeviceHistory.DecisionSnapshot(
            event.sequence(),
            event.attemptId(),
            event.occurredAt() != null ? event.occurredAt().toString() : "",
            Boolean.TRUE.equals(payload.get("approve")),
            String.valueOf(payload.get("source")),
            String.valueOf(payload.get("reason")),
            risk instanceof Number n ? n.intValue() : null
        );
    }
}
