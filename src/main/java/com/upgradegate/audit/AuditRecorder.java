package com.upgradegate.audit;

import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.ConditionOutcome;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.Verdict;
import com.upgradegate.upgrade.AttemptKind;
import com.upgradegate.upgrade.UpgradeMode;
import com.upgradegate.upgrade.UpgradeRecord;
import com.upgradegate.upgrade.UpgradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Writes decisions, attempts and status transitions to the {@link AuditStore}.
 *
 * <p>Every write either succeeds or throws {@link AuditStoreException}; callers
 * must not advance an attempt whose transition was not recorded.</p>
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    public static final String DECISION_RECORDED = "decision_recorded";
    public static final String ATTEMPT_CREATED = "attempt_created";
    public static final String STATUS_EVENT_PREFIX = "upgrade_status:";

    private final AuditStore store;
    private final Clock clock;

    public AuditRecorder(AuditStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public AuditEvent recordDecision(String attemptId, Device device, Policy policy, HealthSnapshot health,
                                     Verdict verdict, int riskScore) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approve", verdict.approve());
        payload.put("source", verdict.source().getValue());
        payload.put("reason", verdict.reason());
        payload.put("confidence", verdict.confidence());
        payload.put("target_version", verdict.targetVersion());
        payload.put("conditions", conditions(verdict.conditions()));
        payload.put("additional_checks", verdict.additionalChecks());
        payload.put("health", health(health));
        payload.put("risk_score", riskScore);
        payload.put("policy_origin", policy.origin().getValue());
        payload.put("vendor", device.vendor());
        payload.put("model", device.model());
        payload.put("current_version", device.currentVersion());

        return guarded("record decision for " + device.id(),
            () -> store.appendEvent(device.id(), attemptId, DECISION_RECORDED, payload, clock.instant()));
    }

    public UpgradeRecord openAttempt(String deviceId, AttemptKind kind, UpgradeMode mode, Verdict verdict) {
        return guarded("create attempt for " + deviceId, () -> {
            UpgradeRecord record = store.createAttempt(deviceId, kind, mode, verdict, clock.instant());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("kind", kind.getValue());
            payload.put("mode", mode != null ? mode.getValue() : null);
            payload.put("target_version", record.targetVersion());
            payload.put("approve", verdict != null && verdict.approve());
            store.appendEvent(deviceId, record.attemptId(), ATTEMPT_CREATED, payload, record.createdAt());
            log.info("Opened {} attempt {} for {}", kind.getValue(), record.attemptId(), deviceId);
            return record;
        });
    }

    /**
     * Moves the attempt to {@code next}, persists it and appends the matching
     * {@code upgrade_status:<status>} event.
     *
     * @throws IllegalStateException if the transition is not allowed
     * @throws AuditStoreException   if it could not be persisted
     */
    public UpgradeRecord transition(UpgradeRecord current, UpgradeStatus next, Map<String, Object> detail) {
        UpgradeRecord updated = current.transitionTo(next, clock.instant(), detail);
        return guarded("record " + next.getValue() + " for " + current.attemptId(), () -> {
            store.updateStatus(updated);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("from", current.status().getValue());
            payload.put("to", next.getValue());
            payload.put("detail", updated.detail());
            store.appendEvent(updated.deviceId(), updated.attemptId(), STATUS_EVENT_PREFIX + next.getValue(),
                payload, updated.updatedAt());
            log.info("Attempt {} for {}: {} -> {}", updated.attemptId(), updated.deviceId(),
                current.status().getValue(), next.getValue());
            return updated;
        });
    }

    /** The attempt as last persisted. */
    public Optional<UpgradeRecord> stored(String attemptId) {
        return guarded("read attempt " + attemptId, () -> store.findAttempt(attemptId));
    }

    private <T> T guarded(String action, Supplier<T> write) {
        try {
            return write.get();
        } catch (AuditStoreException | IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Audit store failed to {}: {}", action, e.getMessage());
            throw new AuditStoreException("failed to " + action, e);
        }
    }

    private static List<Map<String, Object>> conditions(List<ConditionOutcome> outcomes) {
        return outcomes.stream().map(c -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("condition", c.conditionId());
            m.put("measured", c.measured());
            m.put("threshold", c.threshold());
            m.put("passed", c.passed());
            return m;
        }).toList();
    }

    private static Map<String, Object> health(HealthSnapshot health) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("window", health.window().toString());
        m.put("cpu_avg", health.cpuAvg());
        m.put("mem_free_min", health.memFreeMin());
        m.put("critical_errors", health.criticalErrors());
        m.put("status", health.status().getValue());
        return m;
    }
}
