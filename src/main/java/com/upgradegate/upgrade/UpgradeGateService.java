package com.upgradegate.upgrade;

import com.upgradegate.audit.AuditEvent;
import com.upgradegate.audit.AuditRecorder;
import com.upgradegate.audit.DeviceHistory;
import com.upgradegate.audit.DeviceHistoryService;
import com.upgradegate.inventory.Device;
import com.upgradegate.inventory.InventoryClient;
import com.upgradegate.policy.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry points used by presentation layers. Enforces at most one in-flight
 * attempt per device: requests for a device that is locked or has a
 * non-terminal attempt fail with {@link AttemptInProgressException}.
 */
@Service
public class UpgradeGateService {

    private static final Logger log = LoggerFactory.getLogger(UpgradeGateService.class);

    private final InventoryClient inventory;
    private final UpgradeDecisionService decisions;
    private final UpgradeOrchestrator orchestrator;
    private final AuditRecorder recorder;
    private final DeviceHistoryService history;
    private final DeviceLocks locks = new DeviceLocks();

    public UpgradeGateService(InventoryClient inventory,
                              UpgradeDecisionService decisions,
                              UpgradeOrchestrator orchestrator,
                              AuditRecorder recorder,
                              DeviceHistoryService history) {
        this.inventory = inventory;
        this.decisions = decisions;
        this.orchestrator = orchestrator;
        this.recorder = recorder;
        this.history = history;
    }

    /**
     * Evaluates without starting an attempt. The decision is still audited.
     * Holds the device's lock, so it is exclusive with upgrades, rollbacks and
     * other evaluations of the same device.
     */
    public Decision evaluate(String deviceId) {
        return locks.withLock(deviceId, () -> {
            rejectIfInFlight(deviceId);
            Decision decision = decisions.decide(deviceId);
            recorder.recordDecision(null, decision.device(), decision.policy(), decision.health(),
                decision.verdict(), decision.riskScore());
            return decision;
        });
    }

    public Verdict verdict(String deviceId) {
        return evaluate(deviceId).verdict();
    }

    public UpgradeRecord upgrade(String deviceId, UpgradeMode mode) {
        return locks.withLock(deviceId, () -> {
            rejectIfInFlight(deviceId);
            Decision decision = decisions.decide(deviceId);
            UpgradeRecord record = orchestrator.upgrade(decision, mode);
            log.info("Upgrade attempt {} for {} ended as {}", record.attemptId(), deviceId, record.status().getValue());
            return record;
        });
    }

    public UpgradeRecord rollback(String deviceId) {
        return locks.withLock(deviceId, () -> {
            rejectIfInFlight(deviceId);
            Device device = inventory.requireDevice(deviceId);
            UpgradeRecord record = orchestrator.rollback(device);
            log.info("Rollback attempt {} for {} ended as {}", record.attemptId(), deviceId, record.status().getValue());
            return record;
        });
    }

    public List<UpgradeRecord> attempts(String deviceId) {
        inventory.requireDevice(deviceId);
        return history.attempts(deviceId);
    }

    public List<AuditEvent> auditTrail(String deviceId, int limit) {
        inventory.requireDevice(deviceId);
        return history.events(deviceId, limit);
    }

    public Optional<DeviceHistory> history(String deviceId) {
        inventory.requireDevice(deviceId);
        return history.history(deviceId);
    }

    private void rejectIfInFlight(String deviceId) {
        history.activeAttempt(deviceId).ifPresent(active -> {
            throw new AttemptInProgressException(deviceId, active.attemptId());
        });
    }
}
