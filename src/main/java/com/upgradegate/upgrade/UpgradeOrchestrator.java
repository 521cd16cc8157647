package com.upgradegate.upgrade;

import com.upgradegate.audit.AuditRecorder;
import com.upgradegate.audit.AuditStoreException;
import com.upgradegate.automation.AutomationBackend;
import com.upgradegate.automation.AutomationMode;
import com.upgradegate.automation.AutomationRequest;
import com.upgradegate.automation.AutomationResult;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.Verdict;
import com.upgradegate.policy.VerdictSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one attempt through its status graph against the automation backend.
 *
 * <p>Every transition is recorded before the next step starts. A denied
 * verdict never reaches the backend; a failed precheck never reaches
 * {@code running}. Once the real run has started the orchestrator waits for
 * its result, and it never retries.</p>
 *
 * <p>Audit-store failures abort the attempt: while still {@code pending} it is
 * closed as {@code denied} (rollbacks: {@code failed}) and the exception is
 * rethrown; later it ends as {@code precheck_failed} or {@code failed}.</p>
 *
 * <p>Callers hold the device's lock for the whole call.</p>
 */
@Service
public class UpgradeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(UpgradeOrchestrator.class);

    private final AuditRecorder recorder;
    private final AutomationBackend backend;
    private final Clock clock;

    public UpgradeOrchestrator(AuditRecorder recorder, AutomationBackend backend, Clock clock) {
        this.recorder = recorder;
        this.backend = backend;
        this.clock = clock;
    }

    public UpgradeRecord upgrade(Decision decision, UpgradeMode mode) {
        Device device = decision.device();
        Verdict verdict = decision.verdict();

        UpgradeRecord attempt = recorder.openAttempt(device.id(), AttemptKind.UPGRADE, mode, verdict);
        try {
            recorder.recordDecision(attempt.attemptId(), device, decision.policy(), decision.health(),
                verdict, decision.riskScore());

            if (!verdict.approve()) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("reason", verdict.reason());
                detail.put("source", verdict.source().getValue());
                return recorder.transition(attempt, UpgradeStatus.DENIED, detail);
            }

            attempt = recorder.transition(attempt, UpgradeStatus.PRECHECK, Map.of());
            Map<String, Object> checkVars = new LinkedHashMap<>();
            checkVars.put("pre_checks", decision.policy().requiredPreChecks());
            checkVars.put("additional_checks", verdict.additionalChecks());
            checkVars.put("current_version", device.currentVersion());
            AutomationResult check = invoke(attempt, AutomationMode.CHECK, checkVars);
            if (!check.success()) {
                log.warn("Precheck failed for {} (attempt {})", device.id(), attempt.attemptId());
                return recorder.transition(attempt, UpgradeStatus.PRECHECK_FAILED, check.detail());
            }

            if (mode == UpgradeMode.PLAN_ONLY) {
                return recorder.transition(attempt, UpgradeStatus.PLANNED, check.detail());
            }

            attempt = recorder.transition(attempt, UpgradeStatus.RUNNING, Map.of());
        } catch (AuditStoreException e) {
            return abort(attempt, e, Map.of());
        }

        AutomationResult applied = invoke(attempt, AutomationMode.APPLY, Map.of("current_version", device.currentVersion()));
        if (!applied.success()) {
            log.warn("Upgrade of {} to {} failed (attempt {})", device.id(), attempt.targetVersion(), attempt.attemptId());
        }
        try {
            return recorder.transition(attempt, applied.success() ? UpgradeStatus.SUCCESS : UpgradeStatus.FAILED,
                applied.detail());
        } catch (AuditStoreException e) {
            return abort(attempt, e, applied.detail());
        }
    }

    /**
     * Reinstalls the device's current version. Operator-initiated, so there is
     * no evaluation and no precheck.
     */
    public UpgradeRecord rollback(Device device) {
        Verdict verdict = new Verdict(true, "Rollback to " + device.currentVersion() + " requested by operator",
            device.currentVersion(), 1.0, VerdictSource.OPERATOR, List.of(), List.of());

        UpgradeRecord attempt = recorder.openAttempt(device.id(), AttemptKind.ROLLBACK, null, verdict);
        try {
            attempt = recorder.transition(attempt, UpgradeStatus.RUNNING, Map.of());
        } catch (AuditStoreException e) {
            return abort(attempt, e, Map.of());
        }

        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("rollback_from", device.upgradeTarget());
        AutomationResult result = invoke(attempt, AutomationMode.ROLLBACK, vars);
        if (!result.success()) {
            log.warn("Rollback of {} to {} failed (attempt {})", device.id(), device.currentVersion(), attempt.attemptId());
        }
        try {
            return recorder.transition(attempt, result.success() ? UpgradeStatus.SUCCESS : UpgradeStatus.FAILED,
                result.detail());
        } catch (AuditStoreException e) {
            return abort(attempt, e, result.detail());
        }
    }

    private AutomationResult invoke(UpgradeRecord attempt, AutomationMode mode, Map<String, Object> extraVars) {
        AutomationRequest request = new AutomationRequest(attempt.deviceId(), attempt.targetVersion(), mode, extraVars);
        try {
            return backend.run(request);
        } catch (RuntimeException e) {
            log.warn("Automation backend call ({}) for {} raised: {}", mode.getValue(), attempt.deviceId(), e.getMessage());
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("router_id", attempt.deviceId());
            detail.put("mode", mode.getValue());
            detail.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            return AutomationResult.failed(detail);
        }
    }

    private UpgradeRecord abort(UpgradeRecord attempt, AuditStoreException cause, Map<String, Object> backendDetail) {
        // the failed write may have stored the new status before its event was lost
        UpgradeRecord current = lastPersisted(attempt);
        if (current.isTerminal()) {
            log.error("Attempt {} for {} is stored as {} but its status event was not recorded",
                current.attemptId(), current.deviceId(), current.status().getValue());
            return current;
        }

        UpgradeStatus terminal = switch (current.status()) {
            case PENDING -> current.kind() == AttemptKind.UPGRADE ? UpgradeStatus.DENIED : UpgradeStatus.FAILED;
            case PRECHECK -> UpgradeStatus.PRECHECK_FAILED;
            case RUNNING -> UpgradeStatus.FAILED;
            default -> throw new IllegalStateException("cannot abort attempt " + current.attemptId()
                + " in status " + current.status().getValue(), cause);
        };

        Map<String, Object> detail = new LinkedHashMap<>(backendDetail);
        detail.put("error", "audit store unavailable: " + cause.getMessage());

        UpgradeRecord aborted;
        try {
            aborted = recorder.transition(current, terminal, detail);
        } catch (AuditStoreException e) {
            log.error("Attempt {} for {} could not be recorded as {}; stored status may be stale",
                current.attemptId(), current.deviceId(), terminal.getValue());
            aborted = current.transitionTo(terminal, clock.instant(), detail);
        }

        if (current.status() == UpgradeStatus.PENDING) {
            throw cause;
        }
        return aborted;
    }

    private UpgradeRecord lastPersisted(UpgradeRecord attempt) {
        try {
            return recorder.stored(attempt.attemptId()).orElse(attempt);
        } catch (AuditStoreException e) {
            log.warn("Could not re-read attempt {}: {}", attempt.attemptId(), e.getMessage());
            return attempt;
        }
    }
}
