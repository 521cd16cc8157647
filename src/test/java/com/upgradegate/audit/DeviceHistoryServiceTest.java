package com.upgradegate.audit;

import com.upgradegate.upgrade.AttemptKind;
import com.upgradegate.upgrade.UpgradeMode;
import com.upgradegate.upgrade.UpgradeRecord;
import com.upgradegate.upgrade.UpgradeStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeviceHistoryServiceTest {

    private static final Instant T0 = Instant.parse("2026-10-19T12:00:00Z");

    private final InMemoryAuditStore store = new InMemoryAuditStore();
    private final DeviceHistoryService service = new DeviceHistoryService(store);

    @Test
    void emptyWhenDeviceHasNoHistory() {
        assertTrue(service.history("R1").isEmpty());
        assertTrue(service.activeAttempt("R1").isEmpty());
    }

    @Test
    void lastDecisionIsTheMostRecentOne() {
        store.appendEvent("R1", null, AuditRecorder.DECISION_RECORDED,
            Map.of("approve", true, "source", "rule", "reason", "ok", "risk_score", 10), T0);
        store.appendEvent("R2", null, AuditRecorder.DECISION_RECORDED,
            Map.of("approve", true, "source", "rule", "reason", "other device", "risk_score", 0), T0);
        AuditEvent latest = store.appendEvent("R1", "att-7", AuditRecorder.DECISION_RECORDED,
            Map.of("approve", false, "source", "gate", "reason", "gate timeout", "risk_score", 35), T0.plusSeconds(60));

        DeviceHistory history = service.history("R1").orElseThrow();

        assertEquals(2, history.eventCount());
        assertEquals(latest.sequence(), history.historyVersion());
        DeviceHistory.DecisionSnapshot decision = history.lastDecision();
        assertFalse(decision.approve());
        assertEquals("gate", decision.source());
        assertEquals("gate timeout", decision.reason());
        assertEquals(35, decision.riskScore());
        assertEquals("att-7", decision.attemptId());
        assertEquals("2026-10-19T12:01:00Z", decision.occurredAt());
    }

    @Test
    void inFlightListsOnlyNonTerminalAttempts() {
        UpgradeRecord done = store.createAttempt("R1", AttemptKind.UPGRADE, UpgradeMode.EXECUTE, null, T0);
        store.updateStatus(done.transitionTo(UpgradeStatus.DENIED, T0, Map.of()));
        UpgradeRecord running = store.createAttempt("R1", AttemptKind.ROLLBACK, null, null, T0);
        store.updateStatus(running.transitionTo(UpgradeStatus.RUNNING, T0, Map.of()));

        DeviceHistory history = service.history("R1").orElseThrow();

        assertEquals(2, history.attempts().size());
        assertEquals(1, history.inFlight().size());
        assertEquals(running.attemptId(), history.inFlight().get(0).attemptId());
        assertNull(history.lastDecision());
        assertEquals(running.attemptId(), service.activeAttempt("R1").orElseThrow().attemptId());
    }
}
