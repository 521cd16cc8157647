package com.upgradegate.upgrade;

import com.upgradegate.audit.AuditEvent;
import com.upgradegate.audit.AuditRecorder;
import com.upgradegate.audit.DeviceHistoryService;
import com.upgradegate.audit.InMemoryAuditStore;
import com.upgradegate.automation.AutomationMode;
import com.upgradegate.automation.AutomationResult;
import com.upgradegate.gate.GateSettings;
import com.upgradegate.gate.ReviewResponse;
import com.upgradegate.gate.SafetyGate;
import com.upgradegate.health.HealthAggregator;
import com.upgradegate.health.InMemoryTelemetry;
import com.upgradegate.health.TelemetryMetric;
import com.upgradegate.inventory.Device;
import com.upgradegate.inventory.DeviceNotFoundException;
import com.upgradegate.inventory.InMemoryInventory;
import com.upgradegate.inventory.PolicyRule;
import com.upgradegate.policy.PolicyDefaults;
import com.upgradegate.policy.PolicyEvaluator;
import com.upgradegate.policy.PolicyStore;
import com.upgradegate.policy.PreCheckPlanner;
import com.upgradegate.policy.RiskScorer;
import com.upgradegate.support.ScriptedAutomationBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UpgradeGateServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);
    private final ExecutorService executor = Executors.newCachedThreadPool();

    private final InMemoryInventory inventory = new InMemoryInventory();
    private final InMemoryTelemetry telemetry = new InMemoryTelemetry(clock);
    private final InMemoryAuditStore store = new InMemoryAuditStore();
    private final ScriptedAutomationBackend backend = new ScriptedAutomationBackend();

    private UpgradeGateService service;

    @BeforeEach
    void wire() {
        inventory.register(new Device("R1", "edge-r1", "10.0.0.1", "cisco", "ISR4331", "16.9.4", "17.3.5", null, null));
        inventory.register(PolicyRule.thresholds("cisco", "ISR4331", 75.0, 25.0));
        healthy("R1");

        service = serviceWith(new SafetyGate(new GateSettings(false, Duration.ofSeconds(1), ""), request -> {
            throw new AssertionError("gate is disabled");
        }, executor));
    }

    private UpgradeGateService serviceWith(SafetyGate gate) {
        PolicyStore policyStore = new PolicyStore(
            new PolicyDefaults(70.0, 30.0, 0, true, Duration.ofHours(2), false, List.of("connectivity_check"), null),
            List.of(), new PreCheckPlanner());
        UpgradeDecisionService decisions = new UpgradeDecisionService(inventory, policyStore,
            new HealthAggregator(telemetry, executor, Duration.ofSeconds(2)),
            new PolicyEvaluator(PolicyEvaluator.standardConditions(), clock),
            gate,
            new RiskScorer());
        AuditRecorder recorder = new AuditRecorder(store, clock);

        return new UpgradeGateService(inventory, decisions, new UpgradeOrchestrator(recorder, backend, clock),
            recorder, new DeviceHistoryService(store));
    }

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private void healthy(String deviceId) {
        telemetry.record(deviceId, TelemetryMetric.CPU_USAGE, 45.0);
        telemetry.record(deviceId, TelemetryMetric.MEM_FREE, 60.0);
    }

    @Test
    void evaluateAuditsDecisionWithoutOpeningAttempt() {
        Decision decision = service.evaluate("R1");

        assertTrue(decision.verdict().approve(), decision.verdict().reason());
        assertEquals(0, decision.riskScore());
        assertTrue(store.attempts("R1").isEmpty());

        List<AuditEvent> events = store.events("R1", 10);
        assertEquals(1, events.size());
        assertEquals(AuditRecorder.DECISION_RECORDED, events.get(0).eventName());
        assertNull(events.get(0).attemptId());
        assertEquals(0, events.get(0).payload().get("risk_score"));
    }

    @Test
    void unknownDeviceIsNotFound() {
        assertThrows(DeviceNotFoundException.class, () -> service.upgrade("R404", UpgradeMode.EXECUTE));
        assertThrows(DeviceNotFoundException.class, () -> service.evaluate("R404"));
        assertThrows(DeviceNotFoundException.class, () -> service.attempts("R404"));
        assertTrue(backend.requests().isEmpty());
    }

    @Test
    @DisplayName("two simultaneous upgrades: one proceeds, the other is rejected")
    void concurrentUpgradesAreExclusive() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        backend.answer(AutomationMode.CHECK, request -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AutomationResult.succeeded(Map.of("returncode", 0));
        });

        CountDownLatch go = new CountDownLatch(1);
        Future<UpgradeRecord> first = executor.submit(() -> {
            go.await();
            return service.upgrade("R1", UpgradeMode.EXECUTE);
        });
        Future<UpgradeRecord> second = executor.submit(() -> {
            go.await();
            return service.upgrade("R1", UpgradeMode.EXECUTE);
        });
        go.countDown();

        assertTrue(entered.await(5, TimeUnit.SECONDS), "one request should reach the precheck");
        // the winner is parked in the precheck, so the other request can only finish by being rejected
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!first.isDone() && !second.isDone() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        release.countDown();

        int succeeded = 0;
        int rejected = 0;
        for (Future<UpgradeRecord> f : List.of(first, second)) {
            try {
                assertEquals(UpgradeStatus.SUCCESS, f.get(5, TimeUnit.SECONDS).status());
                succeeded++;
            } catch (ExecutionException e) {
                assertInstanceOf(AttemptInProgressException.class, e.getCause());
                rejected++;
            }
        }
        assertEquals(1, succeeded);
        assertEquals(1, rejected);
        assertEquals(1, store.attempts("R1").size());
        assertEquals(List.of(AutomationMode.CHECK, AutomationMode.APPLY), backend.modes());
    }

    @Test
    void evaluateIsRejectedWhileUpgradeRuns() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        backend.answer(AutomationMode.APPLY, request -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AutomationResult.succeeded(Map.of());
        });

        Future<UpgradeRecord> running = executor.submit(() -> service.upgrade("R1", UpgradeMode.EXECUTE));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertThrows(AttemptInProgressException.class, () -> service.evaluate("R1"));
        assertThrows(AttemptInProgressException.class, () -> service.rollback("R1"));

        release.countDown();
        assertEquals(UpgradeStatus.SUCCESS, running.get(5, TimeUnit.SECONDS).status());
    }

    @Test
    @DisplayName("an evaluation in progress holds the device against upgrades and other evaluations")
    void evaluationHoldsTheDevice() throws Exception {
        CountDownLatch reviewing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        UpgradeGateService gated = serviceWith(new SafetyGate(new GateSettings(true, Duration.ofSeconds(10), ""),
            request -> {
                reviewing.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new ReviewResponse(true, "looks safe", 0.9, List.of());
            }, executor));

        Future<Decision> evaluation = executor.submit(() -> gated.evaluate("R1"));
        assertTrue(reviewing.await(5, TimeUnit.SECONDS));

        assertThrows(AttemptInProgressException.class, () -> gated.upgrade("R1", UpgradeMode.EXECUTE));
        assertThrows(AttemptInProgressException.class, () -> gated.evaluate("R1"));

        release.countDown();
        assertTrue(evaluation.get(5, TimeUnit.SECONDS).verdict().approve());
        assertTrue(backend.requests().isEmpty());
        assertTrue(store.attempts("R1").isEmpty());
    }

    @Test
    @DisplayName("a stored non-terminal attempt blocks new requests")
    void nonTerminalAttemptBlocks() {
        UpgradeRecord stuck = store.createAttempt("R1", AttemptKind.UPGRADE, UpgradeMode.EXECUTE, null, clock.instant());

        AttemptInProgressException ex = assertThrows(AttemptInProgressException.class,
            () -> service.upgrade("R1", UpgradeMode.EXECUTE));
        assertEquals(stuck.attemptId(), ex.getAttemptId());
        assertEquals("R1", ex.getDeviceId());
        assertTrue(backend.requests().isEmpty());
    }

    @Test
    void terminalAttemptsDoNotBlockRetries() {
        backend.respond(AutomationMode.APPLY, AutomationResult.failed(Map.of("returncode", 2)));
        assertEquals(UpgradeStatus.FAILED, service.upgrade("R1", UpgradeMode.EXECUTE).status());

        backend.reset();
        assertEquals(UpgradeStatus.SUCCESS, service.upgrade("R1", UpgradeMode.EXECUTE).status());
        assertEquals(2, service.attempts("R1").size());
    }

    @Test
    void rollbackAfterUpgrade() {
        service.upgrade("R1", UpgradeMode.EXECUTE);
        UpgradeRecord rollback = service.rollback("R1");

        assertEquals(AttemptKind.ROLLBACK, rollback.kind());
        assertEquals(UpgradeStatus.SUCCESS, rollback.status());
        assertEquals(List.of(AttemptKind.UPGRADE, AttemptKind.ROLLBACK),
            service.attempts("R1").stream().map(UpgradeRecord::kind).toList());
    }

    @Test
    void historySummarisesAttemptsAndLastDecision() {
        telemetry.record("R1", TelemetryMetric.MEM_FREE, 5.0);
        service.upgrade("R1", UpgradeMode.PLAN_ONLY);

        var history = service.history("R1").orElseThrow();
        assertEquals(1, history.attempts().size());
        assertTrue(history.inFlight().isEmpty());
        assertFalse(history.lastDecision().approve());
        assertEquals(store.latestSequence(), history.historyVersion());
        assertEquals(UpgradeStatus.DENIED, history.attempts().get(0).status());
        assertEquals(history.eventCount(), service.auditTrail("R1", 100).size());
    }
}
