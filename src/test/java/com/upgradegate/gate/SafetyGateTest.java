package com.upgradegate.gate;

import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.ConditionOutcome;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.Verdict;
import com.upgradegate.policy.VerdictSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SafetyGateTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    private final Device device = new Device("R1", "edge-r1", "10.0.0.1", "cisco", "ISR4331",
        "16.9.4", "17.3.5", null, null);
    private final Policy policy = new Policy("cisco", "ISR4331", Policy.Origin.VENDOR_RULE, 75, 25, 0, true,
        false, null, Duration.ofHours(2), List.of());
    private final HealthSnapshot health = HealthSnapshot.of("R1", Duration.ofHours(2), 45.0, 60.0, 0);

    private final Verdict ruleApprove = new Verdict(true, "All conditions met: CPU 45% PASS (limit: 75%)",
        "17.3.5", 0.8, VerdictSource.RULE,
        List.of(new ConditionOutcome("cpu", "CPU", "45%", "limit: 75%", true)), List.of());
    private final Verdict ruleDeny = new Verdict(false, "Conditions failed: CPU 90% FAIL (limit: 75%)",
        "17.3.5", 0.8, VerdictSource.RULE,
        List.of(new ConditionOutcome("cpu", "CPU", "90%", "limit: 75%", false)), List.of());

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private SafetyGate gate(boolean enabled, Duration timeout, SemanticReviewClient client) {
        return new SafetyGate(new GateSettings(enabled, timeout, "reviewer-v1"), client, executor);
    }

    @Test
    @DisplayName("disabled gate passes the rule verdict through without calling the reviewer")
    void disabledPassesThrough() {
        AtomicInteger calls = new AtomicInteger();
        SafetyGate gate = gate(false, Duration.ofSeconds(1), request -> {
            calls.incrementAndGet();
            return new ReviewResponse(false, "no", 1.0, null);
        });

        assertSame(ruleApprove, gate.review(device, policy, health, ruleApprove));
        assertInstanceOf(GateOutcome.Disabled.class, gate.consult(device, policy, health, ruleApprove));
        assertEquals(0, calls.get());
    }

    @Nested
    @DisplayName("reviewer answers")
    class Reviewed {

        @Test
        void approvalReplacesReasonAndConfidenceButKeepsTarget() {
            AtomicReference<ReviewRequest> seen = new AtomicReference<>();
            SafetyGate gate = gate(true, Duration.ofSeconds(2), request -> {
                seen.set(request);
                return new ReviewResponse(true, "Stable load, safe to proceed", 0.93, List.of("verify_bgp_sessions"));
            });

            Verdict verdict = gate.review(device, policy, health, ruleApprove);

            assertTrue(verdict.approve());
            assertEquals(VerdictSource.GATE, verdict.source());
            assertEquals("Stable load, safe to proceed", verdict.reason());
            assertEquals(0.93, verdict.confidence());
            assertEquals("17.3.5", verdict.targetVersion());
            assertEquals(List.of("verify_bgp_sessions"), verdict.additionalChecks());
            assertEquals(ruleApprove.conditions(), verdict.conditions());
            assertSame(ruleApprove, seen.get().ruleVerdict());
            assertEquals("reviewer-v1", seen.get().model());
        }

        @Test
        void gateDenialOverridesRuleApproval() {
            SafetyGate gate = gate(true, Duration.ofSeconds(2),
                request -> new ReviewResponse(false, "Firmware has a known BGP regression", 0.7, null));

            Verdict verdict = gate.review(device, policy, health, ruleApprove);

            assertFalse(verdict.approve());
            assertEquals("Firmware has a known BGP regression", verdict.reason());
            assertEquals("17.3.5", verdict.targetVersion());
        }

        @Test
        @DisplayName("gate approval cannot overturn a rule denial")
        void cannotApproveWhatRulesDenied() {
            SafetyGate gate = gate(true, Duration.ofSeconds(2),
                request -> new ReviewResponse(true, "Looks fine", 0.9, null));

            Verdict verdict = gate.review(device, policy, health, ruleDeny);

            assertFalse(verdict.approve());
            assertEquals(VerdictSource.GATE, verdict.source());
            assertTrue(verdict.reason().contains("cannot overturn"), verdict.reason());
            assertTrue(verdict.reason().contains("CPU 90% FAIL"), verdict.reason());
        }
    }

    @Nested
    @DisplayName("fail-closed")
    class FailClosed {

        @Test
        void reviewerErrorDeniesEvenWhenRulesApprove() {
            SafetyGate gate = gate(true, Duration.ofSeconds(2), request -> {
                throw new SemanticReviewException("connection refused");
            });

            Verdict verdict = gate.review(device, policy, health, ruleApprove);

            assertFalse(verdict.approve());
            assertEquals(VerdictSource.GATE, verdict.source());
            assertEquals(0.0, verdict.confidence());
            assertEquals("17.3.5", verdict.targetVersion());
            assertTrue(verdict.reason().startsWith("Safety gate failed: "), verdict.reason());
            assertTrue(verdict.reason().contains("connection refused"), verdict.reason());
            assertTrue(verdict.reason().contains("rule verdict was approve"), verdict.reason());
        }

        @Test
        void timeoutDenies() {
            SafetyGate gate = gate(true, Duration.ofMillis(100), request -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new ReviewResponse(true, "late", 1.0, null);
            });

            GateOutcome outcome = gate.consult(device, policy, health, ruleApprove);
            GateOutcome.Failed failed = assertInstanceOf(GateOutcome.Failed.class, outcome);
            assertTrue(failed.cause().contains("timed out"), failed.cause());

            Verdict verdict = gate.review(device, policy, health, ruleApprove);
            assertFalse(verdict.approve());
        }

        @Test
        void malformedAnswerDenies() {
            SafetyGate gate = gate(true, Duration.ofSeconds(2),
                request -> new ReviewResponse(true, " ", 0.9, null));

            Verdict verdict = gate.review(device, policy, health, ruleApprove);

            assertFalse(verdict.approve());
            assertTrue(verdict.reason().contains("review response has no reason"), verdict.reason());
        }

        @Test
        void nullAnswerDenies() {
            SafetyGate gate = gate(true, Duration.ofSeconds(2), request -> null);

            assertFalse(gate.review(device, policy, health, ruleApprove).approve());
        }

        @Test
        void unexpectedRuntimeErrorDenies() {
            SafetyGate gate = gate(true, Duration.ofSeconds(2), request -> {
                throw new IllegalStateException("bug in client");
            });

            assertFalse(gate.review(device, policy, health, ruleApprove).approve());
        }
    }
}
