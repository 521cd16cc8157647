package com.upgradegate.gate;

import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.Verdict;
import com.upgradegate.policy.VerdictSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Optional second opinion on a rule verdict, failing closed.
 *
 * <ul>
 *   <li>disabled: the rule verdict passes through unchanged</li>
 *   <li>reviewed: the reviewer's reason and confidence replace the rule's;
 *       approval requires both rule and reviewer to approve</li>
 *   <li>failed (error, timeout, malformed answer): deny, whatever the rule said</li>
 * </ul>
 * The target version always comes from the rule verdict.
 */
public class SafetyGate {

    private static final Logger log = LoggerFactory.getLogger(SafetyGate.class);

    private final GateSettings settings;
    private final SemanticReviewClient client;
    private final Executor executor;

    public SafetyGate(GateSettings settings, SemanticReviewClient client, Executor executor) {
        this.settings = settings;
        this.client = client;
        this.executor = executor;
    }

    public Verdict review(Device device, Policy policy, HealthSnapshot health, Verdict ruleVerdict) {
        GateOutcome outcome = consult(device, policy, health, ruleVerdict);

        if (outcome instanceof GateOutcome.Reviewed reviewed) {
            return applyOpinion(device, ruleVerdict, reviewed.response());
        }
        if (outcome instanceof GateOutcome.Failed failed) {
            log.warn("Safety gate failed for device {}, denying: {}", device.id(), failed.cause());
            return ruleVerdict.deny("Safety gate failed: " + failed.cause()
                + " (rule verdict was " + (ruleVerdict.approve() ? "approve" : "deny") + ")", VerdictSource.GATE);
        }
        return ruleVerdict;
    }

    public GateOutcome consult(Device device, Policy policy, HealthSnapshot health, Verdict ruleVerdict) {
        if (!settings.enabled()) {
            return new GateOutcome.Disabled();
        }

        ReviewRequest request = new ReviewRequest(device, policy, health, ruleVerdict, settings.model());
        CompletableFuture<ReviewResponse> call;
        try {
            call = CompletableFuture.supplyAsync(() -> client.review(request), executor);
        } catch (RuntimeException ex) {
            return new GateOutcome.Failed("review could not be dispatched: " + ex.getMessage());
        }

        try {
            ReviewResponse response = call.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                return new GateOutcome.Failed("review service returned no opinion");
            }
            return new GateOutcome.Reviewed(response);
        } catch (TimeoutException ex) {
            call.cancel(true);
            return new GateOutcome.Failed("review timed out after " + settings.timeout().toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            return new GateOutcome.Failed(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return new GateOutcome.Failed("interrupted while awaiting review");
        }
    }

    private Verdict applyOpinion(Device device, Verdict ruleVerdict, ReviewResponse response) {
        boolean approve = ruleVerdict.approve() && response.approve();
        String reason = response.reason();
        if (!ruleVerdict.approve() && response.approve()) {
            reason = "Rule evaluation denied and the gate cannot overturn it. Gate opinion: " + response.reason()
                + " | " + ruleVerdict.reason();
        }

        log.info("Safety gate reviewed device {}: rule={} gate={} final={} confidence={}",
            device.id(), ruleVerdict.approve(), response.approve(), approve, response.confidence());

        return new Verdict(approve, reason, ruleVerdict.targetVersion(), response.confidence(),
            VerdictSource.GATE, ruleVerdict.conditions(), response.additionalChecks());
    }
}
