package com.upgradegate.upgrade;

import com.upgradegate.gate.SafetyGate;
import com.upgradegate.health.HealthAggregator;
import com.upgradegate.health.HealthSnapshot;
import com.upgradegate.inventory.Device;
import com.upgradegate.inventory.InventoryClient;
import com.upgradegate.inventory.PolicyRule;
import com.upgradegate.policy.Policy;
import com.upgradegate.policy.PolicyEvaluator;
import com.upgradegate.policy.PolicyStore;
import com.upgradegate.policy.RiskScorer;
import com.upgradegate.policy.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Inventory lookup, policy resolution, health aggregation, rule evaluation and
 * safety review for one device. Has no side effects.
 */
@Service
public class UpgradeDecisionService {

    private static final Logger log = LoggerFactory.getLogger(UpgradeDecisionService.class);

    private final InventoryClient inventory;
    private final PolicyStore policyStore;
    private final HealthAggregator healthAggregator;
    private final PolicyEvaluator evaluator;
    private final SafetyGate safetyGate;
    private final RiskScorer riskScorer;

    public UpgradeDecisionService(InventoryClient inventory,
                                  PolicyStore policyStore,
                                  HealthAggregator healthAggregator,
                                  PolicyEvaluator evaluator,
                                  SafetyGate safetyGate,
                                  RiskScorer riskScorer) {
        this.inventory = inventory;
        this.policyStore = policyStore;
        this.healthAggregator = healthAggregator;
        this.evaluator = evaluator;
        this.safetyGate = safetyGate;
        this.riskScorer = riskScorer;
    }

    /**
     * @throws com.upgradegate.inventory.DeviceNotFoundException if the device is unknown
     */
    public Decision decide(String deviceId) {
        Device device = inventory.requireDevice(deviceId);
        Optional<PolicyRule> inventoryRule = inventory.findPolicy(device.vendor(), device.model());
        Policy policy = policyStore.resolve(device, inventoryRule);

        HealthSnapshot health = healthAggregator.aggregate(deviceId, policy.window());
        Verdict ruleVerdict = evaluator.evaluate(device, policy, health);
        Verdict verdict = safetyGate.review(device, policy, health, ruleVerdict);
        int risk = riskScorer.score(health);

        log.info("Decision for {}: approve={} source={} health={} risk={}",
            deviceId, verdict.approve(), verdict.source().getValue(), health.status().getValue(), risk);
        return new Decision(device, policy, health, ruleVerdict, verdict, risk);
    }
}
