package com.upgradegate.policy;

import com.upgradegate.config.UpgradeGateProperties;
import com.upgradegate.health.WindowDurations;
import com.upgradegate.inventory.InventoryConfiguration;
import com.upgradegate.inventory.MaintenanceWindow;
import com.upgradegate.inventory.PolicyRule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class PolicyConfiguration {

    @Bean
    public PreCheckPlanner preCheckPlanner() {
        return new PreCheckPlanner();
    }

    /**
     * Converts {@code upgrade-gate.policy} into the immutable store. A
     * malformed window or day name fails startup here.
     */
    @Bean
    public PolicyStore policyStore(UpgradeGateProperties properties, PreCheckPlanner preCheckPlanner) {
        UpgradeGateProperties.PolicyProperties policy = properties.getPolicy();
        UpgradeGateProperties.Defaults d = policy.getDefaults();
        UpgradeGateProperties.Window w = policy.getUpgradeWindow();

        PolicyDefaults defaults = new PolicyDefaults(
            d.getMaxCpuPercent(),
            d.getMinFreeMemPercent(),
            d.getMaxCriticalErrors(),
            d.isBlockIfCriticalErrors(),
            WindowDurations.parse(d.getWindow()),
            d.isRequireMaintenanceWindow(),
            d.getPreChecks(),
            w == null ? null : MaintenanceWindow.of(w.getStartHour(), w.getEndHour(), w.getAllowedDays(), w.getZone())
        );

        List<PolicyRule> rules = policy.getVendorRules().stream()
            .map(InventoryConfiguration::toPolicyRule)
            .toList();

        return new PolicyStore(defaults, rules, preCheckPlanner);
    }

    @Bean
    public PolicyEvaluator policyEvaluator(Clock clock) {
        return new PolicyEvaluator(PolicyEvaluator.standardConditions(), clock);
    }

    @Bean
    public RiskScorer riskScorer() {
        return new RiskScorer();
    }
}
