package com.upgradegate.policy;

import com.upgradegate.inventory.Device;
import com.upgradegate.inventory.PolicyRule;

import java.util.List;
import java.util.Optional;

/**
 * Global defaults plus the configured vendor/model rules. Built once at
 * startup and never mutated.
 *
 * <p>Resolution order for a device: the inventory's policy row, then the
 * configured vendor rule (exact model match first, then substring), then the
 * defaults. Any threshold the chosen row leaves unset comes from the defaults.</p>
 */
public final class PolicyStore {

    private final PolicyDefaults defaults;
    private final List<PolicyRule> vendorRules;
    private final PreCheckPlanner preCheckPlanner;

    public PolicyStore(PolicyDefaults defaults, List<PolicyRule> vendorRules, PreCheckPlanner preCheckPlanner) {
        this.defaults = defaults;
        this.vendorRules = List.copyOf(vendorRules);
        this.preCheckPlanner = preCheckPlanner;
    }

    public Optional<PolicyRule> vendorRule(String vendor, String model) {
        return vendorRules.stream()
            .filter(r -> r.matchesExactly(vendor, model))
            .findFirst()
            .or(() -> vendorRules.stream()
                .filter(r -> r.matchesLoosely(vendor, model))
                .findFirst());
    }

    public Policy resolve(Device device, Optional<PolicyRule> inventoryRule) {
        Optional<PolicyRule> configured = vendorRule(device.vendor(), device.model());

        Policy.Origin origin;
        PolicyRule rule;
        if (inventoryRule.isPresent()) {
            origin = Policy.Origin.INVENTORY;
            rule = inventoryRule.get();
        } else if (configured.isPresent()) {
            origin = Policy.Origin.VENDOR_RULE;
            rule = configured.get();
        } else {
            origin = Policy.Origin.DEFAULTS;
            rule = null;
        }

        return new Policy(
            device.vendor(),
            device.model(),
            origin,
            rule != null && rule.maxCpuPercent() != null ? rule.maxCpuPercent() : defaults.maxCpuPercent(),
            rule != null && rule.minFreeMemPercent() != null ? rule.minFreeMemPercent() : defaults.minFreeMemPercent(),
            rule != null && rule.maxCriticalErrors() != null ? rule.maxCriticalErrors() : defaults.maxCriticalErrors(),
            rule != null && rule.blockIfCriticalErrors() != null ? rule.blockIfCriticalErrors() : defaults.blockIfCriticalErrors(),
            defaults.requireMaintenanceWindow(),
            defaults.upgradeWindow(),
            defaults.window(),
            // vendor requirements (compatibility, memory, bootflash) come from the configured rule
            preCheckPlanner.plan(defaults.preChecks(), configured.orElse(rule))
        );
    }
}
