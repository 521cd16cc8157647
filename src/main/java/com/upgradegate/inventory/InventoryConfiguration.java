package com.upgradegate.inventory;

import com.upgradegate.config.UpgradeGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InventoryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InventoryConfiguration.class);

    /**
     * In-memory inventory seeded from {@code upgrade-gate.inventory}. A
     * database-backed client replaces it by declaring its own {@link InventoryClient}.
     */
    @Bean
    @ConditionalOnMissingBean(InventoryClient.class)
    public InMemoryInventory inventoryClient(UpgradeGateProperties properties) {
        InMemoryInventory inventory = new InMemoryInventory();
        UpgradeGateProperties.Inventory seed = properties.getInventory();

        for (UpgradeGateProperties.DeviceEntry entry : seed.getDevices()) {
            UpgradeGateProperties.Window window = entry.getMaintenanceWindow();
            inventory.register(new Device(
                entry.getId(),
                entry.getHostname(),
                entry.getMgmtAddress(),
                entry.getVendor(),
                entry.getModel(),
                entry.getCurrentVersion(),
                entry.getTargetVersion(),
                window == null ? null : MaintenanceWindow.of(
                    window.getStartHour(), window.getEndHour(), window.getAllowedDays(), window.getZone()),
                entry.getNotes()
            ));
        }
        for (UpgradeGateProperties.Rule rule : seed.getPolicies()) {
            inventory.register(toPolicyRule(rule));
        }

        log.info("Inventory seeded with {} devices and {} policies",
            seed.getDevices().size(), seed.getPolicies().size());
        return inventory;
    }

    public static PolicyRule toPolicyRule(UpgradeGateProperties.Rule rule) {
        return new PolicyRule(
            rule.getVendor(),
            rule.getModel(),
            rule.getMaxCpuPercent(),
            rule.getMinFreeMemPercent(),
            rule.getMaxCriticalErrors(),
            rule.getBlockIfCriticalErrors(),
            rule.isCompatibilityCheck(),
            rule.getMinimumMemoryMb(),
            rule.getBootflashRequirementMb()
        );
    }
}
