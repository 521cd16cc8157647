package com.upgradegate.inventory;

import java.util.Optional;

/**
 * Device and policy lookups. Inventory management itself lives outside this service.
 */
public interface InventoryClient {

    Optional<Device> findDevice(String deviceId);

    Optional<PolicyRule> findPolicy(String vendor, String model);

    default Device requireDevice(String deviceId) {
        return findDevice(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }
}
