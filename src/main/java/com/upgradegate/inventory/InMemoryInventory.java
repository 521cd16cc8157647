package com.upgradegate.inventory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryInventory implements InventoryClient {

    private final ConcurrentHashMap<String, Device> devices = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<PolicyRule> policies = new CopyOnWriteArrayList<>();

    public InMemoryInventory register(Device device) {
        devices.put(device.id(), device);
        return this;
    }

    public InMemoryInventory register(PolicyRule policy) {
        policies.add(policy);
        return this;
    }

    @Override
    public Optional<Device> findDevice(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(devices.get(deviceId));
    }

    @Override
    public Optional<PolicyRule> findPolicy(String vendor, String model) {
        return policies.stream()
            .filter(p -> p.matchesExactly(vendor, model))
            .findFirst();
    }

    public List<Device> devices() {
        return List.copyOf(devices.values());
    }
}
