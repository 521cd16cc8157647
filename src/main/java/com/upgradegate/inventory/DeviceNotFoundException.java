package com.upgradegate.inventory;

/**
 * Thrown when a request names a device the inventory does not know.
 * Not retried; the caller has to supply a valid device id.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("device not found: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
