package com.upgradegate.upgrade;

/**
 * Thrown when a device already has an attempt that has not reached a
 * terminal status, or another request for it is being processed.
 */
public class AttemptInProgressException extends RuntimeException {

    private final String deviceId;
    private final String attemptId;

    public AttemptInProgressException(String deviceId, String attemptId) {
        super(attemptId != null
            ? "attempt " + attemptId + " is already in progress for device " + deviceId
            : "another request is already in progress for device " + deviceId);
        this.deviceId = deviceId;
        this.attemptId = attemptId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    /** The blocking attempt, or null when the device is locked by a request that has not created one yet. */
    public String getAttemptId() {
        return attemptId;
    }
}
