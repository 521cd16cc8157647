package com.upgradegate.health;

/**
 * A telemetry read failed (network, timeout, query error). The health
 * aggregator degrades the affected metric to absent; this never reaches callers.
 */
public class TelemetryException extends RuntimeException {

    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
