package com.upgradegate.health;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Read side of the telemetry time-series store.
 */
public interface TelemetryClient {

    /**
     * Aggregates one metric for a device over the trailing window.
     *
     * @return the aggregate, or empty when the window holds no samples
     * @throws TelemetryException when the store cannot be queried
     */
    OptionalDouble aggregate(String deviceId, Duration window, TelemetryMetric metric);
}
