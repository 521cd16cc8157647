package com.upgradegate.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.DoubleStream;

/**
 * Sample store used when no time-series database is wired in.
 */
public class InMemoryTelemetry implements TelemetryClient {

    private record Sample(String deviceId, TelemetryMetric metric, Instant at, double value) {}

    private final CopyOnWriteArrayList<Sample> samples = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryTelemetry(Clock clock) {
        this.clock = clock;
    }

    public void record(String deviceId, TelemetryMetric metric, Instant at, double value) {
        samples.add(new Sample(deviceId, metric, at, value));
    }

    public void record(String deviceId, TelemetryMetric metric, double value) {
        record(deviceId, metric, clock.instant(), value);
    }

    @Override
    public OptionalDouble aggregate(String deviceId, Duration window, TelemetryMetric metric) {
        Instant now = clock.instant();
        Instant from = now.minus(window);

        DoubleStream values = samples.stream()
            .filter(s -> s.deviceId().equals(deviceId) && s.metric() == metric)
            .filter(s -> !s.at().isBefore(from) && !s.at().isAfter(now))
            .mapToDouble(Sample::value);

        return switch (metric.aggregation()) {
            case MEAN -> values.average();
            case MIN -> values.min();
            case SUM -> {
                double[] all = values.toArray();
                yield all.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(DoubleStream.of(all).sum());
            }
        };
    }
}
