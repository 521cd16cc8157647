package com.upgradegate.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds a {@link HealthSnapshot} from three independent telemetry reads
 * issued concurrently under one shared deadline.
 *
 * <p>A read that fails, times out or returns an out-of-range value is
 * recorded as absent; it never aborts the snapshot.</p>
 */
public class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final TelemetryClient telemetry;
    private final Executor executor;
    private final Duration timeout;

    public HealthAggregator(TelemetryClient telemetry, Executor executor, Duration timeout) {
        this.telemetry = telemetry;
        this.executor = executor;
        this.timeout = timeout;
    }

    public HealthSnapshot aggregate(String deviceId, Duration window) {
        long deadline = System.nanoTime() + timeout.toNanos();

        CompletableFuture<OptionalDouble> cpuRead = read(deviceId, window, TelemetryMetric.CPU_USAGE);
        CompletableFuture<OptionalDouble> memRead = read(deviceId, window, TelemetryMetric.MEM_FREE);
        CompletableFuture<OptionalDouble> errorRead = read(deviceId, window, TelemetryMetric.CRITICAL_ERRORS);

        Double cpuAvg = percent(deviceId, TelemetryMetric.CPU_USAGE, await(deviceId, TelemetryMetric.CPU_USAGE, cpuRead, deadline));
        Double memFreeMin = percent(deviceId, TelemetryMetric.MEM_FREE, await(deviceId, TelemetryMetric.MEM_FREE, memRead, deadline));
        Integer criticalErrors = errorCount(deviceId, await(deviceId, TelemetryMetric.CRITICAL_ERRORS, errorRead, deadline));

        HealthSnapshot snapshot = HealthSnapshot.of(deviceId, window, cpuAvg, memFreeMin, criticalErrors);
        log.info("Health snapshot device={} window={} cpu_avg={} mem_free_min={} critical_errors={} status={}",
            deviceId, window, cpuAvg, memFreeMin, criticalErrors, snapshot.status().getValue());
        return snapshot;
    }

    private CompletableFuture<OptionalDouble> read(String deviceId, Duration window, TelemetryMetric metric) {
        return CompletableFuture.supplyAsync(() -> telemetry.aggregate(deviceId, window, metric), executor);
    }

    /**
     * @return the read's value, or null when it failed or missed the deadline
     */
    private OptionalDouble await(String deviceId, TelemetryMetric metric,
                                 CompletableFuture<OptionalDouble> read, long deadline) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            OptionalDouble value = read.get(remaining, TimeUnit.NANOSECONDS);
            return value != null ? value : OptionalDouble.empty();
        } catch (TimeoutException ex) {
            read.cancel(true);
            log.warn("Telemetry read timed out device={} metric={}, treating as absent", deviceId, metric);
            return null;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Telemetry read failed device={} metric={}: {}, treating as absent",
                deviceId, metric, cause.getMessage());
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            read.cancel(true);
            log.warn("Interrupted while reading telemetry device={} metric={}, treating as absent", deviceId, metric);
            return null;
        }
    }

    private Double percent(String deviceId, TelemetryMetric metric, OptionalDouble value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        double v = value.getAsDouble();
        if (Double.isNaN(v) || v < 0.0 || v > 100.0) {
            log.warn("Discarding out-of-range {} value {} for device={}", metric, v, deviceId);
            return null;
        }
        return v;
    }

    /** An empty window means no critical errors were logged; a failed read stays absent. */
    private Integer errorCount(String deviceId, OptionalDouble value) {
        if (value == null) {
            return null;
        }
        if (value.isEmpty()) {
            return 0;
        }
        double v = value.getAsDouble();
        if (Double.isNaN(v) || v < 0.0) {
            log.warn("Discarding invalid critical error count {} for device={}", v, deviceId);
            return null;
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.round(v));
    }
}
