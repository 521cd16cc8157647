package com.upgradegate.health;

/**
 * The three health series read per device, with the aggregation applied over the window.
 */
public enum TelemetryMetric {
    CPU_USAGE("cpu", "usage_percent", Aggregation.MEAN),
    MEM_FREE("mem", "free_percent", Aggregation.MIN),
    CRITICAL_ERRORS("errors", "count", Aggregation.SUM);

    public enum Aggregation {
        MEAN,
        MIN,
        SUM
    }

    private final String measurement;
    private final String field;
    private final Aggregation aggregation;

    TelemetryMetric(String measurement, String field, Aggregation aggregation) {
        this.measurement = measurement;
        this.field = field;
        this.aggregation = aggregation;
    }

    public String measurement() {
        return measurement;
    }

    public String field() {
        return field;
    }

    public Aggregation aggregation() {
        return aggregation;
    }
}
