package org.carball.discovery.model.schema;

import java.time.Duration;
import java.time.Instant;

/**
 * Type-dependent summary statistics. Only the part matching the attribute's data type is populated.
 */
public record Statistics(Numeric numeric, Text text, Temporal temporal) {

    public static Statistics empty() {
        return new Statistics(null, null, null);
    }

    public record Numeric(
        double min,
        double max,
        double mean,
        double median,
        double stdDev,
        double p25,
        double p75,
        double p95,
        double p99
    ) {}

    public record Text(
        int minLength,
        int maxLength,
        double avgLength,
        long emptyCount,
        long distinctCount
    ) {}

    public record Temporal(
        Instant earliest,
        Instant latest,
        Duration range,
        Duration granularity
    ) {}
}
