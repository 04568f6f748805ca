package org.carball.discovery.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Benchmarks and weights for the five quality dimensions.
 */
@Data
@Slf4j
public class QualityThresholds {

    // Benchmarks a dimension must reach before an issue is raised
    @JsonProperty("expected_completeness")
    private double expectedCompleteness = 0.95;

    @JsonProperty("consistency_threshold")
    private double consistencyThreshold = 0.90;

    @JsonProperty("uniqueness_threshold")
    private double uniquenessThreshold = 0.99;

    @JsonProperty("validity_threshold")
    private double validityThreshold = 0.95;

    @JsonProperty("timeliness_threshold")
    private double timelinessThreshold = 0.8;

    @JsonProperty("max_freshness_delay_seconds")
    private long maxFreshnessDelaySeconds = 300;

    // Weights for the overall score
    @JsonProperty("completeness_weight")
    private double completenessWeight = 0.25;

    @JsonProperty("consistency_weight")
    private double consistencyWeight = 0.25;

    @JsonProperty("timeliness_weight")
    private double timelinessWeight = 0.20;

    @JsonProperty("uniqueness_weight")
    private double uniquenessWeight = 0.15;

    @JsonProperty("validity_weight")
    private double validityWeight = 0.15;

    public static QualityThresholds defaults() {
        return new QualityThresholds();
    }

    public Duration getMaxFreshnessDelay() {
        return Duration.ofSeconds(maxFreshnessDelaySeconds);
    }

    public double totalWeight() {
        return completenessWeight + consistencyWeight + timelinessWeight + uniquenessWeight + validityWeight;
    }

    /**
     * Logs warnings for benchmarks outside [0, 1] or weights that do not sum to one.
     */
    public void validate() {
        checkUnitInterval("expected completeness", expectedCompleteness);
        checkUnitInterval("consistency threshold", consistencyThreshold);
        checkUnitInterval("uniqueness threshold", uniquenessThreshold);
        checkUnitInterval("validity threshold", validityThreshold);
        checkUnitInterval("timeliness threshold", timelinessThreshold);

        if (Math.abs(totalWeight() - 1.0) > 0.001) {
            log.warn("Quality weights sum to {} instead of 1.0; overall score will be normalized", totalWeight());
        }
        if (maxFreshnessDelaySeconds <= 0) {
            log.warn("Max freshness delay ({}s) should be positive", maxFreshnessDelaySeconds);
        }
    }

    private void checkUnitInterval(String label, double value) {
        if (value < 0.0 || value > 1.0) {
            log.warn("Quality {} ({}) should be between 0 and 1", label, value);
        }
    }

    public String getDescription() {
        return String.format(
            "Quality: completeness=%.2f, consistency=%.2f, uniqueness=%.2f, validity=%.2f, freshness=%ds",
            expectedCompleteness, consistencyThreshold, uniquenessThreshold, validityThreshold,
            maxFreshnessDelaySeconds);
    }
}
