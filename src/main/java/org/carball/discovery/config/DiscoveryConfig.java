package org.carball.discovery.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.model.discovery.ProfileDepth;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class DiscoveryConfig {

    // Remote store
    @ToString.Exclude
    private String apiKey;

    private String accountId;

    @Builder.Default
    private String baseUrl = "https://api.newrelic.com";

    @Builder.Default
    private Duration queryTimeout = Duration.ofSeconds(30);

    // Rate limiting
    @Builder.Default
    private int rateLimitPerMinute = 60;

    @Builder.Default
    private int rateLimitBurst = 60;

    // Retry policy
    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private Duration initialRetryInterval = Duration.ofMillis(100);

    @Builder.Default
    private Duration maxRetryInterval = Duration.ofSeconds(10);

    @Builder.Default
    private double retryMultiplier = 2.0;

    @Builder.Default
    private double retryJitter = 0.1;

    // Circuit breaker
    @Builder.Default
    private int failureThreshold = 5;

    @Builder.Default
    private int successThreshold = 2;

    @Builder.Default
    private Duration openDuration = Duration.ofSeconds(30);

    @Builder.Default
    private int halfOpenRequests = 3;

    // Orchestration
    @Builder.Default
    private int maxConcurrency = 10;

    @Builder.Default
    private int workerPoolSize = 20;

    @Builder.Default
    private int defaultSampleSize = 1000;

    @Builder.Default
    private int maxSampleSize = 10000;

    @Builder.Default
    private Duration discoveryTimeout = Duration.ofMinutes(5);

    @Builder.Default
    private boolean cacheEnabled = true;

    @Builder.Default
    private Duration cacheTtl = Duration.ofHours(1);

    @Builder.Default
    private long minSchemaRecords = 100;

    @Builder.Default
    private ProfileDepth profileDepth = ProfileDepth.STANDARD;

    @Builder.Default
    private Duration sampleWindow = Duration.ofHours(1);

    @Builder.Default
    private Duration qualityWindow = Duration.ofHours(24);

    @Builder.Default
    private List<String> samplingStrategies = new ArrayList<>(List.of("adaptive", "stratified", "random"));

    @Builder.Default
    private QualityThresholds qualityThresholds = QualityThresholds.defaults();

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced discovery settings";

    public static DiscoveryConfig defaults() {
        return DiscoveryConfig.builder().build();
    }

    /**
     * Rejects settings the engine cannot run with and logs warnings for questionable ones.
     */
    public void validate() {
        if (maxConcurrency < 1) {
            throw new IllegalStateException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        if (defaultSampleSize < 10) {
            throw new IllegalStateException("defaultSampleSize must be at least 10, got " + defaultSampleSize);
        }
        if (maxSampleSize < defaultSampleSize) {
            throw new IllegalStateException("maxSampleSize (" + maxSampleSize
                    + ") must not be smaller than defaultSampleSize (" + defaultSampleSize + ")");
        }
        if (rateLimitPerMinute < 1 || rateLimitBurst < 1) {
            throw new IllegalStateException("Rate limit and burst must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalStateException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (successThreshold > halfOpenRequests) {
            throw new IllegalStateException("successThreshold (" + successThreshold
                    + ") must not exceed halfOpenRequests (" + halfOpenRequests + ")");
        }

        if (workerPoolSize < maxConcurrency) {
            log.warn("Worker pool size ({}) is smaller than max concurrency ({}); effective concurrency is {}",
                    workerPoolSize, maxConcurrency, workerPoolSize);
        }
        if (retryJitter < 0.0 || retryJitter > 1.0) {
            log.warn("Retry jitter ({}) should be between 0 and 1", retryJitter);
        }
        if (retryMultiplier < 1.0) {
            log.warn("Retry multiplier ({}) below 1.0 shrinks backoff between attempts", retryMultiplier);
        }
        if (failureThreshold < 1) {
            log.warn("Circuit breaker failure threshold ({}) should be positive", failureThreshold);
        }
        qualityThresholds.validate();

        log.debug("Using discovery config - concurrency: {}, sample: {}/{}, rate: {}/min, profile: {}",
                maxConcurrency, defaultSampleSize, maxSampleSize, rateLimitPerMinute, profileName);
    }

    /**
     * Validates the settings needed to reach the remote store over HTTP.
     */
    public void validateCredentials() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("API key is required (set NEWRELIC_API_KEY)");
        }
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalStateException("Account ID is required (set NEWRELIC_ACCOUNT_ID)");
        }
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Concurrency: %d | Sample: %d (max %d) | Rate: %d/min | Cache TTL: %s | Depth: %s",
                profileName, maxConcurrency, defaultSampleSize, maxSampleSize,
                rateLimitPerMinute, cacheTtl, profileDepth);
    }
}
