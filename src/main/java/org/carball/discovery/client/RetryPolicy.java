package org.carball.discovery.client;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.config.DiscoveryConfig;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Exponential backoff with jitter. Only failures classified as transient are retried, and no single
 * wait exceeds {@code maxInterval}.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double multiplier;
    private final double jitter;
    private final Random random;
    private final Sleeper sleeper;

    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successfulCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong totalBackoffMillis = new AtomicLong();

    public RetryPolicy(int maxAttempts, Duration initialInterval, Duration maxInterval,
                       double multiplier, double jitter, Random random, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.multiplier = multiplier;
        this.jitter = Math.max(0.0, Math.min(1.0, jitter));
        this.random = random;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(DiscoveryConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialRetryInterval(),
                config.getMaxRetryInterval(), config.getRetryMultiplier(), config.getRetryJitter(),
                new Random(), Sleeper.SYSTEM);
    }

    public <T> T execute(QueryCall<T> call) throws QueryException {
        QueryException lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            totalAttempts.incrementAndGet();
            try {
                T result = call.call();
                successfulCalls.incrementAndGet();
                return result;
            } catch (QueryException e) {
                lastFailure = e;
                if (!ErrorClassifier.isRetryable(e)) {
                    failedCalls.incrementAndGet();
                    throw e;
                }
                if (attempt == maxAttempts - 1) {
                    break;
                }

                Duration backoff = backoff(attempt);
                totalRetries.incrementAndGet();
                totalBackoffMillis.addAndGet(backoff.toMillis());
                log.debug("Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt + 1, maxAttempts, e.getMessage(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    failedCalls.incrementAndGet();
                    throw new QueryCancelledException("Retry backoff interrupted", interrupted);
                }
            }
        }

        failedCalls.incrementAndGet();
        log.warn("Giving up after {} attempts: {}", maxAttempts, lastFailure.getMessage());
        throw new RetriesExhaustedException(maxAttempts, lastFailure);
    }

    /**
     * Backoff before retry number {@code attempt + 1}: initial * multiplier^attempt, randomized by
     * the jitter fraction and capped at the max interval.
     */
    Duration backoff(int attempt) {
        double base = initialInterval.toMillis() * Math.pow(multiplier, attempt);
        base = Math.min(base, maxInterval.toMillis());
        double delta = base * jitter;
        double randomized = base - delta + random.nextDouble() * 2 * delta;
        long millis = (long) Math.max(0, Math.min(randomized, maxInterval.toMillis()));
        return Duration.ofMillis(millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public long getTotalAttempts() {
        return totalAttempts.get();
    }

    public long getSuccessfulCalls() {
        return successfulCalls.get();
    }

    public long getFailedCalls() {
        return failedCalls.get();
    }

    public long getTotalRetries() {
        return totalRetries.get();
    }

    public Duration getTotalBackoff() {
        return Duration.ofMillis(totalBackoffMillis.get());
    }
}
