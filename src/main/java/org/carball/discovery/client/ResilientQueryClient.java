package org.carball.discovery.client;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.config.DiscoveryConfig;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps a transport with rate limiting, retries and a circuit breaker. One rate-limit token is taken
 * per call; every attempt is gated by and reported to the breaker.
 */
@Slf4j
public class ResilientQueryClient implements QueryClient {

    private final QueryClient delegate;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong queryCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong circuitRejections = new AtomicLong();

    public ResilientQueryClient(QueryClient delegate, RateLimiter rateLimiter,
                                RetryPolicy retryPolicy, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreaker;
    }

    public static ResilientQueryClient wrap(QueryClient delegate, DiscoveryConfig config) {
        RateLimiter rateLimiter = RateLimiter.perMinute(config.getRateLimitPerMinute(), config.getRateLimitBurst());
        CircuitBreaker circuitBreaker = new CircuitBreaker(config.getFailureThreshold(),
                config.getSuccessThreshold(), config.getOpenDuration(), config.getHalfOpenRequests(),
                Clock.systemUTC());
        log.info("Resilient client: {} queries/min, {} attempts, breaker opens after {} failures for {}",
                config.getRateLimitPerMinute(), config.getMaxAttempts(),
                config.getFailureThreshold(), config.getOpenDuration());
        return new ResilientQueryClient(delegate, rateLimiter, RetryPolicy.from(config), circuitBreaker);
    }

    @Override
    public QueryResult query(String nrql) throws QueryException {
        queryCount.incrementAndGet();
        try {
            circuitBreaker.checkNotOpen();
            acquireToken();
            return retryPolicy.execute(() -> attempt(nrql));
        } catch (CircuitOpenException e) {
            circuitRejections.incrementAndGet();
            errorCount.incrementAndGet();
            throw e;
        } catch (QueryException e) {
            errorCount.incrementAndGet();
            throw e;
        }
    }

    private void acquireToken() throws QueryCancelledException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Interrupted while waiting for a rate limit token", e);
        }
    }

    private QueryResult attempt(String nrql) throws QueryException {
        if (!circuitBreaker.allowRequest()) {
            throw new CircuitOpenException();
        }
        try {
            QueryResult result = delegate.query(nrql);
            circuitBreaker.recordSuccess();
            return result;
        } catch (QueryCancelledException e) {
            // Cancellation says nothing about the remote store's health
            circuitBreaker.releasePermit();
            throw e;
        } catch (QueryException e) {
            circuitBreaker.recordFailure();
            log.debug("Query attempt failed: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public AccountInfo getAccountInfo() {
        return delegate.getAccountInfo();
    }

    public ClientStats getStats() {
        return new ClientStats(queryCount.get(), errorCount.get(), circuitRejections.get(),
                retryPolicy.getTotalRetries(), circuitBreaker.getState(), rateLimiter.availableTokens());
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
