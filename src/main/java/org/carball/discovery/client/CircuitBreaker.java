package org.carball.discovery.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Three-state circuit breaker shared by every caller of one client. Failures in the closed state are
 * counted until a success resets them; there is no time-based decay.
 */
@Slf4j
public class CircuitBreaker {

    private final int failureThreshold;
    private final int successThreshold;
    private final int halfOpenRequests;
    private final Duration openDuration;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failures;
    private int successes;
    private int halfOpenCount;
    private Instant openUntil = Instant.MIN;
    private Instant halfOpenUntil = Instant.MIN;

    public CircuitBreaker(int failureThreshold, int successThreshold, Duration openDuration,
                          int halfOpenRequests, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.successThreshold = Math.max(1, successThreshold);
        this.halfOpenRequests = Math.max(1, halfOpenRequests);
        if (this.successThreshold > this.halfOpenRequests) {
            throw new IllegalArgumentException("Success threshold " + successThreshold
                    + " can never be reached with " + halfOpenRequests + " half-open requests");
        }
        this.openDuration = openDuration;
        this.clock = clock;
    }

    /**
     * Returns whether a call may proceed, moving an expired open circuit to half-open. A half-open round
     * whose permits are all taken but undecided after {@code openDuration} is restarted.
     */
    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(openUntil)) {
                    return false;
                }
                log.info("Circuit breaker half-open after {}; admitting probe requests", openDuration);
                state = CircuitState.HALF_OPEN;
                startHalfOpenRound();
                return true;
            case HALF_OPEN:
                if (halfOpenCount < halfOpenRequests) {
                    halfOpenCount++;
                    return true;
                }
                if (!clock.instant().isBefore(halfOpenUntil)) {
                    log.info("Half-open round undecided after {}; admitting a new round", openDuration);
                    startHalfOpenRound();
                    return true;
                }
                return false;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    /**
     * Fails fast while the circuit is open and its cooldown has not elapsed. Does not change state.
     */
    public synchronized void checkNotOpen() throws CircuitOpenException {
        if (state == CircuitState.OPEN && clock.instant().isBefore(openUntil)) {
            throw new CircuitOpenException();
        }
    }

    /**
     * Hands back a half-open permit whose call ended without an outcome, such as a cancellation.
     */
    public synchronized void releasePermit() {
        if (state == CircuitState.HALF_OPEN && halfOpenCount > 0) {
            halfOpenCount--;
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.CLOSED) {
            failures = 0;
        } else if (state == CircuitState.HALF_OPEN) {
            successes++;
            if (successes >= successThreshold) {
                log.info("Circuit breaker closed after {} successful probes", successes);
                reset();
            }
        }
    }

    public synchronized void recordFailure() {
        if (state == CircuitState.CLOSED) {
            failures++;
            if (failures >= failureThreshold) {
                open();
            }
        } else if (state == CircuitState.HALF_OPEN) {
            failures++;
            open();
        }
    }

    public synchronized void reset() {
        state = CircuitState.CLOSED;
        failures = 0;
        successes = 0;
        halfOpenCount = 0;
        openUntil = Instant.MIN;
        halfOpenUntil = Instant.MIN;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failures;
    }

    private void startHalfOpenRound() {
        successes = 0;
        halfOpenCount = 1;
        halfOpenUntil = clock.instant().plus(openDuration);
    }

    private void open() {
        CircuitState previous = state;
        state = CircuitState.OPEN;
        openUntil = clock.instant().plus(openDuration);
        successes = 0;
        halfOpenCount = 0;
        log.warn("Circuit breaker opened from {} with {} failures; rejecting calls until {}", previous, failures, openUntil);
    }
}
