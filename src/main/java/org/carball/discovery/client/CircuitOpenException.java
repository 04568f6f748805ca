package org.carball.discovery.client;

/**
 * Raised without touching the transport while the circuit breaker rejects calls.
 */
public class CircuitOpenException extends QueryException {

    public CircuitOpenException() {
        super("circuit breaker is open: too many failures");
    }
}
