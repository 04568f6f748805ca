package org.carball.discovery.client;

public class RetriesExhaustedException extends TransientQueryException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, QueryException lastFailure) {
        super("failed after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure.getStatusCode(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
