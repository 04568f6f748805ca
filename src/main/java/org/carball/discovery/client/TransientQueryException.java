package org.carball.discovery.client;

/**
 * Timeouts, connection failures, throttling and 5xx responses.
 */
public class TransientQueryException extends QueryException {

    public TransientQueryException(String message) {
        super(message);
    }

    public TransientQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientQueryException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
