package org.carball.discovery.client;

/**
 * Authentication, authorization, not-found and validation failures. Never retried.
 */
public class PermanentQueryException extends QueryException {

    public PermanentQueryException(String message) {
        super(message);
    }

    public PermanentQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public PermanentQueryException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
