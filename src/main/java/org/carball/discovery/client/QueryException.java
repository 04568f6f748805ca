package org.carball.discovery.client;

/**
 * Base failure of a remote query. Subclasses decide whether the failure is worth retrying.
 */
public class QueryException extends Exception {

    private final int statusCode;

    public QueryException(String message) {
        this(message, 0, null);
    }

    public QueryException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public QueryException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or 0 when the failure did not come from an HTTP response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return false;
    }
}
