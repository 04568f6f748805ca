package org.carball.discovery.client;

/**
 * The calling thread was interrupted while waiting on a token, a backoff or the transport.
 */
public class QueryCancelledException extends QueryException {

    public QueryCancelledException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
