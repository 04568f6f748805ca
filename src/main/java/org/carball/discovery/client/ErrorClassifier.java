package org.carball.discovery.client;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failure is transient. Typed query exceptions answer for themselves;
 * anything else is classified by its message, and unrecognized failures are not retried.
 */
public final class ErrorClassifier {

    private static final List<String> PERMANENT_MARKERS = List.of(
            "401", "403", "404", "unauthorized", "forbidden", "invalid", "validation", "not found");

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "timeout", "timed out", "connection", "network", "temporary", "unavailable",
            "429", "502", "503", "504", "too many requests");

    private ErrorClassifier() {
    }

    public static boolean isRetryable(Throwable error) {
        if (error == null || error instanceof CircuitOpenException || error instanceof QueryCancelledException) {
            return false;
        }
        if (error instanceof TransientQueryException) {
            return true;
        }
        if (error instanceof PermanentQueryException) {
            return false;
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (PERMANENT_MARKERS.stream().anyMatch(message::contains)) {
            return false;
        }
        return TRANSIENT_MARKERS.stream().anyMatch(message::contains);
    }

    /**
     * Maps an HTTP status to the matching exception type.
     */
    public static QueryException forStatus(int status, String detail) {
        String message = "NRDB query failed with HTTP " + status + (detail == null || detail.isBlank() ? "" : ": " + detail);
        if (status == 429 || status == 408 || status >= 500) {
            return new TransientQueryException(message, status, null);
        }
        return new PermanentQueryException(message, status, null);
    }
}
