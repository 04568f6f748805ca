package org.carball.discovery.engine;

/**
 * A discovery operation could not produce a result as a whole. Failures of single schemas inside
 * a batch are reported as {@link org.carball.discovery.model.discovery.SchemaFailure}s instead.
 */
public class DiscoveryException extends Exception {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
