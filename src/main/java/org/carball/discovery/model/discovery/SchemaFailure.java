package org.carball.discovery.model.discovery;

public record SchemaFailure(String eventType, String errorType, String message) {

    public static SchemaFailure of(String eventType, Throwable error) {
        return new SchemaFailure(eventType, error.getClass().getSimpleName(), error.getMessage());
    }
}
