package org.carball.discovery.client;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
