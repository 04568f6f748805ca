package org.carball.discovery.client;

public record ClientStats(
    long queryCount,
    long errorCount,
    long circuitRejections,
    long retries,
    CircuitState circuitState,
    double availableTokens
) {}
