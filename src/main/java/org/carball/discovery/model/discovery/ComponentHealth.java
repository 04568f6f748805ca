package org.carball.discovery.model.discovery;

import java.time.Instant;

public record ComponentHealth(String status, Instant lastCheck, String message) {}
