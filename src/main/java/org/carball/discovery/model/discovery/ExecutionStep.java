package org.carball.discovery.model.discovery;

import java.time.Duration;

public record ExecutionStep(String name, String type, Duration estimate, String status, String details) {}
