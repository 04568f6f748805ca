package org.carball.discovery.model.discovery;

import java.time.Duration;
import java.util.Map;

public record HealthStatus(
    String status,
    String version,
    Duration uptime,
    Map<String, ComponentHealth> components,
    Map<String, Object> metrics
) {}
