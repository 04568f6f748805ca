package org.carball.discovery.model.discovery;

import lombok.Builder;
import org.carball.discovery.model.quality.Severity;

import java.util.List;
import java.util.Map;

@Builder
public record Insight(
    String id,
    String type,
    Severity severity,
    String title,
    String description,
    String impact,
    Map<String, Object> evidence,
    List<String> actions
) {}
