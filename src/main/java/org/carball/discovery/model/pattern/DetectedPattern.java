package org.carball.discovery.model.pattern;

import java.util.List;
import java.util.Map;

/**
 * A pattern lifted to schema level, naming the attributes it was found on.
 */
public record DetectedPattern(
    String name,
    PatternType type,
    double confidence,
    List<String> attributes,
    String description,
    Map<String, Object> evidence
) {}
