package org.carball.discovery.model.pattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A confidence-scored finding on a single attribute.
 */
public record Pattern(
    PatternType type,
    String subtype,
    double confidence,
    String description,
    Map<String, Object> parameters
) {
    public Pattern {
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
