package org.carball.discovery.model.schema;

import java.util.List;

public record CardinalityProfile(
    long unique,
    long total,
    double ratio,
    boolean highCardinality,
    List<ValueFrequency> topValues
) {
    public static CardinalityProfile empty() {
        return new CardinalityProfile(0, 0, 0.0, false, List.of());
    }
}
