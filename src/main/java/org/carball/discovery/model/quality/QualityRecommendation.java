package org.carball.discovery.model.quality;

public record QualityRecommendation(
    QualityDimension type,
    Severity priority,
    String description,
    String impact,
    String effort
) {}
