package org.carball.discovery.model.relationship;

public record Correlation(
    SchemaAttribute first,
    SchemaAttribute second,
    double coefficient,
    double pValue,
    int sampleSize,
    CorrelationStrength strength
) {}
