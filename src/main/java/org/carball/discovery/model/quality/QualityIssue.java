package org.carball.discovery.model.quality;

import java.time.Instant;

/**
 * A shortfall against a quality benchmark. {@code attribute} is null for schema-wide issues.
 */
public record QualityIssue(
    QualityDimension dimension,
    Severity severity,
    String attribute,
    String description,
    String impact,
    Instant detectedAt
) {}
