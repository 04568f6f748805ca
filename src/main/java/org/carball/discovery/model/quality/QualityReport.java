package org.carball.discovery.model.quality;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record QualityReport(
    String schemaName,
    Instant timestamp,
    double overallScore,
    Map<QualityDimension, DimensionScore> dimensions,
    List<QualityIssue> issues,
    List<QualityRecommendation> recommendations
) {
    public double score(QualityDimension dimension) {
        DimensionScore score = dimensions.get(dimension);
        return score == null ? 0.0 : score.score();
    }
}
