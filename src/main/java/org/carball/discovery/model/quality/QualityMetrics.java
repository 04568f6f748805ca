package org.carball.discovery.model.quality;

/**
 * Quality summary attached to a profiled schema.
 */
public record QualityMetrics(
    double overallScore,
    double completeness,
    double consistency,
    double timeliness,
    double uniqueness,
    double validity,
    int issueCount
) {
    public static QualityMetrics unassessed() {
        return new QualityMetrics(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0);
    }

    public static QualityMetrics from(QualityReport report) {
        return new QualityMetrics(
                report.overallScore(),
                report.score(QualityDimension.COMPLETENESS),
                report.score(QualityDimension.CONSISTENCY),
                report.score(QualityDimension.TIMELINESS),
                report.score(QualityDimension.UNIQUENESS),
                report.score(QualityDimension.VALIDITY),
                report.issues().size());
    }
}
