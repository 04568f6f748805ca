package org.carball.discovery.model.relationship;

public record JoinabilityResult(
    boolean joinable,
    double matchRatio,
    JoinCardinality cardinality,
    int sampleMatches,
    int totalSamples
) {
    public static JoinabilityResult notJoinable(int totalSamples) {
        return new JoinabilityResult(false, 0.0, JoinCardinality.MANY_TO_MANY, 0, totalSamples);
    }
}
