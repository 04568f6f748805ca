package org.carball.discovery.model.relationship;

import lombok.Getter;

@Getter
public enum JoinCardinality {
    ONE_TO_ONE("one-to-one", 1.0),
    ONE_TO_MANY("one-to-many", 0.95),
    MANY_TO_ONE("many-to-one", 0.95),
    MANY_TO_MANY("many-to-many", 0.85);

    private final String value;
    private final double confidenceFactor;

    JoinCardinality(String value, double confidenceFactor) {
        this.value = value;
        this.confidenceFactor = confidenceFactor;
    }

    public static JoinCardinality of(boolean sourceUnique, boolean targetUnique) {
        if (sourceUnique && targetUnique) {
            return ONE_TO_ONE;
        }
        if (sourceUnique) {
            return ONE_TO_MANY;
        }
        if (targetUnique) {
            return MANY_TO_ONE;
        }
        return MANY_TO_MANY;
    }
}
