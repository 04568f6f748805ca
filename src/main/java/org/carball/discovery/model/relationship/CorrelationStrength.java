package org.carball.discovery.model.relationship;

import lombok.Getter;

@Getter
public enum CorrelationStrength {
    STRONG_POSITIVE("strong_positive"),
    MODERATE_POSITIVE("moderate_positive"),
    WEAK("weak"),
    MODERATE_NEGATIVE("moderate_negative"),
    STRONG_NEGATIVE("strong_negative");

    private final String value;

    CorrelationStrength(String value) {
        this.value = value;
    }

    public static CorrelationStrength of(double coefficient) {
        if (coefficient >= 0.7) {
            return STRONG_POSITIVE;
        }
        if (coefficient >= 0.4) {
            return MODERATE_POSITIVE;
        }
        if (coefficient <= -0.7) {
            return STRONG_NEGATIVE;
        }
        if (coefficient <= -0.4) {
            return MODERATE_NEGATIVE;
        }
        return WEAK;
    }
}
