package org.carball.discovery.model.quality;

import lombok.Getter;

@Getter
public enum QualityDimension {
    COMPLETENESS("Completeness"),
    CONSISTENCY("Consistency"),
    TIMELINESS("Timeliness"),
    UNIQUENESS("Uniqueness"),
    VALIDITY("Validity");

    private final String displayName;

    QualityDimension(String displayName) {
        this.displayName = displayName;
    }
}
