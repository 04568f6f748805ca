package org.carball.discovery.model.pattern;

import lombok.Getter;

@Getter
public enum PatternType {
    SEASONAL("seasonal"),
    TREND("trend"),
    ANOMALY("anomaly"),
    CHANGE_POINT("change_point"),
    DISTRIBUTION("distribution"),
    FORMAT("format"),
    SEQUENCE("sequence");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }
}
