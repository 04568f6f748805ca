package org.carball.discovery.model.schema;

import lombok.Getter;

@Getter
public enum DataType {
    STRING("string"),
    NUMERIC("numeric"),
    BOOLEAN("boolean"),
    TIMESTAMP("timestamp"),
    JSON("json"),
    ARRAY("array"),
    UNKNOWN("unknown");

    private final String value;

    DataType(String value) {
        this.value = value;
    }
}
