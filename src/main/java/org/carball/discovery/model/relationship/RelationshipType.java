package org.carball.discovery.model.relationship;

import lombok.Getter;

@Getter
public enum RelationshipType {
    JOIN("join"),
    CORRELATION("correlation"),
    TEMPORAL("temporal"),
    HIERARCHY("hierarchy"),
    DERIVED("derived");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }
}
