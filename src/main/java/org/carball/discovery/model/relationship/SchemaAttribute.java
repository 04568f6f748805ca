package org.carball.discovery.model.relationship;

import org.carball.discovery.model.schema.Attribute;

public record SchemaAttribute(String schemaName, Attribute attribute) {

    public String attributeName() {
        return attribute.getName();
    }

    public String qualifiedName() {
        return schemaName + "." + attribute.getName();
    }
}
