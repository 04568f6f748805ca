package org.carball.discovery.model.relationship;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A directed link between two schema attributes. Every relationship carries at least one
 * evidence entry and a confidence in [0, 1].
 */
@Builder(toBuilder = true)
public record Relationship(
    String id,
    RelationshipType type,
    String sourceSchema,
    String sourceAttribute,
    String targetSchema,
    String targetAttribute,
    double confidence,
    List<Evidence> evidence,
    Map<String, Object> metadata
) {
    public Relationship {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Relationship confidence must be within [0, 1]: " + confidence);
        }
        if (evidence == null || evidence.isEmpty()) {
            throw new IllegalArgumentException("Relationship " + sourceSchema + " -> " + targetSchema
                    + " has no evidence");
        }
        evidence = List.copyOf(evidence);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (id == null) {
            id = type.getValue() + ":" + sourceSchema + "." + sourceAttribute + "->" + targetSchema + "." + targetAttribute;
        }
    }

    public boolean connects(String schemaA, String schemaB) {
        return (sourceSchema.equals(schemaA) && targetSchema.equals(schemaB))
                || (sourceSchema.equals(schemaB) && targetSchema.equals(schemaA));
    }
}
