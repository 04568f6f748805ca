package org.carball.discovery.model.discovery;

import org.carball.discovery.model.schema.Schema;

import java.util.List;

/**
 * Schemas profiled by one discovery call, together with the event types that failed.
 */
public record DiscoveryBatch(List<Schema> schemas, List<SchemaFailure> failures) {

    public DiscoveryBatch {
        schemas = List.copyOf(schemas);
        failures = List.copyOf(failures);
    }

    /**
     * Batch holding copies of every schema, so the caller and a cache never share instances.
     */
    public DiscoveryBatch copy() {
        return new DiscoveryBatch(schemas.stream().map(Schema::copy).toList(), failures);
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
