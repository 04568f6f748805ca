package org.carball.discovery.model.discovery;

import lombok.Builder;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.schema.Schema;

import java.util.List;
import java.util.Map;

@Builder
public record DiscoveryResult(
    List<Schema> schemas,
    List<Relationship> relationships,
    List<CrossSchemaPattern> patterns,
    List<Insight> insights,
    List<String> recommendations,
    ExecutionPlan executionPlan,
    List<SchemaFailure> failures,
    Map<String, Object> metadata
) {}
