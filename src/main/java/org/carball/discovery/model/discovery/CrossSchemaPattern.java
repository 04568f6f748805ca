package org.carball.discovery.model.discovery;

import java.util.List;

public record CrossSchemaPattern(
    String name,
    String type,
    List<String> schemas,
    double confidence,
    String description
) {}
