package org.carball.discovery.relationship;

import java.util.List;

public record GraphAnalysis(
    int nodeCount,
    int edgeCount,
    List<String> hubs,
    List<String> isolated,
    int componentCount,
    double averageDegree
) {}
