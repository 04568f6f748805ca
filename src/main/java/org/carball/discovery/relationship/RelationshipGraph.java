package org.carball.discovery.relationship;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.model.relationship.Evidence;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.relationship.RelationshipType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Undirected view over relationships, keyed by schema name. Self-referencing relationships are
 * kept but do not count towards degree or connectivity.
 */
@Slf4j
public class RelationshipGraph {

    static final int HUB_MIN_DEGREE = 4;

    private final Set<String> nodes = new TreeSet<>();
    private final List<Relationship> edges = new ArrayList<>();
    private final Map<String, List<Relationship>> adjacency = new TreeMap<>();

    public RelationshipGraph(Collection<String> schemaNames, Collection<Relationship> relationships) {
        nodes.addAll(schemaNames);
        relationships.forEach(this::add);
    }

    public void add(Relationship relationship) {
        edges.add(relationship);
        nodes.add(relationship.sourceSchema());
        nodes.add(relationship.targetSchema());
        if (!relationship.sourceSchema().equals(relationship.targetSchema())) {
            adjacency.computeIfAbsent(relationship.sourceSchema(), k -> new ArrayList<>()).add(relationship);
            adjacency.computeIfAbsent(relationship.targetSchema(), k -> new ArrayList<>()).add(relationship);
        }
    }

    public List<Relationship> getRelationships() {
        return List.copyOf(edges);
    }

    public int degree(String schema) {
        return adjacency.getOrDefault(schema, List.of()).size();
    }

    public boolean hasDirectEdge(String a, String b) {
        return adjacency.getOrDefault(a, List.of()).stream().anyMatch(r -> r.connects(a, b));
    }

    /**
     * Composes pairs of edges that meet at a schema (A-B, B-C) into a derived A-C edge whose
     * confidence is the product of the two. Both composing edges must reach {@code minConfidence};
     * pairs that already share a direct edge are skipped. Only one composition step is taken.
     */
    public List<Relationship> deriveTransitive(double minConfidence) {
        Map<String, Relationship> derived = new LinkedHashMap<>();

        for (Map.Entry<String, List<Relationship>> entry : adjacency.entrySet()) {
            String via = entry.getKey();
            List<Relationship> incident = entry.getValue();

            for (int i = 0; i < incident.size(); i++) {
                for (int j = i + 1; j < incident.size(); j++) {
                    Relationship first = incident.get(i);
                    Relationship second = incident.get(j);
                    if (first.confidence() < minConfidence || second.confidence() < minConfidence) {
                        continue;
                    }
                    String a = otherEnd(first, via);
                    String c = otherEnd(second, via);
                    if (a.equals(c) || hasDirectEdge(a, c)) {
                        continue;
                    }

                    String key = a.compareTo(c) < 0 ? a + "|" + c : c + "|" + a;
                    double confidence = first.confidence() * second.confidence();
                    Relationship existing = derived.get(key);
                    if (existing == null || existing.confidence() < confidence) {
                        derived.put(key, compose(first, second, via, a, c, confidence));
                    }
                }
            }
        }

        log.debug("Derived {} transitive relationships from {} edges", derived.size(), edges.size());
        return new ArrayList<>(derived.values());
    }

    private Relationship compose(Relationship first, Relationship second, String via,
                                 String a, String c, double confidence) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("via", via);
        metadata.put("path", List.of(first.id(), second.id()));

        return Relationship.builder()
                .type(RelationshipType.DERIVED)
                .sourceSchema(a)
                .sourceAttribute(attributeAt(first, a))
                .targetSchema(c)
                .targetAttribute(attributeAt(second, c))
                .confidence(confidence)
                .evidence(List.of(
                        new Evidence("composed_edge", first.id(), first.confidence(),
                                a + " relates to " + via + " (" + first.type().getValue() + ")"),
                        new Evidence("composed_edge", second.id(), second.confidence(),
                                via + " relates to " + c + " (" + second.type().getValue() + ")")))
                .metadata(metadata)
                .build();
    }

    public GraphAnalysis analyze() {
        List<String> hubs = new ArrayList<>();
        List<String> isolated = new ArrayList<>();
        int degreeSum = 0;
        for (String node : nodes) {
            int degree = degree(node);
            degreeSum += degree;
            if (degree >= HUB_MIN_DEGREE) {
                hubs.add(node);
            }
            if (degree == 0) {
                isolated.add(node);
            }
        }
        double averageDegree = nodes.isEmpty() ? 0.0 : (double) degreeSum / nodes.size();
        return new GraphAnalysis(nodes.size(), edges.size(), hubs, isolated, countComponents(), averageDegree);
    }

    private int countComponents() {
        Set<String> visited = new HashSet<>();
        int components = 0;
        for (String start : nodes) {
            if (!visited.add(start)) {
                continue;
            }
            components++;
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                for (Relationship edge : adjacency.getOrDefault(node, List.of())) {
                    String next = otherEnd(edge, node);
                    if (visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
        }
        return components;
    }

    private static String otherEnd(Relationship relationship, String node) {
        return relationship.sourceSchema().equals(node) ? relationship.targetSchema() : relationship.sourceSchema();
    }

    private static String attributeAt(Relationship relationship, String schema) {
        return relationship.sourceSchema().equals(schema) ? relationship.sourceAttribute() : relationship.targetAttribute();
    }
}
