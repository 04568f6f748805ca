package org.carball.discovery.engine;

import org.carball.discovery.analyzer.AttributeAnalyzer;
import org.carball.discovery.model.discovery.CrossSchemaPattern;
import org.carball.discovery.model.discovery.DiscoveryFilter;
import org.carball.discovery.model.discovery.DiscoveryHints;
import org.carball.discovery.model.discovery.ExecutionPlan;
import org.carball.discovery.model.discovery.ExecutionStep;
import org.carball.discovery.model.discovery.Insight;
import org.carball.discovery.model.quality.Severity;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.relationship.RelationshipType;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.Schema;
import org.carball.discovery.model.schema.SemanticType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns discovery hints into a filter, and a set of profiled schemas into ranked schemas,
 * cross-schema patterns, insights, a plan and recommendations.
 */
class SchemaIntelligence {

    static final int DEFAULT_MAX_SCHEMAS = 50;
    static final long DEFAULT_MIN_RECORDS = 100;
    static final double LOW_QUALITY_SCORE = 0.7;
    static final double VERY_HIGH_CARDINALITY = 0.9;

    private static final Map<String, List<String>> DOMAIN_PATTERNS = Map.of(
            "performance", List.of("*Transaction*", "*PageView*", "*Synthetics*"),
            "infrastructure", List.of("*SystemSample*", "*ProcessSample*", "*NetworkSample*"),
            "logs", List.of("*Log*"),
            "browser", List.of("*PageView*", "*BrowserInteraction*", "*JavaScriptError*"),
            "errors", List.of("*Error*"));

    private final int parallelism;

    SchemaIntelligence(int parallelism) {
        this.parallelism = parallelism;
    }

    DiscoveryFilter filterFor(DiscoveryHints hints) {
        List<String> include = new ArrayList<>();
        for (String keyword : hints.getKeywords()) {
            include.add("*" + keyword + "*");
        }
        for (String preferred : hints.getPreferredTypes()) {
            include.add(preferred);
        }
        if (hints.getDomain() != null) {
            include.addAll(DOMAIN_PATTERNS.getOrDefault(hints.getDomain().toLowerCase(Locale.ROOT), List.of()));
        }
        return DiscoveryFilter.builder()
                .includePatterns(include)
                .maxSchemas(DEFAULT_MAX_SCHEMAS)
                .minRecordCount(DEFAULT_MIN_RECORDS)
                .build();
    }

    /**
     * Highest relevance first: keyword hits in the name weigh most, then volume, quality and
     * the number of detected patterns.
     */
    List<Schema> rank(List<Schema> schemas, DiscoveryHints hints) {
        Map<Schema, Double> scores = new IdentityHashMap<>();
        for (Schema schema : schemas) {
            scores.put(schema, relevance(schema, hints));
        }
        List<Schema> ranked = new ArrayList<>(schemas);
        ranked.sort(Comparator.comparing((Schema s) -> scores.get(s)).reversed());
        return ranked;
    }

    static double relevance(Schema schema, DiscoveryHints hints) {
        double score = 0.0;
        String name = schema.getName().toLowerCase(Locale.ROOT);
        for (String keyword : hints.getKeywords()) {
            if (name.contains(keyword.toLowerCase(Locale.ROOT))) {
                score += 10.0;
            }
        }
        score += schema.getDataVolume().totalRecords() / 1_000_000.0;
        score += schema.getQuality().overallScore() * 5.0;
        score += schema.getPatterns().size();
        return score;
    }

    List<CrossSchemaPattern> crossSchemaPatterns(List<Schema> schemas) {
        Map<String, List<String>> byAttribute = new TreeMap<>();
        Map<String, List<String>> byIdentifier = new TreeMap<>();
        List<String> timestamped = new ArrayList<>();

        for (Schema schema : schemas) {
            for (Attribute attribute : schema.getAttributes()) {
                byAttribute.computeIfAbsent(attribute.getName(), k -> new ArrayList<>()).add(schema.getName());
                if (attribute.getSemanticType() == SemanticType.IDENTIFIER
                        || AttributeAnalyzer.isIdentifierName(attribute.getName())) {
                    byIdentifier.computeIfAbsent(attribute.getName(), k -> new ArrayList<>()).add(schema.getName());
                }
            }
            if (schema.hasTimestamp()) {
                timestamped.add(schema.getName());
            }
        }

        List<CrossSchemaPattern> patterns = new ArrayList<>();
        byAttribute.forEach((attribute, names) -> {
            if (names.size() > 1 && !"timestamp".equals(attribute)) {
                patterns.add(new CrossSchemaPattern("Common attribute: " + attribute, "common_attribute",
                        names, 0.9, String.format("Attribute '%s' appears in %d schemas", attribute, names.size())));
            }
        });
        if (timestamped.size() > 1) {
            patterns.add(new CrossSchemaPattern("Temporal alignment possible", "temporal_alignment",
                    timestamped, 0.95,
                    String.format("%d schemas have timestamp fields for correlation", timestamped.size())));
        }
        byIdentifier.forEach((attribute, names) -> {
            if (names.size() > 1) {
                patterns.add(new CrossSchemaPattern("Potential join key: " + attribute, "join_candidate",
                        names, 0.8, String.format("ID field '%s' could link %d schemas", attribute, names.size())));
            }
        });
        return patterns;
    }

    List<Insight> insights(List<Schema> schemas, List<CrossSchemaPattern> patterns, List<Relationship> relationships) {
        List<Insight> insights = new ArrayList<>();

        for (Schema schema : schemas) {
            double overall = schema.getQuality().overallScore();
            if (overall < LOW_QUALITY_SCORE) {
                Map<String, Object> evidence = new LinkedHashMap<>();
                evidence.put("quality_score", overall);
                evidence.put("completeness", schema.getQuality().completeness());
                insights.add(Insight.builder()
                        .id("quality-" + schema.getName())
                        .type("data_quality")
                        .severity(Severity.WARNING)
                        .title("Low data quality in " + schema.getName())
                        .description(String.format("Schema %s has quality score of %.2f", schema.getName(), overall))
                        .impact("May affect accuracy of analysis and dashboards")
                        .evidence(evidence)
                        .actions(List.of("Review data collection for this schema",
                                "Check for missing required fields"))
                        .build());
            }
        }

        for (Schema schema : schemas) {
            for (Attribute attribute : schema.getAttributes()) {
                if (attribute.getCardinality().highCardinality()
                        && attribute.getCardinality().ratio() > VERY_HIGH_CARDINALITY) {
                    Map<String, Object> evidence = new LinkedHashMap<>();
                    evidence.put("unique_values", attribute.getCardinality().unique());
                    evidence.put("total_values", attribute.getCardinality().total());
                    insights.add(Insight.builder()
                            .id("cardinality-" + schema.getName() + "-" + attribute.getName())
                            .type("performance")
                            .severity(Severity.INFO)
                            .title("High cardinality attribute: " + schema.getName() + "." + attribute.getName())
                            .description(String.format("Attribute has %.0f%% unique values",
                                    attribute.getCardinality().ratio() * 100))
                            .impact("May impact query performance when used in FACET")
                            .evidence(evidence)
                            .actions(List.of("Avoid faceting on this attribute without a LIMIT",
                                    "Use time-based aggregations to reduce cardinality"))
                            .build());
                }
            }
        }

        long joinCandidates = patterns.stream().filter(p -> "join_candidate".equals(p.type())).count();
        if (joinCandidates > 0) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("join_candidates", joinCandidates);
            evidence.put("total_patterns", patterns.size());
            insights.add(Insight.builder()
                    .id("opportunities")
                    .type("opportunity")
                    .severity(Severity.INFO)
                    .title(String.format("Found %d potential data relationships", joinCandidates))
                    .description("Multiple schemas share common ID fields that could be used for joins")
                    .impact("Combining sources gives richer dashboards")
                    .evidence(evidence)
                    .actions(List.of("Explore queries that combine the related schemas"))
                    .build());
        }

        for (Relationship relationship : relationships) {
            if (relationship.type() != RelationshipType.JOIN) {
                continue;
            }
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("confidence", relationship.confidence());
            evidence.putAll(relationship.metadata());
            insights.add(Insight.builder()
                    .id("relationship-" + relationship.id())
                    .type("relationship")
                    .severity(Severity.INFO)
                    .title(String.format("%s.%s joins %s.%s", relationship.sourceSchema(),
                            relationship.sourceAttribute(), relationship.targetSchema(), relationship.targetAttribute()))
                    .description(String.format("Confirmed on sampled values with confidence %.2f",
                            relationship.confidence()))
                    .impact("Enables correlated analysis across both event types")
                    .evidence(evidence)
                    .actions(List.of("Use " + relationship.sourceAttribute() + " to correlate "
                            + relationship.sourceSchema() + " with " + relationship.targetSchema()))
                    .build());
        }

        insights.sort(Comparator.comparing(Insight::severity).reversed());
        return insights;
    }

    ExecutionPlan plan(DiscoveryHints hints, List<Schema> schemas, int relationshipCount) {
        List<ExecutionStep> steps = new ArrayList<>();
        steps.add(new ExecutionStep("Schema Discovery", "discovery", Duration.ofSeconds(2), "completed",
                String.format("Discovered %d schemas", schemas.size())));
        steps.add(new ExecutionStep("Relationship Mining", "analysis", Duration.ofSeconds(2), "completed",
                String.format("Found %d relationships", relationshipCount)));

        String purpose = hints.getPurpose() == null ? "" : hints.getPurpose().toLowerCase(Locale.ROOT);
        if (purpose.contains("performance")) {
            steps.add(new ExecutionStep("Performance Pattern Analysis", "analysis", Duration.ofSeconds(1), "planned",
                    "Analyze response times, error rates and throughput patterns"));
        } else if (purpose.contains("cost")) {
            steps.add(new ExecutionStep("Usage Analysis", "analysis", Duration.ofSeconds(1), "planned",
                    "Analyze ingestion rates and storage patterns"));
        }
        steps.add(new ExecutionStep("Dashboard Generation", "visualization", Duration.ofSeconds(3), "planned",
                "Generate a dashboard from the discovered insights"));

        Duration total = steps.stream().map(ExecutionStep::estimate).reduce(Duration.ZERO, Duration::plus);
        return new ExecutionPlan(steps, total, parallelism);
    }

    List<String> recommendations(List<Insight> insights) {
        Map<String, Long> counts = new TreeMap<>();
        insights.forEach(i -> counts.merge(i.type(), 1L, Long::sum));

        List<String> recommendations = new ArrayList<>();
        if (counts.containsKey("data_quality")) {
            recommendations.add(String.format("Address %d data quality issues before building production dashboards",
                    counts.get("data_quality")));
        }
        if (counts.containsKey("performance")) {
            recommendations.add("Consider performance optimizations for high-cardinality attributes");
        }
        if (counts.containsKey("opportunity") || counts.containsKey("relationship")) {
            recommendations.add("Explore data relationships to create comprehensive views");
        }
        recommendations.add("Enable result caching for frequently accessed schemas");
        return recommendations;
    }
}
