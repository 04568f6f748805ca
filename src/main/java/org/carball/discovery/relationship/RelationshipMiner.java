package org.carball.discovery.relationship;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.analyzer.AttributeAnalyzer;
import org.carball.discovery.analyzer.StatUtils;
import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.relationship.Correlation;
import org.carball.discovery.model.relationship.CorrelationStrength;
import org.carball.discovery.model.relationship.Evidence;
import org.carball.discovery.model.relationship.JoinCardinality;
import org.carball.discovery.model.relationship.JoinabilityResult;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.relationship.RelationshipType;
import org.carball.discovery.model.relationship.SchemaAttribute;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.sample.TimeRange;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.Schema;
import org.carball.discovery.model.schema.SemanticType;
import org.carball.discovery.sampling.SamplingParams;
import org.carball.discovery.sampling.SamplingStrategy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds join, correlation, temporal and hierarchy relationships between schemas, then adds
 * transitively derived ones. Each call samples every schema at most once.
 */
@Slf4j
public class RelationshipMiner {

    static final double MIN_MATCH_RATIO = 0.1;
    static final double MIN_CORRELATION = 0.7;
    static final int MIN_CORRELATION_PAIRS = 10;
    static final int MAX_TEMPORAL_LAG = 3;
    static final double HIERARCHY_CONFIDENCE = 0.6;
    static final double TRANSITIVE_MIN_CONFIDENCE = 0.5;
    static final double UNIQUE_RATIO = 0.95;
    static final int MIN_STEM_LENGTH = 4;

    private static final long HOUR_MILLIS = Duration.ofHours(1).toMillis();

    private static final List<String[]> HIERARCHIES = List.of(
            new String[]{"Application", "Transaction"},
            new String[]{"Host", "Process"},
            new String[]{"Service", "Endpoint"},
            new String[]{"User", "Session"},
            new String[]{"Order", "OrderItem"});

    private final SamplingStrategy sampler;
    private final QueryClient client;
    private final Duration window;
    private final int sampleSize;
    private final Clock clock;

    public RelationshipMiner(SamplingStrategy sampler, QueryClient client, Duration window, int sampleSize, Clock clock) {
        this.sampler = sampler;
        this.client = client;
        this.window = window;
        this.sampleSize = sampleSize;
        this.clock = clock;
    }

    public List<Relationship> findRelationships(List<Schema> schemas) throws QueryException {
        log.info("Mining relationships across {} schemas", schemas.size());
        Map<String, DataSample> samples = new HashMap<>();

        List<Relationship> relationships = new ArrayList<>();
        relationships.addAll(findJoins(schemas, samples));
        relationships.addAll(findCorrelationRelationships(schemas, samples));
        relationships.addAll(findTemporalRelationships(schemas));
        relationships.addAll(findHierarchies(schemas));

        RelationshipGraph graph = new RelationshipGraph(schemas.stream().map(Schema::getName).toList(), relationships);
        relationships.addAll(graph.deriveTransitive(TRANSITIVE_MIN_CONFIDENCE));

        log.info("Found {} relationships", relationships.size());
        return relationships;
    }

    // Join discovery

    List<Relationship> findJoins(List<Schema> schemas, Map<String, DataSample> samples) throws QueryException {
        List<Relationship> joins = new ArrayList<>();
        for (int i = 0; i < schemas.size(); i++) {
            for (int j = i + 1; j < schemas.size(); j++) {
                Schema source = schemas.get(i);
                Schema target = schemas.get(j);
                for (Attribute a : source.getAttributes()) {
                    for (Attribute b : target.getAttributes()) {
                        if (!isJoinCandidate(source.getName(), a, target.getName(), b)) {
                            continue;
                        }
                        SchemaAttribute sa = new SchemaAttribute(source.getName(), a);
                        SchemaAttribute sb = new SchemaAttribute(target.getName(), b);
                        JoinabilityResult result = testJoinability(sa, sb, sampleFor(source.getName(), samples),
                                sampleFor(target.getName(), samples));
                        if (result.joinable()) {
                            joins.add(joinRelationship(sa, sb, result, samples.get(source.getName()).totalRecords()));
                        }
                    }
                }
            }
        }
        log.debug("Join pass found {} relationships", joins.size());
        return joins;
    }

    static boolean isJoinCandidate(String sourceSchema, Attribute a, String targetSchema, Attribute b) {
        if (a.isTemporal() || b.isTemporal()) {
            return false;
        }
        String nameA = a.getName();
        String nameB = b.getName();
        if (nameA.equals(nameB)) {
            return true;
        }
        if (a.getSemanticType() == SemanticType.IDENTIFIER && b.getSemanticType() == SemanticType.IDENTIFIER
                && stem(nameA).equals(stem(nameB)) && !stem(nameA).isEmpty()) {
            return true;
        }
        if (referencesSchema(nameA, targetSchema, nameB) || referencesSchema(nameB, sourceSchema, nameA)) {
            return true;
        }
        String normA = normalize(nameA);
        String normB = normalize(nameB);
        if (normA.length() <= normB.length()) {
            return normA.length() >= MIN_STEM_LENGTH && normB.contains(normA);
        }
        return normB.length() >= MIN_STEM_LENGTH && normA.contains(normB);
    }

    // orderId in Transaction against id in Order
    private static boolean referencesSchema(String name, String otherSchema, String otherName) {
        String lower = name.toLowerCase(Locale.ROOT);
        String schema = otherSchema.toLowerCase(Locale.ROOT);
        return otherName.equalsIgnoreCase("id") && (lower.equals(schema + "id") || lower.equals(schema + "_id"));
    }

    static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "").replace(".", "");
    }

    static String stem(String name) {
        String normalized = normalize(name);
        for (String suffix : List.of("uuid", "guid", "id")) {
            if (normalized.endsWith(suffix)) {
                return normalized.substring(0, normalized.length() - suffix.length());
            }
        }
        return normalized;
    }

    /**
     * Samples both schemas and measures how many sampled source values appear on the target side.
     */
    public JoinabilityResult testJoinability(SchemaAttribute source, SchemaAttribute target) throws QueryException {
        Map<String, DataSample> samples = new HashMap<>();
        return testJoinability(source, target, sampleFor(source.schemaName(), samples),
                sampleFor(target.schemaName(), samples));
    }

    JoinabilityResult testJoinability(SchemaAttribute source, SchemaAttribute target,
                                      DataSample sourceSample, DataSample targetSample) {
        List<String> sourceValues = asStrings(sourceSample.nonNullValues(source.attributeName()));
        List<String> targetValues = asStrings(targetSample.nonNullValues(target.attributeName()));
        if (sourceValues.isEmpty() || targetValues.isEmpty()) {
            return JoinabilityResult.notJoinable(sourceValues.size());
        }

        Set<String> targetSet = new HashSet<>(targetValues);
        int matches = 0;
        for (String value : sourceValues) {
            if (targetSet.contains(value)) {
                matches++;
            }
        }
        double matchRatio = (double) matches / sourceValues.size();
        JoinCardinality cardinality = JoinCardinality.of(isUnique(sourceValues), isUnique(targetValues));

        return new JoinabilityResult(matchRatio >= MIN_MATCH_RATIO, matchRatio, cardinality, matches,
                sourceValues.size());
    }

    private static boolean isUnique(List<String> values) {
        return (double) new HashSet<>(values).size() / values.size() >= UNIQUE_RATIO;
    }

    private Relationship joinRelationship(SchemaAttribute source, SchemaAttribute target,
                                          JoinabilityResult result, long sourceTotal) {
        double confidence = result.matchRatio() * result.cardinality().getConfidenceFactor();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("cardinality", result.cardinality().getValue());
        metadata.put("estimated_rows", Math.round(sourceTotal * result.matchRatio()));

        return Relationship.builder()
                .type(RelationshipType.JOIN)
                .sourceSchema(source.schemaName())
                .sourceAttribute(source.attributeName())
                .targetSchema(target.schemaName())
                .targetAttribute(target.attributeName())
                .confidence(confidence)
                .evidence(List.of(
                        new Evidence("match_ratio", result.matchRatio(), result.matchRatio(),
                                String.format("%d of %d sampled values match", result.sampleMatches(), result.totalSamples())),
                        new Evidence("cardinality", result.cardinality().getValue(),
                                result.cardinality().getConfidenceFactor(), "Join cardinality from sampled uniqueness"),
                        new Evidence("sample_size", result.totalSamples(), 1.0, "Sampled source values")))
                .metadata(metadata)
                .build();
    }

    // Statistical correlation

    private List<Relationship> findCorrelationRelationships(List<Schema> schemas, Map<String, DataSample> samples)
            throws QueryException {
        List<SchemaAttribute> numeric = new ArrayList<>();
        for (Schema schema : schemas) {
            for (Attribute attribute : schema.getAttributes()) {
                if (attribute.isNumeric() && !attribute.isTemporal()) {
                    numeric.add(new SchemaAttribute(schema.getName(), attribute));
                }
            }
        }

        List<Relationship> relationships = new ArrayList<>();
        for (Correlation correlation : findCorrelations(numeric, samples)) {
            if (Math.abs(correlation.coefficient()) <= MIN_CORRELATION) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("strength", correlation.strength().getValue());
            metadata.put("coefficient", correlation.coefficient());

            relationships.add(Relationship.builder()
                    .type(RelationshipType.CORRELATION)
                    .sourceSchema(correlation.first().schemaName())
                    .sourceAttribute(correlation.first().attributeName())
                    .targetSchema(correlation.second().schemaName())
                    .targetAttribute(correlation.second().attributeName())
                    .confidence(Math.abs(correlation.coefficient()))
                    .evidence(List.of(
                            new Evidence("pearson", correlation.coefficient(), Math.abs(correlation.coefficient()),
                                    "Pearson correlation coefficient"),
                            new Evidence("p_value", correlation.pValue(), 1.0 - correlation.pValue(),
                                    "Two-sided significance of the coefficient"),
                            new Evidence("sample_size", correlation.sampleSize(), 1.0, "Aligned value pairs")))
                    .metadata(metadata)
                    .build());
        }
        log.debug("Correlation pass found {} relationships", relationships.size());
        return relationships;
    }

    /**
     * Pearson correlation for every pair of attributes (i &lt; j) with at least ten aligned
     * values. Attributes of the same schema align by record; across schemas they align by
     * hourly bucket means.
     */
    public List<Correlation> findCorrelations(List<SchemaAttribute> attributes) throws QueryException {
        return findCorrelations(attributes, new HashMap<>());
    }

    List<Correlation> findCorrelations(List<SchemaAttribute> attributes, Map<String, DataSample> samples)
            throws QueryException {
        List<Correlation> correlations = new ArrayList<>();
        for (int i = 0; i < attributes.size(); i++) {
            for (int j = i + 1; j < attributes.size(); j++) {
                SchemaAttribute first = attributes.get(i);
                SchemaAttribute second = attributes.get(j);
                double[][] pairs = first.schemaName().equals(second.schemaName())
                        ? alignByRecord(sampleFor(first.schemaName(), samples), first, second)
                        : alignByHour(sampleFor(first.schemaName(), samples), first,
                                sampleFor(second.schemaName(), samples), second);
                int n = pairs[0].length;
                if (n < MIN_CORRELATION_PAIRS) {
                    continue;
                }
                double r = StatUtils.pearson(pairs[0], pairs[1]);
                correlations.add(new Correlation(first, second, r, StatUtils.correlationPValue(r, n), n,
                        CorrelationStrength.of(r)));
            }
        }
        return correlations;
    }

    private static double[][] alignByRecord(DataSample sample, SchemaAttribute first, SchemaAttribute second) {
        List<double[]> pairs = new ArrayList<>();
        for (Map<String, Object> record : sample.records()) {
            Double x = StatUtils.toDouble(record.get(first.attributeName()));
            Double y = StatUtils.toDouble(record.get(second.attributeName()));
            if (x != null && y != null) {
                pairs.add(new double[]{x, y});
            }
        }
        return unzip(pairs);
    }

    private static double[][] alignByHour(DataSample firstSample, SchemaAttribute first,
                                          DataSample secondSample, SchemaAttribute second) {
        Map<Long, Double> firstMeans = hourlyMeans(firstSample, first.attributeName());
        Map<Long, Double> secondMeans = hourlyMeans(secondSample, second.attributeName());
        List<double[]> pairs = new ArrayList<>();
        for (Map.Entry<Long, Double> entry : firstMeans.entrySet()) {
            Double other = secondMeans.get(entry.getKey());
            if (other != null) {
                pairs.add(new double[]{entry.getValue(), other});
            }
        }
        return unzip(pairs);
    }

    private static Map<Long, Double> hourlyMeans(DataSample sample, String attribute) {
        Map<Long, double[]> sums = new TreeMap<>();
        for (Map<String, Object> record : sample.records()) {
            Instant timestamp = AttributeAnalyzer.toInstant(record.get("timestamp"));
            Double value = StatUtils.toDouble(record.get(attribute));
            if (timestamp == null || value == null) {
                continue;
            }
            double[] sum = sums.computeIfAbsent(timestamp.toEpochMilli() / HOUR_MILLIS, k -> new double[2]);
            sum[0] += value;
            sum[1]++;
        }
        Map<Long, Double> means = new TreeMap<>();
        sums.forEach((hour, sum) -> means.put(hour, sum[0] / sum[1]));
        return means;
    }

    private static double[][] unzip(List<double[]> pairs) {
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return new double[][]{x, y};
    }

    // Temporal co-movement

    List<Relationship> findTemporalRelationships(List<Schema> schemas) throws QueryException {
        TimeRange range = TimeRange.last(window, clock);
        Map<String, double[]> series = new LinkedHashMap<>();
        for (Schema schema : schemas) {
            if (schema.hasTimestamp()) {
                series.put(schema.getName(), hourlyCounts(schema.getEventType(), range));
            }
        }

        List<Relationship> relationships = new ArrayList<>();
        List<String> names = new ArrayList<>(series.keySet());
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                LaggedCorrelation best = bestLag(series.get(names.get(i)), series.get(names.get(j)));
                if (best == null || Math.abs(best.coefficient()) <= MIN_CORRELATION) {
                    continue;
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("lag", best.lag());
                metadata.put("lag_unit", "hour");

                relationships.add(Relationship.builder()
                        .type(RelationshipType.TEMPORAL)
                        .sourceSchema(names.get(i))
                        .sourceAttribute("timestamp")
                        .targetSchema(names.get(j))
                        .targetAttribute("timestamp")
                        .confidence(Math.abs(best.coefficient()))
                        .evidence(List.of(
                                new Evidence("cross_correlation", best.coefficient(), Math.abs(best.coefficient()),
                                        String.format("Hourly volumes co-move at lag %d", best.lag())),
                                new Evidence("sample_size", best.points(), 1.0, "Aligned hourly buckets")))
                        .metadata(metadata)
                        .build());
            }
        }
        log.debug("Temporal pass found {} relationships", relationships.size());
        return relationships;
    }

    private double[] hourlyCounts(String eventType, TimeRange range) throws QueryException {
        String nrql = "SELECT count(*) FROM " + QueryClient.quote(eventType) + " " + range.toNrql()
                + " TIMESERIES 1 hour";
        List<Map<String, Object>> rows = client.query(nrql).results();
        double[] counts = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            Double count = StatUtils.toDouble(rows.get(i).get("count"));
            counts[i] = count == null ? 0.0 : count;
        }
        return counts;
    }

    record LaggedCorrelation(int lag, double coefficient, int points) {}

    /**
     * Cross-correlation within the lag window; positive lag means the second series trails.
     */
    static LaggedCorrelation bestLag(double[] first, double[] second) {
        LaggedCorrelation best = null;
        for (int lag = -MAX_TEMPORAL_LAG; lag <= MAX_TEMPORAL_LAG; lag++) {
            int start = Math.max(0, -lag);
            int end = Math.min(first.length, second.length - lag);
            int n = end - start;
            if (n < MIN_CORRELATION_PAIRS) {
                continue;
            }
            double[] x = new double[n];
            double[] y = new double[n];
            for (int k = 0; k < n; k++) {
                x[k] = first[start + k];
                y[k] = second[start + k + lag];
            }
            double r = StatUtils.pearson(x, y);
            if (best == null || Math.abs(r) > Math.abs(best.coefficient())) {
                best = new LaggedCorrelation(lag, r, n);
            }
        }
        return best;
    }

    // Known parent/child event types

    static List<Relationship> findHierarchies(List<Schema> schemas) {
        List<Relationship> relationships = new ArrayList<>();
        for (int i = 0; i < schemas.size(); i++) {
            for (int j = i + 1; j < schemas.size(); j++) {
                String a = schemas.get(i).getName();
                String b = schemas.get(j).getName();
                for (String[] pair : HIERARCHIES) {
                    if (isParentChild(a, b, pair)) {
                        relationships.add(hierarchy(a, b));
                        break;
                    }
                    if (isParentChild(b, a, pair)) {
                        relationships.add(hierarchy(b, a));
                        break;
                    }
                }
            }
        }
        return relationships;
    }

    private static boolean isParentChild(String parent, String child, String[] pair) {
        return parent.contains(pair[0]) && !parent.contains(pair[1]) && child.contains(pair[1]);
    }

    private static Relationship hierarchy(String parent, String child) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("parent", parent);
        metadata.put("child", child);
        return Relationship.builder()
                .type(RelationshipType.HIERARCHY)
                .sourceSchema(parent)
                .sourceAttribute("*")
                .targetSchema(child)
                .targetAttribute("*")
                .confidence(HIERARCHY_CONFIDENCE)
                .evidence(List.of(new Evidence("naming", parent + "/" + child, HIERARCHY_CONFIDENCE,
                        "Event type names follow a known parent/child pattern")))
                .metadata(metadata)
                .build();
    }

    private DataSample sampleFor(String schemaName, Map<String, DataSample> samples) throws QueryException {
        DataSample sample = samples.get(schemaName);
        if (sample == null) {
            sample = sampler.sample(SamplingParams.builder()
                    .eventType(schemaName)
                    .timeRange(TimeRange.last(window, clock))
                    .maxSamples(sampleSize)
                    .build());
            samples.put(schemaName, sample);
        }
        return sample;
    }

    private static List<String> asStrings(List<Object> values) {
        List<String> strings = new ArrayList<>(values.size());
        for (Object value : values) {
            strings.add(String.valueOf(value));
        }
        return strings;
    }
}
