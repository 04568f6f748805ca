package org.carball.discovery.quality;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.analyzer.AttributeAnalyzer;
import org.carball.discovery.analyzer.StatUtils;
import org.carball.discovery.analyzer.ValueFormat;
import org.carball.discovery.config.QualityThresholds;
import org.carball.discovery.model.quality.AttributeQuality;
import org.carball.discovery.model.quality.DimensionScore;
import org.carball.discovery.model.quality.QualityDimension;
import org.carball.discovery.model.quality.QualityIssue;
import org.carball.discovery.model.quality.QualityMetrics;
import org.carball.discovery.model.quality.QualityRecommendation;
import org.carball.discovery.model.quality.QualityReport;
import org.carball.discovery.model.quality.Severity;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.DataType;
import org.carball.discovery.model.schema.Schema;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scores a schema's sample on completeness, consistency, timeliness, uniqueness and validity.
 * Every score lies in [0, 1]; an empty sample scores zero everywhere.
 */
@Slf4j
public class QualityAssessor {

    static final double CRITICAL_DEVIATION = 0.25;
    static final double WARNING_DEVIATION = 0.05;
    // Score used when a sample carries no timestamps to judge freshness by
    static final double UNKNOWN_TIMELINESS = 0.5;

    private final QualityThresholds thresholds;
    private final Clock clock;

    public QualityAssessor(QualityThresholds thresholds, Clock clock) {
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public QualityReport assess(Schema schema, DataSample sample) {
        Instant now = clock.instant();
        String schemaName = schema.getName();

        if (sample.isEmpty()) {
            log.warn("No records sampled for {}; reporting zero quality", schemaName);
            return emptyReport(schemaName, now);
        }

        List<Attribute> attributes = attributesOf(schema, sample);
        List<QualityIssue> issues = new ArrayList<>();
        Map<QualityDimension, DimensionScore> dimensions = new EnumMap<>(QualityDimension.class);

        dimensions.put(QualityDimension.COMPLETENESS, completeness(attributes, sample, issues, now));
        dimensions.put(QualityDimension.CONSISTENCY, consistency(attributes, sample, issues, now));
        dimensions.put(QualityDimension.TIMELINESS, timeliness(sample, issues, now));
        dimensions.put(QualityDimension.UNIQUENESS, uniqueness(sample, issues, now));
        dimensions.put(QualityDimension.VALIDITY, validity(attributes, sample, issues, now));

        double overall = overallScore(dimensions);
        List<QualityRecommendation> recommendations = recommend(schemaName, issues);

        log.debug("Quality of {}: overall {} with {} issues", schemaName, String.format("%.3f", overall), issues.size());
        return new QualityReport(schemaName, now, overall, dimensions, issues, recommendations);
    }

    public QualityMetrics toMetrics(QualityReport report) {
        return QualityMetrics.from(report);
    }

    /**
     * Completeness and validity of one attribute; {@code values} holds one entry per record.
     */
    public AttributeQuality assessAttribute(Attribute attribute, List<Object> values) {
        if (values.isEmpty()) {
            return new AttributeQuality(0.0, 0.0, 0.0, List.of("no values sampled"));
        }
        long present = values.stream().filter(v -> v != null).count();
        double completeness = (double) present / values.size();
        double validity = validityOf(attribute, values);

        List<String> issues = new ArrayList<>();
        if (completeness < thresholds.getExpectedCompleteness()) {
            issues.add(String.format("%.1f%% of values are missing", (1 - completeness) * 100));
        }
        if (validity < thresholds.getValidityThreshold()) {
            issues.add(String.format("%.1f%% of values do not conform to %s", (1 - validity) * 100,
                    attribute.getDataType().getValue()));
        }
        return new AttributeQuality(clamp((completeness + validity) / 2), completeness, validity, issues);
    }

    static Severity severityFor(double benchmark, double score) {
        double deviation = benchmark - score;
        if (deviation > CRITICAL_DEVIATION) {
            return Severity.CRITICAL;
        }
        if (deviation > WARNING_DEVIATION) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    private QualityReport emptyReport(String schemaName, Instant now) {
        Map<QualityDimension, DimensionScore> dimensions = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            dimensions.put(dimension, new DimensionScore(0.0, Map.of("records", 0), List.of("no records sampled")));
        }
        List<QualityIssue> issues = List.of(new QualityIssue(QualityDimension.COMPLETENESS, Severity.CRITICAL, null,
                "No records were sampled for " + schemaName,
                "Quality cannot be assessed without data", now));
        return new QualityReport(schemaName, now, 0.0, dimensions, issues, recommend(schemaName, issues));
    }

    private List<Attribute> attributesOf(Schema schema, DataSample sample) {
        if (!schema.getAttributes().isEmpty()) {
            return schema.getAttributes();
        }
        Set<String> names = new TreeSet<>();
        sample.records().forEach(r -> names.addAll(r.keySet()));
        AttributeAnalyzer analyzer = new AttributeAnalyzer();
        List<Attribute> attributes = new ArrayList<>();
        for (String name : names) {
            attributes.add(analyzer.analyzeAttribute(name, sample.values(name)));
        }
        return attributes;
    }

    private DimensionScore completeness(List<Attribute> attributes, DataSample sample,
                                        List<QualityIssue> issues, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        double sum = 0.0;
        double benchmark = thresholds.getExpectedCompleteness();

        for (Attribute attribute : attributes) {
            List<Object> values = sample.values(attribute.getName());
            long present = values.stream().filter(v -> v != null).count();
            double score = values.isEmpty() ? 0.0 : (double) present / values.size();
            details.put(attribute.getName(), score);
            sum += score;

            if (score < benchmark) {
                String description = String.format("Attribute %s is %.1f%% null, expected at most %.1f%%",
                        attribute.getName(), (1 - score) * 100, (1 - benchmark) * 100);
                notes.add(description);
                issues.add(new QualityIssue(QualityDimension.COMPLETENESS, severityFor(benchmark, score),
                        attribute.getName(), description, "Queries and joins on this attribute miss records", now));
            }
        }
        double score = attributes.isEmpty() ? 0.0 : sum / attributes.size();
        return new DimensionScore(clamp(score), details, notes);
    }

    private DimensionScore consistency(List<Attribute> attributes, DataSample sample,
                                       List<QualityIssue> issues, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        double sum = 0.0;
        int scored = 0;
        double benchmark = thresholds.getConsistencyThreshold();

        for (Attribute attribute : attributes) {
            List<Object> values = sample.nonNullValues(attribute.getName());
            if (values.isEmpty()) {
                continue;
            }
            long conforming = values.stream().filter(v -> conformsToSemanticType(attribute, v)).count();
            double score = (double) conforming / values.size();
            details.put(attribute.getName(), score);
            sum += score;
            scored++;

            if (score < benchmark) {
                String description = String.format("Attribute %s: %.1f%% of values do not fit its %s format",
                        attribute.getName(), (1 - score) * 100, attribute.getSemanticType().getValue());
                notes.add(description);
                issues.add(new QualityIssue(QualityDimension.CONSISTENCY, severityFor(benchmark, score),
                        attribute.getName(), description, "Mixed formats break grouping and parsing", now));
            }
        }
        return new DimensionScore(scored == 0 ? 0.0 : clamp(sum / scored), details, notes);
    }

    static boolean conformsToSemanticType(Attribute attribute, Object value) {
        Double number = StatUtils.toDouble(value);
        return switch (attribute.getSemanticType()) {
            case EMAIL -> value instanceof String s && ValueFormat.EMAIL.matches(s);
            case URL -> value instanceof String s && ValueFormat.URL.matches(s);
            case IP_ADDRESS -> value instanceof String s && ValueFormat.IP_ADDRESS.matches(s);
            case FILE_PATH -> value instanceof String s && ValueFormat.FILE_PATH.matches(s);
            case JSON_OBJECT -> value instanceof Map || (value instanceof String s && ValueFormat.JSON.matches(s));
            case TIMESTAMP -> AttributeAnalyzer.toInstant(value) != null;
            case PERCENTAGE -> number != null ? number >= 0 && number <= 100
                    : value instanceof String s && ValueFormat.PERCENTAGE.matches(s);
            case LAT_LONG -> number != null && number >= -180 && number <= 180;
            case DURATION -> number == null || number >= 0;
            default -> AttributeAnalyzer.valueTypeOf(value) == attribute.getDataType()
                    || attribute.getDataType() == DataType.UNKNOWN;
        };
    }

    private DimensionScore timeliness(DataSample sample, List<QualityIssue> issues, Instant now) {
        Instant latest = null;
        for (Map<String, Object> record : sample.records()) {
            Instant timestamp = AttributeAnalyzer.toInstant(record.get("timestamp"));
            if (timestamp != null && (latest == null || timestamp.isAfter(latest))) {
                latest = timestamp;
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (latest == null) {
            details.put("latest", null);
            String note = "No timestamps available to judge freshness";
            issues.add(new QualityIssue(QualityDimension.TIMELINESS, Severity.INFO, "timestamp", note,
                    "Freshness is unknown", now));
            return new DimensionScore(UNKNOWN_TIMELINESS, details, List.of(note));
        }

        Duration delay = Duration.between(latest, now);
        Duration maxDelay = thresholds.getMaxFreshnessDelay();
        double score = delay.compareTo(maxDelay) <= 0
                ? 1.0
                : (double) maxDelay.toMillis() / delay.toMillis();
        details.put("latest", latest.toString());
        details.put("delay_seconds", Math.max(0, delay.getSeconds()));

        List<String> notes = new ArrayList<>();
        if (score < thresholds.getTimelinessThreshold()) {
            String description = String.format("Newest record is %ds old, expected within %ds",
                    delay.getSeconds(), maxDelay.getSeconds());
            notes.add(description);
            issues.add(new QualityIssue(QualityDimension.TIMELINESS,
                    severityFor(thresholds.getTimelinessThreshold(), score), "timestamp", description,
                    "Dashboards and alerts lag behind reality", now));
        }
        return new DimensionScore(clamp(score), details, notes);
    }

    private DimensionScore uniqueness(DataSample sample, List<QualityIssue> issues, Instant now) {
        Set<Map<String, Object>> distinct = new HashSet<>(sample.records());
        double recordScore = (double) distinct.size() / sample.sampleSize();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("duplicate_records", sample.sampleSize() - distinct.size());
        double score = recordScore;

        List<Object> ids = sample.nonNullValues("id");
        if (!ids.isEmpty()) {
            double keyScore = (double) new HashSet<>(ids).size() / ids.size();
            details.put("duplicate_keys", ids.size() - new HashSet<>(ids).size());
            score = Math.min(score, keyScore);
        }

        List<String> notes = new ArrayList<>();
        double benchmark = thresholds.getUniquenessThreshold();
        if (score < benchmark) {
            String description = String.format("%.1f%% of sampled records or keys are duplicates", (1 - score) * 100);
            notes.add(description);
            issues.add(new QualityIssue(QualityDimension.UNIQUENESS, severityFor(benchmark, score), null,
                    description, "Counts and sums are inflated", now));
        }
        return new DimensionScore(clamp(score), details, notes);
    }

    private DimensionScore validity(List<Attribute> attributes, DataSample sample,
                                    List<QualityIssue> issues, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        double sum = 0.0;
        int scored = 0;
        double benchmark = thresholds.getValidityThreshold();

        for (Attribute attribute : attributes) {
            List<Object> values = sample.nonNullValues(attribute.getName());
            if (values.isEmpty()) {
                continue;
            }
            double score = validityOf(attribute, values);
            details.put(attribute.getName(), score);
            sum += score;
            scored++;

            if (score < benchmark) {
                String description = String.format("Attribute %s: %.1f%% of values are invalid for type %s",
                        attribute.getName(), (1 - score) * 100, attribute.getDataType().getValue());
                notes.add(description);
                issues.add(new QualityIssue(QualityDimension.VALIDITY, severityFor(benchmark, score),
                        attribute.getName(), description, "Invalid values are dropped or misread downstream", now));
            }
        }
        return new DimensionScore(scored == 0 ? 0.0 : clamp(sum / scored), details, notes);
    }

    private double validityOf(Attribute attribute, List<Object> values) {
        long considered = 0;
        long valid = 0;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            considered++;
            if (isValid(attribute.getDataType(), value)) {
                valid++;
            }
        }
        return considered == 0 ? 0.0 : (double) valid / considered;
    }

    static boolean isValid(DataType dataType, Object value) {
        return switch (dataType) {
            case NUMERIC -> StatUtils.toDouble(value) != null;
            case STRING -> value instanceof String s && !s.isBlank();
            case BOOLEAN -> value instanceof Boolean;
            case TIMESTAMP -> AttributeAnalyzer.toInstant(value) != null;
            case JSON -> value instanceof Map;
            case ARRAY -> AttributeAnalyzer.valueTypeOf(value) == DataType.ARRAY;
            case UNKNOWN -> true;
        };
    }

    private double overallScore(Map<QualityDimension, DimensionScore> dimensions) {
        double weighted = dimensions.get(QualityDimension.COMPLETENESS).score() * thresholds.getCompletenessWeight()
                + dimensions.get(QualityDimension.CONSISTENCY).score() * thresholds.getConsistencyWeight()
                + dimensions.get(QualityDimension.TIMELINESS).score() * thresholds.getTimelinessWeight()
                + dimensions.get(QualityDimension.UNIQUENESS).score() * thresholds.getUniquenessWeight()
                + dimensions.get(QualityDimension.VALIDITY).score() * thresholds.getValidityWeight();
        double total = thresholds.totalWeight();
        return total <= 0.0 ? 0.0 : clamp(weighted / total);
    }

    /**
     * One templated recommendation per dimension and attribute, highest severity first.
     */
    static List<QualityRecommendation> recommend(String schemaName, List<QualityIssue> issues) {
        Map<String, QualityRecommendation> byKey = new LinkedHashMap<>();
        List<QualityIssue> ordered = new ArrayList<>(issues);
        ordered.sort((a, b) -> b.severity().compareTo(a.severity()));

        for (QualityIssue issue : ordered) {
            if (issue.severity() == Severity.INFO) {
                continue;
            }
            String key = issue.dimension() + ":" + issue.attribute();
            if (byKey.containsKey(key)) {
                continue;
            }
            String target = issue.attribute() != null ? "attribute " + issue.attribute() : "event type " + schemaName;
            String description = switch (issue.dimension()) {
                case COMPLETENESS -> issue.attribute() == null
                        ? "Verify that " + schemaName + " is still being reported"
                        : "Populate " + target + " at the source or mark it optional";
                case CONSISTENCY -> "Standardize the format of " + target;
                case TIMELINESS -> "Investigate ingestion delay for " + schemaName;
                case UNIQUENESS -> "Deduplicate records of " + schemaName + " before ingestion";
                case VALIDITY -> "Add validation for " + target;
            };
            String effort = issue.severity() == Severity.CRITICAL ? "high" : "medium";
            byKey.put(key, new QualityRecommendation(issue.dimension(), issue.severity(), description,
                    issue.impact(), effort));
        }
        return new ArrayList<>(byKey.values());
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
