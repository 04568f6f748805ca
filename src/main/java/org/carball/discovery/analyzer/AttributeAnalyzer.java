package org.carball.discovery.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.CardinalityProfile;
import org.carball.discovery.model.schema.DataType;
import org.carball.discovery.model.schema.SemanticType;
import org.carball.discovery.model.schema.Statistics;
import org.carball.discovery.model.schema.ValueFrequency;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Infers type, semantic type, cardinality and statistics for every attribute in a sample.
 * Stateless: the same sample always yields the same attributes.
 */
@Slf4j
public class AttributeAnalyzer {

    static final double FORMAT_MATCH_RATIO = 0.9;
    static final int TOP_VALUES = 10;
    static final int MAX_SAMPLE_VALUES = 10;
    static final int HIGH_CARDINALITY_MIN_UNIQUE = 100;
    static final double HIGH_CARDINALITY_RATIO = 0.5;

    // Epoch milliseconds between 2000 and 2100
    private static final double MIN_EPOCH_MILLIS = 946_684_800_000d;
    private static final double MAX_EPOCH_MILLIS = 4_102_444_800_000d;

    // uri as a whole word: uri, request_uri, uri_path, requestUri, uriPath
    private static final Pattern SNAKE_URI = Pattern.compile("(?:^|_)uri(?:_|$)");
    private static final Pattern CAMEL_URI = Pattern.compile("(?:^uri|Uri|(?<=[a-z])URI)(?:[A-Z_]|$)");

    public List<Attribute> analyze(DataSample sample) {
        Set<String> names = new TreeSet<>();
        sample.records().forEach(record -> names.addAll(record.keySet()));

        List<Attribute> attributes = new ArrayList<>(names.size());
        for (String name : names) {
            attributes.add(analyzeAttribute(name, sample.values(name)));
        }
        log.debug("Analyzed {} attributes of {} from {} records", attributes.size(), sample.eventType(), sample.sampleSize());
        return attributes;
    }

    /**
     * Analyzes one attribute. {@code values} holds one entry per record, null where the record lacks it.
     */
    public Attribute analyzeAttribute(String name, List<Object> values) {
        List<Object> present = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null) {
                present.add(value);
            }
        }

        DataType dataType = inferDataType(name, present);
        SemanticType semanticType = inferSemanticType(name, dataType, present);
        double nullRatio = values.isEmpty() ? 1.0 : (double) (values.size() - present.size()) / values.size();

        return Attribute.builder()
                .name(name)
                .dataType(dataType)
                .semanticType(semanticType)
                .nullRatio(nullRatio)
                .cardinality(cardinality(present))
                .statistics(statistics(dataType, present))
                .sampleValues(sampleValues(present))
                .build();
    }

    public DataType inferDataType(String name, List<Object> present) {
        if (present.isEmpty()) {
            return DataType.UNKNOWN;
        }

        Map<DataType, Integer> votes = new EnumMap<>(DataType.class);
        for (Object value : present) {
            votes.merge(valueTypeOf(value), 1, Integer::sum);
        }
        DataType majority = votes.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(DataType.UNKNOWN);

        if (majority == DataType.NUMERIC && looksLikeEpochTimestamps(name, present)) {
            return DataType.TIMESTAMP;
        }
        if (majority == DataType.STRING && matchRatio(present, ValueFormat.TIMESTAMP) >= FORMAT_MATCH_RATIO) {
            return DataType.TIMESTAMP;
        }
        return majority;
    }

    public static DataType valueTypeOf(Object value) {
        if (value instanceof Number) {
            return DataType.NUMERIC;
        }
        if (value instanceof Boolean) {
            return DataType.BOOLEAN;
        }
        if (value instanceof String) {
            return DataType.STRING;
        }
        if (value instanceof Instant) {
            return DataType.TIMESTAMP;
        }
        if (value instanceof Map) {
            return DataType.JSON;
        }
        if (value instanceof Collection || value.getClass().isArray()) {
            return DataType.ARRAY;
        }
        return DataType.UNKNOWN;
    }

    /**
     * Name hints win; otherwise at least 90% of string values must match one format.
     */
    public SemanticType inferSemanticType(String name, DataType dataType, List<Object> present) {
        SemanticType byName = semanticTypeFromName(name);
        if (byName != null) {
            return byName;
        }
        if (dataType == DataType.TIMESTAMP) {
            return SemanticType.TIMESTAMP;
        }
        if (dataType == DataType.JSON) {
            return SemanticType.JSON_OBJECT;
        }
        if (dataType != DataType.STRING || present.isEmpty()) {
            return SemanticType.CUSTOM;
        }

        Map<ValueFormat, SemanticType> candidates = new EnumMap<>(ValueFormat.class);
        candidates.put(ValueFormat.EMAIL, SemanticType.EMAIL);
        candidates.put(ValueFormat.URL, SemanticType.URL);
        candidates.put(ValueFormat.IP_ADDRESS, SemanticType.IP_ADDRESS);
        candidates.put(ValueFormat.UUID, SemanticType.IDENTIFIER);
        candidates.put(ValueFormat.JSON, SemanticType.JSON_OBJECT);
        candidates.put(ValueFormat.PERCENTAGE, SemanticType.PERCENTAGE);
        candidates.put(ValueFormat.CURRENCY, SemanticType.CURRENCY);
        candidates.put(ValueFormat.FILE_PATH, SemanticType.FILE_PATH);

        for (Map.Entry<ValueFormat, SemanticType> candidate : candidates.entrySet()) {
            if (matchRatio(present, candidate.getKey()) >= FORMAT_MATCH_RATIO) {
                return candidate.getValue();
            }
        }
        return SemanticType.CUSTOM;
    }

    static SemanticType semanticTypeFromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);

        if (lower.contains("email")) {
            return SemanticType.EMAIL;
        }
        if (lower.contains("url") || isUriName(name) || lower.contains("href")) {
            return SemanticType.URL;
        }
        if (lower.equals("ip") || lower.endsWith("_ip") || name.endsWith("Ip") || name.endsWith("IP")
                || lower.contains("ipaddress") || lower.contains("ip_address")) {
            return SemanticType.IP_ADDRESS;
        }
        if (lower.contains("useragent") || lower.contains("user_agent")) {
            return SemanticType.USER_AGENT;
        }
        if (lower.contains("price") || lower.contains("cost") || lower.contains("amount")
                || lower.contains("revenue") || lower.contains("currency")) {
            return SemanticType.CURRENCY;
        }
        if (lower.contains("country")) {
            return SemanticType.COUNTRY;
        }
        if (lower.contains("latitude") || lower.contains("longitude") || lower.equals("lat")
                || lower.equals("lng") || lower.equals("lon")) {
            return SemanticType.LAT_LONG;
        }
        if (lower.contains("duration") || lower.contains("latency") || lower.contains("elapsed")
                || lower.contains("responsetime")) {
            return SemanticType.DURATION;
        }
        if (lower.contains("percent") || lower.endsWith("pct")) {
            return SemanticType.PERCENTAGE;
        }
        if (lower.contains("filepath") || lower.contains("file_path") || lower.equals("path")) {
            return SemanticType.FILE_PATH;
        }
        if (isIdentifierName(name)) {
            return SemanticType.IDENTIFIER;
        }
        return null;
    }

    static boolean isUriName(String name) {
        return SNAKE_URI.matcher(name.toLowerCase(Locale.ROOT)).find() || CAMEL_URI.matcher(name).find();
    }

    public static boolean isIdentifierName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("id") || name.endsWith("Id") || name.endsWith("ID") || lower.endsWith("_id")
                || lower.endsWith("guid") || lower.endsWith("uuid");
    }

    private boolean looksLikeEpochTimestamps(String name, List<Object> present) {
        if (!name.toLowerCase(Locale.ROOT).contains("timestamp")) {
            return false;
        }
        for (Object value : present) {
            Double d = StatUtils.toDouble(value);
            if (d == null || d < MIN_EPOCH_MILLIS || d > MAX_EPOCH_MILLIS) {
                return false;
            }
        }
        return true;
    }

    static double matchRatio(List<Object> present, ValueFormat format) {
        int strings = 0;
        int matches = 0;
        for (Object value : present) {
            if (value instanceof String text) {
                strings++;
                if (format.matches(text)) {
                    matches++;
                }
            }
        }
        return strings == 0 ? 0.0 : (double) matches / strings;
    }

    CardinalityProfile cardinality(List<Object> present) {
        if (present.isEmpty()) {
            return CardinalityProfile.empty();
        }
        Map<String, Long> counts = new HashMap<>();
        for (Object value : present) {
            counts.merge(String.valueOf(value), 1L, Long::sum);
        }

        long unique = counts.size();
        long total = present.size();
        double ratio = (double) unique / total;
        boolean high = unique > HIGH_CARDINALITY_MIN_UNIQUE && ratio > HIGH_CARDINALITY_RATIO;

        List<ValueFrequency> top = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_VALUES)
                .map(e -> new ValueFrequency(e.getKey(), e.getValue(), (double) e.getValue() / total))
                .toList();

        return new CardinalityProfile(unique, total, ratio, high, top);
    }

    Statistics statistics(DataType dataType, List<Object> present) {
        return switch (dataType) {
            case NUMERIC -> new Statistics(numericStatistics(StatUtils.numericValues(present)), null, null);
            case STRING -> new Statistics(null, textStatistics(present), null);
            case TIMESTAMP -> new Statistics(null, null, temporalStatistics(present));
            default -> Statistics.empty();
        };
    }

    private Statistics.Numeric numericStatistics(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double[] sorted = StatUtils.sorted(values);
        return new Statistics.Numeric(
                sorted[0],
                sorted[sorted.length - 1],
                StatUtils.mean(values),
                StatUtils.percentile(sorted, 50),
                StatUtils.stdDev(values),
                StatUtils.percentile(sorted, 25),
                StatUtils.percentile(sorted, 75),
                StatUtils.percentile(sorted, 95),
                StatUtils.percentile(sorted, 99));
    }

    private Statistics.Text textStatistics(List<Object> present) {
        int min = Integer.MAX_VALUE;
        int max = 0;
        long totalLength = 0;
        long empty = 0;
        Set<String> distinct = new HashSet<>();
        int count = 0;
        for (Object value : present) {
            if (!(value instanceof String text)) {
                continue;
            }
            count++;
            min = Math.min(min, text.length());
            max = Math.max(max, text.length());
            totalLength += text.length();
            if (text.isEmpty()) {
                empty++;
            }
            distinct.add(text);
        }
        if (count == 0) {
            return null;
        }
        return new Statistics.Text(min, max, (double) totalLength / count, empty, distinct.size());
    }

    private Statistics.Temporal temporalStatistics(List<Object> present) {
        List<Long> millis = new ArrayList<>();
        for (Object value : present) {
            Instant instant = toInstant(value);
            if (instant != null) {
                millis.add(instant.toEpochMilli());
            }
        }
        if (millis.isEmpty()) {
            return null;
        }
        millis.sort(null);
        long earliest = millis.get(0);
        long latest = millis.get(millis.size() - 1);

        List<Long> gaps = new ArrayList<>();
        for (int i = 1; i < millis.size(); i++) {
            long gap = millis.get(i) - millis.get(i - 1);
            if (gap > 0) {
                gaps.add(gap);
            }
        }
        gaps.sort(null);
        Duration granularity = gaps.isEmpty() ? Duration.ZERO : Duration.ofMillis(gaps.get(gaps.size() / 2));

        return new Statistics.Temporal(Instant.ofEpochMilli(earliest), Instant.ofEpochMilli(latest),
                Duration.ofMillis(latest - earliest), granularity);
    }

    /**
     * Reads epoch milliseconds, {@link Instant}s and ISO-8601 strings; anything else yields null.
     */
    public static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text && ValueFormat.isIsoTimestamp(text)) {
            return Instant.parse(text);
        }
        return null;
    }

    private List<Object> sampleValues(List<Object> present) {
        Set<Object> distinct = new LinkedHashSet<>();
        for (Object value : present) {
            if (distinct.size() >= MAX_SAMPLE_VALUES) {
                break;
            }
            distinct.add(value);
        }
        return new ArrayList<>(distinct);
    }
}
