package org.carball.discovery.pattern;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.analyzer.AttributeAnalyzer;
import org.carball.discovery.model.pattern.DetectedPattern;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.Schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered detector and keeps the union of their findings. Patterns on the same
 * attribute are not mutually exclusive; callers rank by confidence.
 */
@Slf4j
public class PatternEngine {

    public static final double SCHEMA_PATTERN_MIN_CONFIDENCE = 0.6;

    private final List<PatternDetector> detectors;

    public PatternEngine() {
        this(List.of(
                new TimeSeriesDetector(),
                new DistributionDetector(),
                new FormatDetector(),
                new SequenceDetector()));
    }

    public PatternEngine(List<PatternDetector> detectors) {
        this.detectors = List.copyOf(detectors);
        log.debug("Initialized PatternEngine with detectors: {}",
                this.detectors.stream().map(PatternDetector::name).toList());
    }

    /**
     * @param values non-null values in chronological order
     */
    public List<Pattern> detectPatterns(Attribute attribute, List<Object> values) {
        List<Pattern> patterns = new ArrayList<>();
        for (PatternDetector detector : detectors) {
            if (!detector.supports(attribute.getDataType())) {
                continue;
            }
            try {
                patterns.addAll(detector.detect(attribute.getName(), values));
            } catch (RuntimeException e) {
                log.warn("Detector {} failed on {}: {}", detector.name(), attribute.getName(), e.getMessage());
                log.debug("Detector failure", e);
            }
        }
        patterns.sort(Comparator.comparingDouble(Pattern::confidence).reversed());
        return patterns;
    }

    /**
     * Attaches attribute patterns to the schema's attributes and returns those confident enough
     * to be reported at schema level.
     */
    public List<DetectedPattern> detectSchemaPatterns(Schema schema, DataSample sample) {
        DataSample ordered = chronological(sample);
        List<DetectedPattern> detected = new ArrayList<>();

        for (Attribute attribute : schema.getAttributes()) {
            List<Pattern> patterns = detectPatterns(attribute, ordered.nonNullValues(attribute.getName()));
            attribute.setPatterns(patterns);

            for (Pattern pattern : patterns) {
                if (pattern.confidence() >= SCHEMA_PATTERN_MIN_CONFIDENCE) {
                    detected.add(new DetectedPattern(
                            attribute.getName() + "." + pattern.subtype(),
                            pattern.type(),
                            pattern.confidence(),
                            List.of(attribute.getName()),
                            pattern.description(),
                            pattern.parameters()));
                }
            }
        }

        detected.sort(Comparator.comparingDouble(DetectedPattern::confidence).reversed());
        log.debug("Detected {} schema-level patterns in {}", detected.size(), schema.getName());
        return detected;
    }

    /**
     * Orders records oldest first when they carry a timestamp; NRDB returns newest first.
     */
    static DataSample chronological(DataSample sample) {
        boolean timestamped = !sample.isEmpty()
                && sample.records().stream().allMatch(r -> AttributeAnalyzer.toInstant(r.get("timestamp")) != null);
        if (!timestamped) {
            return sample;
        }
        List<Map<String, Object>> records = new ArrayList<>(sample.records());
        records.sort(Comparator.comparing((Map<String, Object> r) -> AttributeAnalyzer.toInstant(r.get("timestamp")),
                Comparator.<Instant>naturalOrder()));
        return sample.toBuilder().records(records).build();
    }
}
