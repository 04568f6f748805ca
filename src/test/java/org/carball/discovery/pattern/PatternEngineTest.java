package org.carball.discovery.pattern;

import org.carball.discovery.model.pattern.DetectedPattern;
import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.pattern.PatternType;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.DataType;
import org.carball.discovery.model.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class PatternEngineTest {

    @Test
    public void shouldContinueWhenOneDetectorFails() {
        // Given
        PatternDetector failing = new PatternDetector() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public boolean supports(DataType dataType) {
                return true;
            }

            @Override
            public List<Pattern> detect(String attribute, List<Object> values) {
                throw new IllegalStateException("boom");
            }
        };
        PatternEngine engine = new PatternEngine(List.of(failing, new SequenceDetector()));
        Attribute attribute = Attribute.builder().name("offset").dataType(DataType.NUMERIC).build();

        // When
        List<Pattern> patterns = engine.detectPatterns(attribute, List.of(1, 2, 3, 4, 5, 6));

        // Then
        assertThat(patterns).extracting(Pattern::subtype).containsExactly("arithmetic");
    }

    @Test
    public void shouldSortPatternsByConfidence() {
        // Given
        PatternEngine engine = new PatternEngine();
        Attribute attribute = Attribute.builder().name("counter").dataType(DataType.NUMERIC).build();
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            values.add(i * 2.0);
        }

        // When
        List<Pattern> patterns = engine.detectPatterns(attribute, values);

        // Then
        assertThat(patterns).extracting(Pattern::type).contains(PatternType.TREND, PatternType.SEQUENCE);
        for (int i = 1; i < patterns.size(); i++) {
            assertThat(patterns.get(i - 1).confidence()).isGreaterThanOrEqualTo(patterns.get(i).confidence());
        }
    }

    @Test
    public void shouldLiftConfidentPatternsToSchemaInChronologicalOrder() {
        // Given records newest first, as the store returns them
        List<Map<String, Object>> records = new ArrayList<>();
        long start = 1_705_312_800_000L;
        for (int i = 59; i >= 0; i--) {
            Map<String, Object> record = new HashMap<>();
            record.put("timestamp", start + i * 60_000L);
            record.put("requests", 100.0 + i * 10);
            records.add(record);
        }
        DataSample sample = DataSample.of("Metric", records, 60, "random", null, Map.of());
        Attribute requests = Attribute.builder().name("requests").dataType(DataType.NUMERIC).build();
        Schema schema = Schema.builder().name("Metric").attributes(new ArrayList<>(List.of(requests))).build();

        // When
        List<DetectedPattern> detected = new PatternEngine().detectSchemaPatterns(schema, sample);

        // Then
        assertThat(detected).extracting(DetectedPattern::name).contains("requests.increasing", "requests.arithmetic");
        assertThat(detected).allSatisfy(p -> assertThat(p.confidence())
                .isGreaterThanOrEqualTo(PatternEngine.SCHEMA_PATTERN_MIN_CONFIDENCE));
        assertThat(requests.getPatterns()).isNotEmpty();
    }

    @Test
    public void shouldKeepOrderWithoutTimestamps() {
        // Given
        List<Map<String, Object>> records = List.of(Map.of("v", 3), Map.of("v", 1));
        DataSample sample = DataSample.of("X", records, 2, "random", null, Map.of());

        // Then
        assertThat(PatternEngine.chronological(sample)).isSameAs(sample);
    }
}
