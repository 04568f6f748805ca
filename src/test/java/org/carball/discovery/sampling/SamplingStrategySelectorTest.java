package org.carball.discovery.sampling;

import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.CardinalityProfile;
import org.carball.discovery.model.schema.DataType;
import org.carball.discovery.model.schema.SemanticType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SamplingStrategySelectorTest {

    private SamplingStrategySelector selector;

    @BeforeEach
    void setUp() {
        selector = new SamplingStrategySelector(List.of("adaptive", "stratified", "random", "reservoir"), 1000);
    }

    @Test
    public void shouldTakeEverythingRandomlyForSmallPopulations() {
        assertThat(selector.select(new DataProfile(800, Duration.ofHours(1), true, false))).isEqualTo("random");
    }

    @Test
    public void shouldAdaptForHugeVolumes() {
        assertThat(selector.select(new DataProfile(2_000_000_000L, Duration.ofHours(1), true, false))).isEqualTo("adaptive");
    }

    @Test
    public void shouldStreamLongWindows() {
        assertThat(selector.select(new DataProfile(5_000_000, Duration.ofDays(7), true, false))).isEqualTo("reservoir");
    }

    @Test
    public void shouldStreamHighCardinalityData() {
        assertThat(selector.select(new DataProfile(50_000, Duration.ofHours(1), true, true))).isEqualTo("reservoir");
        assertThat(selector.select(new DataProfile(50_000, Duration.ofHours(1), false, true))).isEqualTo("reservoir");
    }

    @Test
    public void shouldPreferAdaptiveOverHighCardinalityForHugeVolumes() {
        assertThat(selector.select(new DataProfile(2_000_000_000L, Duration.ofHours(1), true, true))).isEqualTo("adaptive");
    }

    @Test
    public void shouldFallBackWhenReservoirIsDisabled() {
        // Given
        SamplingStrategySelector withoutReservoir = new SamplingStrategySelector(List.of("random", "stratified"), 1000);

        // When/Then
        assertThat(withoutReservoir.select(new DataProfile(50_000, Duration.ofHours(1), true, true))).isEqualTo("random");
    }

    @Test
    public void shouldDeriveShapeFromAttributes() {
        // Given
        Attribute timestamp = attribute("timestamp", DataType.TIMESTAMP, SemanticType.TIMESTAMP, true);
        Attribute searchTerm = attribute("searchTerm", DataType.STRING, SemanticType.CUSTOM, true);
        Attribute sessionId = attribute("sessionId", DataType.STRING, SemanticType.IDENTIFIER, true);
        Attribute duration = attribute("duration", DataType.NUMERIC, SemanticType.DURATION, true);
        Attribute region = attribute("region", DataType.STRING, SemanticType.CUSTOM, false);

        // When
        DataProfile dimensions = DataProfile.fromAttributes(50_000, Duration.ofHours(1),
                List.of(timestamp, searchTerm, region));
        DataProfile uniqueByNature = DataProfile.fromAttributes(50_000, Duration.ofHours(1),
                List.of(sessionId, duration, region));

        // Then
        assertThat(dimensions.hasTimeSeries()).isTrue();
        assertThat(dimensions.hasHighCardinality()).isTrue();
        assertThat(uniqueByNature.hasTimeSeries()).isFalse();
        assertThat(uniqueByNature.hasHighCardinality()).isFalse();
        assertThat(selector.select(uniqueByNature)).isEqualTo("random");
    }

    @Test
    public void shouldAssumeTimeSeriesBeforeAnalysis() {
        // When
        DataProfile profile = DataProfile.volumeOnly(50_000, Duration.ofHours(1));

        // Then
        assertThat(profile.hasTimeSeries()).isTrue();
        assertThat(profile.hasHighCardinality()).isFalse();
        assertThat(selector.select(profile)).isEqualTo("stratified");
    }

    @Test
    public void shouldStratifyTimeSeries() {
        assertThat(selector.select(new DataProfile(50_000, Duration.ofHours(1), true, false))).isEqualTo("stratified");
        assertThat(selector.select(new DataProfile(50_000, Duration.ofHours(1), false, false))).isEqualTo("random");
    }

    @Test
    public void shouldFallBackToFirstEnabledStrategy() {
        // Given
        SamplingStrategySelector restricted = new SamplingStrategySelector(List.of("stratified", "random"), 1000);

        // When
        String selected = restricted.select(new DataProfile(5_000_000, Duration.ofDays(7), true, false));

        // Then
        assertThat(selected).isEqualTo("stratified");
    }

    @Test
    public void shouldRejectUnknownOrEmptyStrategyLists() {
        assertThatThrownBy(() -> new SamplingStrategySelector(List.of("systematic"), 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("systematic");
        assertThatThrownBy(() -> new SamplingStrategySelector(List.of(), 1000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldComputeHourlyRate() {
        assertThat(new DataProfile(7200, Duration.ofHours(2), false, false).recordsPerHour()).isEqualTo(3600.0);
    }

    private Attribute attribute(String name, DataType dataType, SemanticType semanticType, boolean highCardinality) {
        CardinalityProfile cardinality = highCardinality
                ? new CardinalityProfile(900, 1000, 0.9, true, List.of())
                : new CardinalityProfile(5, 1000, 0.005, false, List.of());
        return Attribute.builder()
                .name(name)
                .dataType(dataType)
                .semanticType(semanticType)
                .cardinality(cardinality)
                .build();
    }
}
