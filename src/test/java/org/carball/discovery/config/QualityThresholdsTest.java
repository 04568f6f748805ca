package org.carball.discovery.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class QualityThresholdsTest {

    @Test
    public void shouldDefaultWeightsToOne() {
        // Given
        QualityThresholds thresholds = QualityThresholds.defaults();

        // Then
        assertThat(thresholds.totalWeight()).isCloseTo(1.0, within(1e-9));
        assertThat(thresholds.getMaxFreshnessDelay()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    public void shouldToleratePartialWeights() {
        // Given
        QualityThresholds thresholds = QualityThresholds.defaults();
        thresholds.setValidityWeight(0.5);

        // When
        thresholds.validate();

        // Then
        assertThat(thresholds.totalWeight()).isCloseTo(1.35, within(1e-9));
        assertThat(thresholds.getDescription()).contains("completeness=0.95");
    }
}
