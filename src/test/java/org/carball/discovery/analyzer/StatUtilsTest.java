package org.carball.discovery.analyzer;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class StatUtilsTest {

    @Test
    public void shouldSkipNonNumericValues() {
        assertThat(StatUtils.numericValues(Arrays.asList(1, null, "x", 2.5, Double.NaN))).containsExactly(1.0, 2.5);
    }

    @Test
    public void shouldComputeMomentsAndPercentiles() {
        // Given
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        // Then
        assertThat(StatUtils.mean(values)).isEqualTo(5.0);
        assertThat(StatUtils.stdDev(values)).isEqualTo(2.0);
        assertThat(StatUtils.percentile(StatUtils.sorted(values), 50)).isEqualTo(4.5);
        assertThat(StatUtils.percentile(new double[0], 50)).isZero();
        assertThat(StatUtils.skewness(new double[]{1, 1, 1})).isZero();
    }

    @Test
    public void shouldCorrelatePerfectlyLinearSeries() {
        // Given
        double[] x = {1, 2, 3, 4, 5};
        double[] y = {2, 4, 6, 8, 10};
        double[] inverse = {10, 8, 6, 4, 2};

        // Then
        assertThat(StatUtils.pearson(x, y)).isCloseTo(1.0, within(1e-12));
        assertThat(StatUtils.pearson(x, inverse)).isCloseTo(-1.0, within(1e-12));
        assertThat(StatUtils.pearson(x, new double[]{3, 3, 3, 3, 3})).isZero();
        assertThat(StatUtils.correlationPValue(1.0, 5)).isZero();
        assertThat(StatUtils.correlationPValue(0.0, 50)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    public void shouldRejectMismatchedSeries() {
        assertThatThrownBy(() -> StatUtils.pearson(new double[]{1, 2}, new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldFitLinearTrend() {
        // Given
        double[] y = new double[50];
        for (int i = 0; i < y.length; i++) {
            y[i] = 3.0 + 0.5 * i;
        }

        // When
        StatUtils.LinearFit fit = StatUtils.linearRegression(y);

        // Then
        assertThat(fit.slope()).isCloseTo(0.5, within(1e-9));
        assertThat(fit.intercept()).isCloseTo(3.0, within(1e-9));
        assertThat(fit.rSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(fit.slopeTStatistic()).isGreaterThan(100);
    }

    @Test
    public void shouldApproximateComplementaryErrorFunction() {
        assertThat(StatUtils.erfc(0.0)).isCloseTo(1.0, within(1e-6));
        assertThat(StatUtils.erfc(1.0)).isCloseTo(0.157299, within(1e-5));
        assertThat(StatUtils.erfc(-1.0)).isCloseTo(1.842701, within(1e-5));
    }
}
