package org.carball.discovery.sampling;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ReservoirTest {

    @Test
    public void shouldKeepEverythingUntilFull() {
        // Given
        Reservoir<Integer> reservoir = new Reservoir<>(5, new Random(1));

        // When
        for (int i = 0; i < 3; i++) {
            reservoir.offer(i);
        }

        // Then
        assertThat(reservoir.items()).containsExactly(0, 1, 2);
        assertThat(reservoir.seen()).isEqualTo(3);
    }

    @Test
    public void shouldNeverExceedCapacity() {
        // Given
        Reservoir<Integer> reservoir = new Reservoir<>(10, new Random(2));

        // When
        for (int i = 0; i < 10_000; i++) {
            reservoir.offer(i);
        }

        // Then
        assertThat(reservoir.items()).hasSize(10).doesNotHaveDuplicates();
        assertThat(reservoir.seen()).isEqualTo(10_000);
    }

    @Test
    public void shouldIncludeEveryItemWithEqualProbability() {
        // Given
        int population = 1000;
        int capacity = 100;
        int trials = 2000;
        int[] hits = new int[population];
        Random random = new Random(42);

        // When
        for (int trial = 0; trial < trials; trial++) {
            Reservoir<Integer> reservoir = new Reservoir<>(capacity, random);
            for (int i = 0; i < population; i++) {
                reservoir.offer(i);
            }
            reservoir.items().forEach(item -> hits[item]++);
        }

        // Then
        double expected = (double) capacity / population;
        assertThat(averageRate(hits, 0, 100, trials)).isCloseTo(expected, within(0.01));
        assertThat(averageRate(hits, 450, 550, trials)).isCloseTo(expected, within(0.01));
        assertThat(averageRate(hits, 900, 1000, trials)).isCloseTo(expected, within(0.01));
    }

    @Test
    public void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new Reservoir<String>(0, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static double averageRate(int[] hits, int from, int to, int trials) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += (double) hits[i] / trials;
        }
        return sum / (to - from);
    }
}
