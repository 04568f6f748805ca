package org.carball.discovery.engine;

import org.carball.discovery.MutableClock;
import org.carball.discovery.model.discovery.CacheStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String, Integer> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        cache = new TtlCache<>(Duration.ofMinutes(5), clock);
    }

    @Test
    public void shouldReturnValueBeforeExpiry() {
        // Given
        cache.put("Transaction", 42);
        clock.advance(Duration.ofMinutes(4));

        // When/Then
        assertThat(cache.get("Transaction")).contains(42);
    }

    @Test
    public void shouldExpireEntryAtTtl() {
        // Given
        cache.put("Transaction", 42);
        clock.advance(Duration.ofMinutes(5));

        // When/Then
        assertThat(cache.get("Transaction")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldRestartTtlWhenOverwritten() {
        // Given
        cache.put("Transaction", 1);
        clock.advance(Duration.ofMinutes(4));
        cache.put("Transaction", 2);
        clock.advance(Duration.ofMinutes(4));

        // When/Then
        assertThat(cache.get("Transaction")).contains(2);
    }

    @Test
    public void shouldTrackHitsMissesAndEvictions() {
        // Given
        cache.put("Transaction", 1);
        cache.put("PageView", 2);
        cache.get("Transaction");
        cache.get("Unknown");
        clock.advance(Duration.ofMinutes(6));
        cache.get("PageView");

        // When
        CacheStats stats = cache.stats();

        // Then both entries have expired, including the one never read again
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.evictions()).isEqualTo(2);
        assertThat(stats.size()).isZero();
    }

    @Test
    public void shouldPurgeExpiredEntriesThatAreNeverReadAgain() {
        // Given
        TtlCache<String, Integer> shortLived = new TtlCache<>(Duration.ofMinutes(1), clock);
        for (int i = 0; i < 10_000; i++) {
            shortLived.put("EventType" + i, i);
        }

        // When
        clock.advance(Duration.ofHours(5));
        shortLived.put("Transaction", 1);

        // Then
        assertThat(shortLived.size()).isEqualTo(1);
        assertThat(shortLived.stats().evictions()).isEqualTo(10_000);
    }

    @Test
    public void shouldBoundNumberOfEntries() {
        // Given
        TtlCache<String, Integer> bounded = new TtlCache<>(Duration.ofHours(1), 2, clock);

        // When
        bounded.put("Transaction", 1);
        bounded.put("PageView", 2);
        bounded.put("Log", 3);

        // Then
        assertThat(bounded.size()).isEqualTo(2);
    }

    @Test
    public void shouldInvalidateAndClear() {
        // Given
        cache.put("Transaction", 1);
        cache.put("PageView", 2);

        // When
        cache.invalidate("Transaction");

        // Then
        assertThat(cache.get("Transaction")).isEmpty();
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldRejectNegativeTtl() {
        // When/Then
        assertThatThrownBy(() -> new TtlCache<String, Integer>(Duration.ofSeconds(-1), clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be negative");
    }
}
