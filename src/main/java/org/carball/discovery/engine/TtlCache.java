package org.carball.discovery.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.model.discovery.CacheStats;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine cache whose entries expire a fixed time after they were written. Time is read from the
 * given clock, and maintenance runs on the calling thread, so expired entries are purged as soon as
 * the cache is next touched.
 */
@Slf4j
public class TtlCache<K, V> {

    static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<K, V> cache;

    public TtlCache(Duration ttl, Clock clock) {
        this(ttl, DEFAULT_MAXIMUM_SIZE, clock);
    }

    public TtlCache(Duration ttl, long maximumSize, Clock clock) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must not be negative: " + ttl);
        }
        RemovalListener<K, V> onRemoval = (key, value, cause) -> {
            if (cause.wasEvicted()) {
                log.debug("Cache entry {} evicted ({})", key, cause);
            }
        };
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(() -> clock.millis() * 1_000_000L)
                .executor(Runnable::run)
                .removalListener(onRemoval)
                .recordStats()
                .build();
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(K key, V value) {
        cache.put(key, value);
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
    }

    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    public CacheStats stats() {
        int size = size();
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), size);
    }
}
