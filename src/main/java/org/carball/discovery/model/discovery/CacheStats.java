package org.carball.discovery.model.discovery;

public record CacheStats(long hits, long misses, long evictions, int size) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
