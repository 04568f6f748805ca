package org.carball.discovery.client;

import java.time.Duration;

/**
 * Narrows {@code SHOW EVENT TYPES}. A null pattern or lookback means no restriction.
 */
public record EventTypeFilter(String pattern, long minRecordCount, Duration lookback) {

    public static EventTypeFilter all() {
        return new EventTypeFilter(null, 0, null);
    }
}
