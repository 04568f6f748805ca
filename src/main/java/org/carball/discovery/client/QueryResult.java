package org.carball.discovery.client;

import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> results, QueryMetadata metadata, PerformanceInfo performanceInfo) {

    public QueryResult {
        results = results == null ? List.of() : results;
        metadata = metadata == null ? QueryMetadata.empty() : metadata;
    }

    public static QueryResult of(List<Map<String, Object>> results) {
        return new QueryResult(results, QueryMetadata.empty(), null);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * Reads a numeric column from the first row, or 0 when absent.
     */
    public long firstLong(String column) {
        if (results.isEmpty()) {
            return 0;
        }
        Object value = results.get(0).get(column);
        return value instanceof Number number ? number.longValue() : 0;
    }
}
