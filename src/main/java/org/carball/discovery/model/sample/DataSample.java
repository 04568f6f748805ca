package org.carball.discovery.model.sample;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw records drawn from one event type by a sampling strategy. Not persisted.
 */
@Builder(toBuilder = true)
public record DataSample(
    String eventType,
    List<Map<String, Object>> records,
    int sampleSize,
    long totalRecords,
    double samplingRate,
    String strategy,
    TimeRange timeRange,
    Map<String, Object> metadata
) {
    public DataSample {
        records = records == null ? List.of() : List.copyOf(records);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DataSample of(String eventType, List<Map<String, Object>> records, long totalRecords,
                                String strategy, TimeRange timeRange, Map<String, Object> metadata) {
        double rate = totalRecords > 0 ? Math.min(1.0, (double) records.size() / totalRecords) : 0.0;
        return new DataSample(eventType, records, records.size(), totalRecords, rate, strategy, timeRange, metadata);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Values of one attribute in record order; absent keys yield {@code null}.
     */
    public List<Object> values(String attribute) {
        List<Object> values = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            values.add(record.get(attribute));
        }
        return values;
    }

    public List<Object> nonNullValues(String attribute) {
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> record : records) {
            Object value = record.get(attribute);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
