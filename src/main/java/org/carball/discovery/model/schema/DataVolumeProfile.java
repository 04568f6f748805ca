package org.carball.discovery.model.schema;

public record DataVolumeProfile(
    long totalRecords,
    double recordsPerHour,
    double recordsPerDay,
    double growthRate,
    int retentionDays,
    double estimatedSizeGb
) {
    public static DataVolumeProfile unknown() {
        return new DataVolumeProfile(0, 0.0, 0.0, 0.0, 0, 0.0);
    }
}
