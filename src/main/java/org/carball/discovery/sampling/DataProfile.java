package org.carball.discovery.sampling;

import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.DataType;
import org.carball.discovery.model.schema.SemanticType;

import java.time.Duration;
import java.util.List;

/**
 * Volume and shape of one event type, gathered before choosing a sampling strategy.
 */
public record DataProfile(long totalRecords, Duration window, boolean hasTimeSeries, boolean hasHighCardinality) {

    /**
     * Profile for an event type whose attributes have not been analyzed yet. Every NRDB event
     * carries a {@code timestamp}, so time series is assumed and cardinality is unknown.
     */
    public static DataProfile volumeOnly(long totalRecords, Duration window) {
        return new DataProfile(totalRecords, window, true, false);
    }

    /**
     * Derives the shape flags from analyzed attributes. Only string dimensions count toward high
     * cardinality; identifiers are unique by nature and measurements rarely repeat.
     */
    public static DataProfile fromAttributes(long totalRecords, Duration window, List<Attribute> attributes) {
        boolean timeSeries = attributes.stream().anyMatch(Attribute::isTemporal);
        boolean highCardinality = attributes.stream()
                .filter(a -> a.getDataType() == DataType.STRING)
                .filter(a -> a.getSemanticType() != SemanticType.IDENTIFIER)
                .anyMatch(a -> a.getCardinality() != null && a.getCardinality().highCardinality());
        return new DataProfile(totalRecords, window, timeSeries, highCardinality);
    }

    public double recordsPerHour() {
        double hours = Math.max(1.0 / 60, window.toMinutes() / 60.0);
        return totalRecords / hours;
    }
}
