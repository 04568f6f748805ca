package org.carball.discovery.model.sample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
        }
    }

    public static TimeRange last(Duration window, Clock clock) {
        Instant now = clock.instant();
        return new TimeRange(now.minus(window), now);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * Splits the range into {@code parts} contiguous slices of equal length.
     */
    public List<TimeRange> split(int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("Cannot split a time range into " + parts + " parts");
        }
        List<TimeRange> slices = new ArrayList<>(parts);
        long totalMillis = duration().toMillis();
        for (int i = 0; i < parts; i++) {
            Instant sliceStart = start.plusMillis(totalMillis * i / parts);
            Instant sliceEnd = i == parts - 1 ? end : start.plusMillis(totalMillis * (i + 1) / parts);
            slices.add(new TimeRange(sliceStart, sliceEnd));
        }
        return slices;
    }

    /**
     * Renders the range as an NRQL {@code SINCE ... UNTIL ...} clause using epoch milliseconds.
     */
    public String toNrql() {
        return "SINCE " + start.toEpochMilli() + " UNTIL " + end.toEpochMilli();
    }
}
