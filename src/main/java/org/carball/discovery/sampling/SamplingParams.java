package org.carball.discovery.sampling;

import lombok.Builder;
import lombok.Data;
import org.carball.discovery.model.sample.TimeRange;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class SamplingParams {
    private String eventType;

    private TimeRange timeRange;

    @Builder.Default
    private int maxSamples = 1000;

    /** Attributes to select; empty selects every attribute. */
    @Builder.Default
    private List<String> attributes = new ArrayList<>();

    /** Optional NRQL condition, without the WHERE keyword. */
    private String whereClause;

    /** Strategy name; null lets the engine choose. */
    private String strategy;

    private Long seed;
}
