package org.carball.discovery.sampling;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Chooses a strategy name from a data profile, restricted to the configured strategy list.
 */
@Slf4j
public class SamplingStrategySelector {

    static final long HUGE_VOLUME = 1_000_000_000L;
    static final Duration STREAMING_WINDOW = Duration.ofDays(7);

    private final List<String> allowed;
    private final int sampleSize;

    public SamplingStrategySelector(List<String> allowed, int sampleSize) {
        if (allowed.isEmpty()) {
            throw new IllegalArgumentException("At least one sampling strategy must be enabled");
        }
        allowed.forEach(name -> {
            if (!SamplingStrategies.names().contains(name)) {
                throw new IllegalArgumentException("Unknown sampling strategy: " + name);
            }
        });
        this.allowed = List.copyOf(allowed);
        this.sampleSize = sampleSize;
    }

    /**
     * Small populations are read whole; otherwise huge volumes adapt, high cardinality and long
     * windows stream through a reservoir, and time series are stratified.
     */
    public String select(DataProfile profile) {
        String preferred;
        if (profile.totalRecords() <= sampleSize) {
            preferred = RandomSamplingStrategy.NAME;
        } else if (profile.totalRecords() > HUGE_VOLUME) {
            preferred = AdaptiveSamplingStrategy.NAME;
        } else if (profile.hasHighCardinality() || profile.window().compareTo(STREAMING_WINDOW) >= 0) {
            preferred = ReservoirSamplingStrategy.NAME;
        } else if (profile.hasTimeSeries() && profile.totalRecords() > 10L * sampleSize) {
            preferred = StratifiedSamplingStrategy.NAME;
        } else {
            preferred = RandomSamplingStrategy.NAME;
        }

        if (allowed.contains(preferred)) {
            return preferred;
        }
        log.debug("Preferred strategy {} is disabled, falling back to {}", preferred, allowed.get(0));
        return allowed.get(0);
    }
}
