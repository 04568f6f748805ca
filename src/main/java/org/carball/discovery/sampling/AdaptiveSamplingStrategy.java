package org.carball.discovery.sampling;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.sample.DataSample;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Probes a small prefix of the range, sizes the sample from the population tier, then delegates.
 * NRDB returns the newest records first, so a probe that covers only a small part of the range means
 * the data is dense and a single limited query would miss older periods; those ranges are sampled
 * stratified, the rest randomly.
 */
@Slf4j
public class AdaptiveSamplingStrategy extends QuerySamplingStrategy {

    public static final String NAME = "adaptive";

    static final int PROBE_SIZE = 100;
    static final double DENSE_COVERAGE = 0.5;

    private final RandomSamplingStrategy randomStrategy;
    private final StratifiedSamplingStrategy stratifiedStrategy;

    public AdaptiveSamplingStrategy(QueryClient client, Random random) {
        super(client, random);
        this.randomStrategy = new RandomSamplingStrategy(client, random);
        this.stratifiedStrategy = new StratifiedSamplingStrategy(client, random);
    }

    @Override
    public DataSample sample(SamplingParams params) throws QueryException {
        long total = countRecords(params, params.getTimeRange());
        List<Map<String, Object>> probe = fetch(params, params.getTimeRange(), PROBE_SIZE);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("probe_size", probe.size());
        metadata.put("total_records", total);

        if (probe.size() < PROBE_SIZE) {
            // The probe already holds the whole population
            metadata.put("delegate", "probe");
            metadata.put("probe_coverage", 1.0);
            return DataSample.of(params.getEventType(), probe, Math.max(total, probe.size()), NAME,
                    params.getTimeRange(), metadata);
        }

        int size = (int) Math.max(1, Math.min(params.getMaxSamples(), estimateSampleSize(total)));
        double coverage = probeCoverage(probe, params);
        SamplingStrategy delegate = coverage < DENSE_COVERAGE ? stratifiedStrategy : randomStrategy;
        metadata.put("probe_coverage", coverage);
        metadata.put("delegate", delegate.getName());
        log.debug("Adaptive sampling of {}: population {}, target {}, probe coverage {}, using {}",
                params.getEventType(), total, size, String.format("%.2f", coverage), delegate.getName());

        DataSample delegated = delegate.sample(params.toBuilder().maxSamples(size).build());
        Map<String, Object> merged = new LinkedHashMap<>(delegated.metadata());
        merged.putAll(metadata);
        return delegated.toBuilder()
                .strategy(NAME)
                .metadata(merged)
                .build();
    }

    /**
     * Fraction of the requested range spanned by the probe's timestamps.
     */
    static double probeCoverage(List<Map<String, Object>> probe, SamplingParams params) {
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (Map<String, Object> record : probe) {
            if (record.get("timestamp") instanceof Number timestamp) {
                min = Math.min(min, timestamp.longValue());
                max = Math.max(max, timestamp.longValue());
            }
        }
        long rangeMillis = params.getTimeRange().duration().toMillis();
        if (min > max || rangeMillis <= 0) {
            return 1.0;
        }
        Instant start = params.getTimeRange().start();
        Instant end = params.getTimeRange().end();
        long clippedMin = Math.max(min, start.toEpochMilli());
        long clippedMax = Math.min(max, end.toEpochMilli());
        return Math.max(0.0, Math.min(1.0, (double) (clippedMax - clippedMin) / rangeMillis));
    }

    /**
     * Size tiers: everything up to 10k, 10% up to 100k, 1% up to 1M, then 0.1% capped at 50,000.
     */
    @Override
    public long estimateSampleSize(long totalRecords) {
        if (totalRecords <= 10_000) {
            return totalRecords;
        }
        if (totalRecords <= 100_000) {
            return totalRecords / 10;
        }
        if (totalRecords <= 1_000_000) {
            return totalRecords / 100;
        }
        return Math.min(totalRecords / 1000, 50_000);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
