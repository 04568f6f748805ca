package org.carball.discovery.sampling;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.sample.TimeRange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Splits the range into equal time strata and samples each with an even share of the budget,
 * so bursts in one period cannot crowd out the rest.
 */
@Slf4j
public class StratifiedSamplingStrategy extends QuerySamplingStrategy {

    public static final String NAME = "stratified";
    public static final int DEFAULT_STRATA = 10;

    private final int strata;

    public StratifiedSamplingStrategy(QueryClient client, Random random) {
        this(client, random, DEFAULT_STRATA);
    }

    public StratifiedSamplingStrategy(QueryClient client, Random random, int strata) {
        super(client, random);
        if (strata < 1) {
            throw new IllegalArgumentException("Strata count must be positive: " + strata);
        }
        this.strata = strata;
    }

    @Override
    public DataSample sample(SamplingParams params) throws QueryException {
        long total = countRecords(params, params.getTimeRange());
        int perStratum = Math.max(1, params.getMaxSamples() / strata);

        List<Map<String, Object>> records = new ArrayList<>();
        List<Integer> stratumSizes = new ArrayList<>(strata);
        for (TimeRange stratum : params.getTimeRange().split(strata)) {
            List<Map<String, Object>> stratumRecords = fetch(params, stratum, perStratum);
            stratumSizes.add(stratumRecords.size());
            records.addAll(stratumRecords);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("strata_count", strata);
        metadata.put("per_stratum_budget", perStratum);
        metadata.put("stratum_sizes", stratumSizes);
        log.debug("Stratified sample of {}: {} records over {} strata", params.getEventType(), records.size(), strata);

        return DataSample.of(params.getEventType(), records, total, NAME, params.getTimeRange(), metadata);
    }

    /**
     * 2% of the population, at most 20,000 and at least 500 (or everything when smaller).
     */
    @Override
    public long estimateSampleSize(long totalRecords) {
        long size = Math.min(totalRecords / 50, 20_000);
        return Math.max(size, Math.min(totalRecords, 500));
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getStrata() {
        return strata;
    }
}
