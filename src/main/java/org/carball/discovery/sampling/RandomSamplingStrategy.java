package org.carball.discovery.sampling;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.sample.DataSample;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * One range query with a record limit. Over-fetches up to twice the budget and keeps a uniform
 * subset so the sample is not simply the newest records.
 */
@Slf4j
public class RandomSamplingStrategy extends QuerySamplingStrategy {

    public static final String NAME = "random";

    public RandomSamplingStrategy(QueryClient client, Random random) {
        super(client, random);
    }

    @Override
    public DataSample sample(SamplingParams params) throws QueryException {
        long total = countRecords(params, params.getTimeRange());
        int fetchLimit = (int) Math.min(MAX_QUERY_LIMIT, 2L * params.getMaxSamples());

        List<Map<String, Object>> fetched = fetch(params, params.getTimeRange(), fetchLimit);
        List<Map<String, Object>> records = subsample(fetched, params.getMaxSamples(), randomFor(params));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fetched", fetched.size());
        log.debug("Random sample of {}: {} of {} fetched records (population {})",
                params.getEventType(), records.size(), fetched.size(), total);

        return DataSample.of(params.getEventType(), records, total, NAME, params.getTimeRange(), metadata);
    }

    /**
     * 1% of the population, at most 10,000 and at least 100 (or everything when smaller).
     */
    @Override
    public long estimateSampleSize(long totalRecords) {
        long size = Math.min(totalRecords / 100, 10_000);
        return Math.max(size, Math.min(totalRecords, 100));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
