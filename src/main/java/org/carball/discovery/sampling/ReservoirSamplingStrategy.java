package org.carball.discovery.sampling;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.sample.TimeRange;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Walks the range in sequential batches and keeps a fixed-size reservoir, so no population count is
 * needed up front. Suited to long or unbounded ranges.
 */
@Slf4j
public class ReservoirSamplingStrategy extends QuerySamplingStrategy {

    public static final String NAME = "reservoir";

    static final Duration MIN_BATCH = Duration.ofMinutes(5);
    static final int MAX_BATCHES = 48;

    public ReservoirSamplingStrategy(QueryClient client, Random random) {
        super(client, random);
    }

    @Override
    public DataSample sample(SamplingParams params) throws QueryException {
        Reservoir<Map<String, Object>> reservoir = new Reservoir<>(params.getMaxSamples(), randomFor(params));

        List<TimeRange> batches = params.getTimeRange().split(batchCount(params.getTimeRange()));
        for (TimeRange batch : batches) {
            for (Map<String, Object> record : fetch(params, batch, MAX_QUERY_LIMIT)) {
                reservoir.offer(record);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("records_seen", reservoir.seen());
        metadata.put("batches", batches.size());
        log.debug("Reservoir sample of {}: kept {} of {} records seen in {} batches",
                params.getEventType(), reservoir.items().size(), reservoir.seen(), batches.size());

        return DataSample.of(params.getEventType(), reservoir.items(), reservoir.seen(), NAME,
                params.getTimeRange(), metadata);
    }

    static int batchCount(TimeRange range) {
        long byMinimum = Math.max(1, range.duration().toMillis() / MIN_BATCH.toMillis());
        return (int) Math.min(byMinimum, MAX_BATCHES);
    }

    @Override
    public long estimateSampleSize(long totalRecords) {
        return Math.min(10_000, totalRecords);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
