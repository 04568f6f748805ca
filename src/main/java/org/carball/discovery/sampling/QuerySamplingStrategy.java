package org.carball.discovery.sampling;

import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.sample.TimeRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Shared NRQL plumbing for strategies that sample through a {@link QueryClient}.
 */
abstract class QuerySamplingStrategy implements SamplingStrategy {

    /** NRQL's largest LIMIT. */
    static final int MAX_QUERY_LIMIT = 5000;

    protected final QueryClient client;
    protected final Random random;

    protected QuerySamplingStrategy(QueryClient client, Random random) {
        this.client = client;
        this.random = random;
    }

    protected String buildSampleQuery(SamplingParams params, TimeRange range, int limit) {
        StringBuilder nrql = new StringBuilder("SELECT ");
        nrql.append(params.getAttributes().isEmpty() ? "*"
                : params.getAttributes().stream().map(QueryClient::quote).collect(Collectors.joining(", ")));
        nrql.append(" FROM ").append(QueryClient.quote(params.getEventType()));
        if (params.getWhereClause() != null && !params.getWhereClause().isBlank()) {
            nrql.append(" WHERE ").append(params.getWhereClause());
        }
        nrql.append(' ').append(range.toNrql());
        nrql.append(" LIMIT ").append(Math.max(1, Math.min(limit, MAX_QUERY_LIMIT)));
        return nrql.toString();
    }

    protected List<Map<String, Object>> fetch(SamplingParams params, TimeRange range, int limit) throws QueryException {
        return client.query(buildSampleQuery(params, range, limit)).results();
    }

    protected long countRecords(SamplingParams params, TimeRange range) throws QueryException {
        return client.countRecords(params.getEventType(), range);
    }

    protected Random randomFor(SamplingParams params) {
        return params.getSeed() != null ? new Random(params.getSeed()) : random;
    }

    /**
     * Picks {@code size} records uniformly without replacement, keeping their original order.
     */
    protected static List<Map<String, Object>> subsample(List<Map<String, Object>> records, int size, Random random) {
        if (records.size() <= size) {
            return records;
        }
        Reservoir<Integer> positions = new Reservoir<>(size, random);
        for (int i = 0; i < records.size(); i++) {
            positions.offer(i);
        }
        List<Integer> chosen = new ArrayList<>(positions.items());
        chosen.sort(null);
        List<Map<String, Object>> result = new ArrayList<>(size);
        for (int position : chosen) {
            result.add(records.get(position));
        }
        return result;
    }
}
