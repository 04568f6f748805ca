package org.carball.discovery.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory stand-in for NRDB. Understands the statement shapes the engine issues:
 * {@code SHOW EVENT TYPES}, {@code SELECT count(*) FROM X}, hourly {@code ... TIMESERIES} counts and
 * {@code SELECT ... FROM X ... LIMIT n}.
 */
@Slf4j
public class MockQueryClient implements QueryClient {

    private static final Pattern FROM = Pattern.compile("\\bFROM\\s+(?:`([^`]+)`|(\\w+))", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT = Pattern.compile("\\bLIMIT\\s+(\\d+|MAX)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANGE = Pattern.compile("\\bSINCE\\s+(\\d{10,})\\s+UNTIL\\s+(\\d{10,})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COUNT = Pattern.compile("^SELECT\\s+count\\(\\*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIMESERIES = Pattern.compile("\\bTIMESERIES\\b", Pattern.CASE_INSENSITIVE);

    private static final int DEFAULT_LIMIT = 100;
    private static final int MAX_LIMIT = 5000;

    private final Map<String, MockEventType> eventTypes = new ConcurrentHashMap<>();
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final AtomicLong queryCounter = new AtomicLong();
    private final long seed;
    private final Clock clock;

    private volatile boolean shouldFail;
    private volatile int failureStatus = 503;
    private volatile Duration latency = Duration.ZERO;

    public MockQueryClient() {
        this(42L, Clock.systemUTC());
    }

    public MockQueryClient(long seed, Clock clock) {
        this.seed = seed;
        this.clock = clock;
    }

    public MockQueryClient addEventType(MockEventType eventType) {
        eventTypes.put(eventType.getName(), eventType);
        return this;
    }

    @Override
    public QueryResult query(String nrql) throws QueryException {
        long queryNumber = queryCounter.incrementAndGet();
        queries.add(nrql);
        log.trace("Mock query #{}: {}", queryNumber, nrql);

        simulateLatency();
        if (shouldFail) {
            throw ErrorClassifier.forStatus(failureStatus, "mock failure");
        }

        String statement = nrql.trim();
        if (statement.toUpperCase(Locale.ROOT).startsWith("SHOW EVENT TYPES")) {
            return showEventTypes();
        }

        Matcher from = FROM.matcher(statement);
        if (!from.find()) {
            throw new PermanentQueryException("NRQL syntax error: missing FROM clause in '" + nrql + "'", 400, null);
        }
        String eventTypeName = from.group(1) != null ? from.group(1) : from.group(2);
        MockEventType eventType = eventTypes.get(eventTypeName);
        if (eventType == null) {
            return QueryResult.of(List.of());
        }

        if (COUNT.matcher(statement).find() && TIMESERIES.matcher(statement).find()) {
            return hourlyCounts(eventType, statement);
        }
        if (COUNT.matcher(statement).find()) {
            Map<String, Object> row = new HashMap<>();
            row.put("count", eventType.getRecordCount());
            return QueryResult.of(List.of(row));
        }
        return select(eventType, statement, new Random(seed * 31 + queryNumber));
    }

    private QueryResult showEventTypes() {
        List<Map<String, Object>> rows = new ArrayList<>();
        eventTypes.values().stream()
                .sorted(Comparator.comparing(MockEventType::getName))
                .forEach(type -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("eventType", type.getName());
                    row.put("count", type.getRecordCount());
                    rows.add(row);
                });
        return QueryResult.of(rows);
    }

    /**
     * Spreads the event type's volume evenly over one-hour buckets of the queried range.
     */
    private QueryResult hourlyCounts(MockEventType eventType, String statement) {
        long[] range = range(statement);
        long hour = Duration.ofHours(1).toMillis();
        long buckets = Math.max(1, (range[1] - range[0] + hour - 1) / hour);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (long i = 0; i < buckets; i++) {
            long begin = range[0] + i * hour;
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("beginTimeSeconds", begin / 1000);
            row.put("endTimeSeconds", Math.min(range[1], begin + hour) / 1000);
            row.put("count", eventType.getRecordCount() / buckets);
            rows.add(row);
        }
        return QueryResult.of(rows);
    }

    private long[] range(String statement) {
        long endMillis = clock.millis();
        long startMillis = endMillis - Duration.ofHours(1).toMillis();
        Matcher rangeMatcher = RANGE.matcher(statement);
        if (rangeMatcher.find()) {
            startMillis = Long.parseLong(rangeMatcher.group(1));
            endMillis = Long.parseLong(rangeMatcher.group(2));
        }
        return new long[]{startMillis, endMillis};
    }

    private QueryResult select(MockEventType eventType, String statement, Random random) {
        int limit = DEFAULT_LIMIT;
        Matcher limitMatcher = LIMIT.matcher(statement);
        if (limitMatcher.find()) {
            String value = limitMatcher.group(1);
            limit = "MAX".equalsIgnoreCase(value) ? MAX_LIMIT : Math.min(MAX_LIMIT, Integer.parseInt(value));
        }

        long[] range = range(statement);
        long startMillis = range[0];
        long endMillis = range[1];

        int rows = (int) Math.min(limit, eventType.getRecordCount());
        double coveredFraction = Math.min(1.0, (double) rows / Math.max(1, eventType.getRecordCount()));
        List<Map<String, Object>> records = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            Map<String, Object> record = new HashMap<>();
            record.put("timestamp", timestamp(coveredFraction, startMillis, endMillis, random));
            for (Map.Entry<String, AttributeGenerator> attribute : eventType.getAttributes().entrySet()) {
                Object value = attribute.getValue().generate(i, random);
                if (value != null) {
                    record.put(attribute.getKey(), value);
                }
            }
            records.add(record);
        }
        // Newest first, as NRDB returns them
        records.sort(Comparator.comparing((Map<String, Object> r) -> (Long) r.get("timestamp")).reversed());

        return new QueryResult(Collections.unmodifiableList(records),
                new QueryMetadata(List.of(eventType.getName()), List.of(), List.of()),
                new PerformanceInfo(eventType.getRecordCount(), 1));
    }

    /**
     * Like NRDB, a limited select returns the newest records, so the covered span shrinks as the
     * event type's volume grows relative to the limit.
     */
    private long timestamp(double coveredFraction, long startMillis, long endMillis, Random random) {
        long span = Math.max(1, endMillis - startMillis);
        long covered = Math.max(1, (long) (span * coveredFraction));
        return endMillis - (long) (random.nextDouble() * covered);
    }

    private void simulateLatency() throws QueryCancelledException {
        if (latency.isZero()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Interrupted during simulated latency", e);
        }
    }

    public void setShouldFail(boolean shouldFail) {
        this.shouldFail = shouldFail;
    }

    public void setFailureStatus(int failureStatus) {
        this.failureStatus = failureStatus;
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    public long getQueryCount() {
        return queryCounter.get();
    }

    public List<String> getQueries() {
        return List.copyOf(queries);
    }
}
