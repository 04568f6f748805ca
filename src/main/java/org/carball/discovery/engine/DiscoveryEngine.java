package org.carball.discovery.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.analyzer.AttributeAnalyzer;
import org.carball.discovery.client.ClientStats;
import org.carball.discovery.client.EventTypeFilter;
import org.carball.discovery.client.QueryClient;
import org.carball.discovery.client.QueryClients;
import org.carball.discovery.client.QueryException;
import org.carball.discovery.client.ResilientQueryClient;
import org.carball.discovery.config.DiscoveryConfig;
import org.carball.discovery.model.discovery.CacheStats;
import org.carball.discovery.model.discovery.ComponentHealth;
import org.carball.discovery.model.discovery.CrossSchemaPattern;
import org.carball.discovery.model.discovery.DiscoveryBatch;
import org.carball.discovery.model.discovery.DiscoveryFilter;
import org.carball.discovery.model.discovery.DiscoveryHints;
import org.carball.discovery.model.discovery.DiscoveryResult;
import org.carball.discovery.model.discovery.HealthStatus;
import org.carball.discovery.model.discovery.Insight;
import org.carball.discovery.model.discovery.ProfileDepth;
import org.carball.discovery.model.discovery.SchemaFailure;
import org.carball.discovery.model.pattern.DetectedPattern;
import org.carball.discovery.model.quality.QualityReport;
import org.carball.discovery.model.relationship.Relationship;
import org.carball.discovery.model.sample.DataSample;
import org.carball.discovery.model.sample.TimeRange;
import org.carball.discovery.model.schema.Attribute;
import org.carball.discovery.model.schema.DataVolumeProfile;
import org.carball.discovery.model.schema.Schema;
import org.carball.discovery.model.schema.Statistics;
import org.carball.discovery.pattern.PatternEngine;
import org.carball.discovery.quality.QualityAssessor;
import org.carball.discovery.relationship.RelationshipMiner;
import org.carball.discovery.sampling.DataProfile;
import org.carball.discovery.sampling.RandomSamplingStrategy;
import org.carball.discovery.sampling.SamplingParams;
import org.carball.discovery.sampling.SamplingStrategies;
import org.carball.discovery.sampling.SamplingStrategy;
import org.carball.discovery.sampling.SamplingStrategySelector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the discovery core. Resolves event types, profiles them in parallel under a
 * bounded worker pool, and layers patterns, quality, relationships and insights on top.
 * Thread-safe; close it to stop the worker threads.
 */
@Slf4j
public class DiscoveryEngine implements AutoCloseable {

    public static final String VERSION = "1.0.0";

    private final DiscoveryConfig config;
    private final QueryClient client;
    private final Clock clock;

    private final AttributeAnalyzer attributeAnalyzer = new AttributeAnalyzer();
    private final PatternEngine patternEngine = new PatternEngine();
    private final QualityAssessor qualityAssessor;
    private final RelationshipMiner relationshipMiner;
    private final SamplingStrategySelector strategySelector;
    private final Map<String, SamplingStrategy> strategies;
    private final SchemaIntelligence intelligence;
    private final WorkerPool workerPool;

    private final TtlCache<String, DiscoveryBatch> schemaCache;
    private final TtlCache<String, Schema> profileCache;
    // Shape flags of analyzed event types, keyed by event type
    private final TtlCache<String, DataProfile> knownShapes;

    private final Instant startedAt;
    private final AtomicLong discoveries = new AtomicLong();
    private final AtomicLong schemasDiscovered = new AtomicLong();
    private final AtomicLong schemaFailures = new AtomicLong();
    private volatile boolean closed;

    public DiscoveryEngine(DiscoveryConfig config, QueryClient client) {
        this(config, client, Clock.systemUTC(), new Random());
    }

    public DiscoveryEngine(DiscoveryConfig config, QueryClient client, Clock clock, Random random) {
        config.validate();
        this.config = config;
        this.client = client;
        this.clock = clock;

        this.strategies = SamplingStrategies.createAll(client, random);
        this.strategySelector = new SamplingStrategySelector(config.getSamplingStrategies(), config.getDefaultSampleSize());
        this.qualityAssessor = new QualityAssessor(config.getQualityThresholds(), clock);
        this.relationshipMiner = new RelationshipMiner(strategies.get(RandomSamplingStrategy.NAME), client, config.getQualityWindow(),
                config.getDefaultSampleSize(), clock);
        this.intelligence = new SchemaIntelligence(config.getWorkerPoolSize());
        this.workerPool = new WorkerPool(config.getWorkerPoolSize(), config.getMaxConcurrency());
        this.schemaCache = new TtlCache<>(config.getCacheTtl(), clock);
        this.profileCache = new TtlCache<>(config.getCacheTtl(), clock);
        this.knownShapes = new TtlCache<>(config.getCacheTtl(), clock);
        this.startedAt = clock.instant();

        log.info("Discovery engine started: {}", config.getConfigurationSummary());
    }

    /**
     * Engine backed by the NRDB HTTP client behind rate limiting, retries and a circuit breaker.
     */
    public static DiscoveryEngine create(DiscoveryConfig config) {
        config.validateCredentials();
        return new DiscoveryEngine(config, QueryClients.create(config));
    }

    // Schema discovery

    /**
     * Profiles every event type the filter admits. Schemas that fail are reported in the batch
     * rather than failing the call; complete batches are cached per filter.
     */
    public DiscoveryBatch discoverSchemas(DiscoveryFilter filter) throws DiscoveryException {
        ensureOpen();
        String cacheKey = filter.cacheKey();
        if (config.isCacheEnabled()) {
            Optional<DiscoveryBatch> cached = schemaCache.get(cacheKey);
            if (cached.isPresent()) {
                log.debug("Schema cache hit for {}", cacheKey);
                return cached.get().copy();
            }
        }

        Instant start = clock.instant();
        List<String> eventTypes = resolveEventTypes(filter);
        log.info("Discovering {} event types", eventTypes.size());

        long minRecords = Math.max(filter.getMinRecordCount(), config.getMinSchemaRecords());
        ProfileDepth depth = config.getProfileDepth();
        List<WorkerPool.Task<Schema>> tasks = new ArrayList<>(eventTypes.size());
        for (String eventType : eventTypes) {
            tasks.add(() -> profile(eventType, depth, minRecords));
        }
        List<WorkerPool.Result<Schema>> results = workerPool.runAll(tasks, config.getDiscoveryTimeout());

        List<Schema> schemas = new ArrayList<>();
        List<SchemaFailure> failures = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            WorkerPool.Result<Schema> result = results.get(i);
            if (!result.isSuccess()) {
                log.warn("Discovery of {} failed: {}", eventTypes.get(i), result.error().getMessage());
                failures.add(SchemaFailure.of(eventTypes.get(i), result.error()));
            } else if (result.value() != null) {
                schemas.add(result.value());
            } else {
                log.debug("Skipped {}: fewer than {} records", eventTypes.get(i), minRecords);
            }
        }

        DiscoveryBatch batch = new DiscoveryBatch(schemas, failures);
        discoveries.incrementAndGet();
        schemasDiscovered.addAndGet(schemas.size());
        schemaFailures.addAndGet(failures.size());
        if (config.isCacheEnabled() && !batch.isPartial()) {
            schemaCache.put(cacheKey, batch.copy());
        }

        log.info("Discovered {} schemas ({} failed) in {} ms", schemas.size(), failures.size(),
                Duration.between(start, clock.instant()).toMillis());
        return batch;
    }

    private List<String> resolveEventTypes(DiscoveryFilter filter) throws DiscoveryException {
        List<String> available;
        try {
            available = client.getEventTypes(new EventTypeFilter(null, 0, filter.getLookback()));
        } catch (QueryException e) {
            throw new DiscoveryException("Failed to list event types: " + e.getMessage(), e);
        }

        List<String> selected = available.stream()
                .filter(filter::matches)
                .distinct()
                .sorted()
                .toList();
        if (filter.getMaxSchemas() > 0 && selected.size() > filter.getMaxSchemas()) {
            selected = selected.subList(0, filter.getMaxSchemas());
        }
        return selected;
    }

    /**
     * Discovers schemas guided by hints, ranks them by relevance and mines relationships and
     * insights across the retained set.
     */
    public DiscoveryResult discoverWithIntelligence(DiscoveryHints hints) throws DiscoveryException {
        Instant start = clock.instant();
        DiscoveryBatch batch = discoverSchemas(intelligence.filterFor(hints));
        List<Schema> ranked = intelligence.rank(batch.schemas(), hints);
        List<CrossSchemaPattern> patterns = intelligence.crossSchemaPatterns(ranked);

        Map<String, Object> metadata = new LinkedHashMap<>();
        List<Relationship> relationships = List.of();
        if (ranked.size() > 1) {
            try {
                relationships = findRelationships(ranked);
            } catch (DiscoveryException e) {
                log.warn("Relationship mining failed, continuing without relationships: {}", e.getMessage());
                metadata.put("relationship_error", e.getMessage());
            }
        }

        List<Insight> insights = intelligence.insights(ranked, patterns, relationships);
        metadata.put("schemas_found", ranked.size());
        metadata.put("patterns_found", patterns.size());
        metadata.put("relationships_found", relationships.size());
        metadata.put("partial", batch.isPartial());
        metadata.put("discovery_time_ms", Duration.between(start, clock.instant()).toMillis());

        return DiscoveryResult.builder()
                .schemas(ranked)
                .relationships(relationships)
                .patterns(patterns)
                .insights(insights)
                .recommendations(intelligence.recommendations(insights))
                .executionPlan(intelligence.plan(hints, ranked, relationships.size()))
                .failures(batch.failures())
                .metadata(metadata)
                .build();
    }

    // Single schema operations

    public Schema profileSchema(String eventType, ProfileDepth depth) throws DiscoveryException {
        ensureOpen();
        String cacheKey = "profile:" + eventType + ":" + depth.name().toLowerCase(Locale.ROOT);
        if (config.isCacheEnabled()) {
            Optional<Schema> cached = profileCache.get(cacheKey);
            if (cached.isPresent()) {
                return cached.get().copy();
            }
        }

        Schema schema;
        try {
            schema = profile(eventType, depth, 0);
        } catch (QueryException e) {
            throw new DiscoveryException("Failed to profile " + eventType + ": " + e.getMessage(), e);
        }
        if (config.isCacheEnabled()) {
            profileCache.put(cacheKey, schema.copy());
        }
        return schema;
    }

    public DataSample sampleData(SamplingParams params) throws DiscoveryException {
        ensureOpen();
        if (params.getEventType() == null || params.getEventType().isBlank()) {
            throw new DiscoveryException("Sampling requires an event type");
        }
        TimeRange range = params.getTimeRange() != null
                ? params.getTimeRange()
                : TimeRange.last(config.getSampleWindow(), clock);
        int requested = params.getMaxSamples() > 0 ? params.getMaxSamples() : config.getDefaultSampleSize();
        SamplingParams resolved = params.toBuilder()
                .timeRange(range)
                .maxSamples(Math.min(requested, config.getMaxSampleSize()))
                .build();

        try {
            SamplingStrategy strategy = params.getStrategy() != null
                    ? strategyNamed(params.getStrategy())
                    : selectStrategy(params.getEventType(), range);
            DataSample sample = strategy.sample(resolved);
            log.debug("Sampled {} records of {} with {}", sample.sampleSize(), params.getEventType(), strategy.getName());
            return sample;
        } catch (QueryException e) {
            throw new DiscoveryException("Failed to sample " + params.getEventType() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Strategy the engine would use for this event type over the default sample window.
     */
    public SamplingStrategy selectStrategy(String eventType) throws DiscoveryException {
        ensureOpen();
        try {
            return selectStrategy(eventType, TimeRange.last(config.getSampleWindow(), clock));
        } catch (QueryException e) {
            throw new DiscoveryException("Failed to profile volume of " + eventType + ": " + e.getMessage(), e);
        }
    }

    public QualityReport assessQuality(String eventType) throws DiscoveryException {
        ensureOpen();
        TimeRange range = TimeRange.last(config.getQualityWindow(), clock);
        try {
            long total = client.countRecords(eventType, range);
            SamplingStrategy strategy = strategyFor(dataProfile(eventType, total, range.duration()));
            DataSample sample = strategy.sample(SamplingParams.builder()
                    .eventType(eventType)
                    .timeRange(range)
                    .maxSamples(config.getDefaultSampleSize())
                    .build());

            List<Attribute> attributes = attributeAnalyzer.analyze(sample);
            rememberShape(eventType, total, range.duration(), attributes);
            Schema schema = Schema.builder()
                    .id(Schema.idFor(eventType))
                    .name(eventType)
                    .eventType(eventType)
                    .attributes(attributes)
                    .sampleCount(sample.sampleSize())
                    .build();
            QualityReport report = qualityAssessor.assess(schema, sample);
            log.info("Quality of {}: {} with {} issues", eventType,
                    String.format("%.2f", report.overallScore()), report.issues().size());
            return report;
        } catch (QueryException e) {
            throw new DiscoveryException("Failed to assess quality of " + eventType + ": " + e.getMessage(), e);
        }
    }

    public List<Relationship> findRelationships(List<Schema> schemas) throws DiscoveryException {
        ensureOpen();
        try {
            return relationshipMiner.findRelationships(schemas);
        } catch (QueryException e) {
            throw new DiscoveryException("Failed to mine relationships: " + e.getMessage(), e);
        }
    }

    // Health

    public HealthStatus health() {
        Instant now = clock.instant();
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        Map<String, Object> metrics = new LinkedHashMap<>();

        if (client instanceof ResilientQueryClient resilient) {
            ClientStats stats = resilient.getStats();
            String status = switch (stats.circuitState()) {
                case CLOSED -> "healthy";
                case HALF_OPEN -> "degraded";
                case OPEN -> "unhealthy";
            };
            components.put("nrdb", new ComponentHealth(status, now,
                    String.format("circuit %s, %d queries, %d errors",
                            stats.circuitState().name().toLowerCase(Locale.ROOT), stats.queryCount(), stats.errorCount())));
            metrics.put("queries", stats.queryCount());
            metrics.put("errors", stats.errorCount());
            metrics.put("retries", stats.retries());
        } else {
            components.put("nrdb", new ComponentHealth("healthy", now, "client without resilience statistics"));
        }

        CacheStats cacheStats = combinedCacheStats();
        components.put("cache", new ComponentHealth(config.isCacheEnabled() ? "healthy" : "disabled", now,
                String.format("%d entries, hit rate %.2f", cacheStats.size(), cacheStats.hitRate())));
        components.put("worker_pool", new ComponentHealth(workerPool.isShutdown() ? "stopped" : "healthy", now,
                String.format("%d tasks active", workerPool.getActiveTasks())));

        Duration uptime = Duration.between(startedAt, now);
        metrics.put("cache_hit_rate", cacheStats.hitRate());
        metrics.put("cache_stats", cacheStats);
        metrics.put("discoveries", discoveries.get());
        metrics.put("schemas_discovered", schemasDiscovered.get());
        metrics.put("schema_failures", schemaFailures.get());
        metrics.put("uptime_seconds", uptime.getSeconds());

        return new HealthStatus(overallStatus(components), VERSION, uptime, components, metrics);
    }

    private String overallStatus(Map<String, ComponentHealth> components) {
        if (closed) {
            return "stopped";
        }
        if (components.values().stream().anyMatch(c -> "unhealthy".equals(c.status()))) {
            return "unhealthy";
        }
        if (components.values().stream().anyMatch(c -> "degraded".equals(c.status()))) {
            return "degraded";
        }
        return "healthy";
    }

    private CacheStats combinedCacheStats() {
        CacheStats schemas = schemaCache.stats();
        CacheStats profiles = profileCache.stats();
        return new CacheStats(schemas.hits() + profiles.hits(), schemas.misses() + profiles.misses(),
                schemas.evictions() + profiles.evictions(), schemas.size() + profiles.size());
    }

    public void invalidateCache() {
        schemaCache.clear();
        profileCache.clear();
        knownShapes.clear();
        log.debug("Discovery caches cleared");
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            workerPool.close();
            log.info("Discovery engine stopped after {} discoveries", discoveries.get());
        }
    }

    // Profiling

    /**
     * Profiles one event type. Returns null when it holds fewer than {@code minRecords} records.
     */
    Schema profile(String eventType, ProfileDepth depth, long minRecords) throws QueryException, DiscoveryException {
        TimeRange range = TimeRange.last(config.getSampleWindow(), clock);
        long total = client.countRecords(eventType, range);
        if (total == 0) {
            throw new DiscoveryException("No data for " + eventType + " in the last " + config.getSampleWindow());
        }
        if (total < minRecords) {
            return null;
        }

        SamplingStrategy strategy = strategyFor(dataProfile(eventType, total, range.duration()));
        DataSample sample = strategy.sample(SamplingParams.builder()
                .eventType(eventType)
                .timeRange(range)
                .maxSamples(config.getDefaultSampleSize())
                .build());
        if (sample.isEmpty()) {
            throw new DiscoveryException("Sampling returned no records for " + eventType);
        }

        Instant now = clock.instant();
        List<Attribute> attributes = attributeAnalyzer.analyze(sample);
        rememberShape(eventType, total, range.duration(), attributes);
        Schema schema = Schema.builder()
                .id(Schema.idFor(eventType))
                .name(eventType)
                .eventType(eventType)
                .attributes(attributes)
                .sampleCount(sample.sampleSize())
                .dataVolume(volume(total, range.duration(), sample))
                .discoveredAt(now)
                .lastAnalyzedAt(now)
                .build();

        if (depth != ProfileDepth.BASIC) {
            List<DetectedPattern> patterns = patternEngine.detectSchemaPatterns(schema, sample);
            schema.setPatterns(patterns);
            for (Attribute attribute : attributes) {
                attribute.setQuality(qualityAssessor.assessAttribute(attribute, sample.values(attribute.getName())));
            }
            schema.setQuality(qualityAssessor.toMetrics(qualityAssessor.assess(schema, sample)));
        } else {
            attributes.forEach(a -> a.setStatistics(Statistics.empty()));
        }
        if (depth != ProfileDepth.FULL) {
            attributes.forEach(a -> a.setSampleValues(new ArrayList<>()));
        }

        schema.getMetadata().put("sampling_strategy", strategy.getName());
        schema.getMetadata().put("profile_depth", depth.name().toLowerCase(Locale.ROOT));
        schema.getMetadata().put("sampling_rate", sample.samplingRate());
        log.debug("Profiled {}: {} attributes, {} patterns", eventType, attributes.size(), schema.getPatterns().size());
        return schema;
    }

    private DataVolumeProfile volume(long total, Duration window, DataSample sample) {
        double hours = Math.max(1.0 / 60, window.toMinutes() / 60.0);
        double perHour = total / hours;
        double avgRecordBytes = sample.records().stream()
                .mapToInt(r -> r.toString().length())
                .average()
                .orElse(0.0);
        int retentionDays = client.getAccountInfo().dataRetentionDays();
        double estimatedGb = perHour * 24 * retentionDays * avgRecordBytes / 1e9;
        return new DataVolumeProfile(total, perHour, perHour * 24, 0.0, retentionDays, estimatedGb);
    }

    private SamplingStrategy selectStrategy(String eventType, TimeRange range) throws QueryException {
        long total = client.countRecords(eventType, range);
        return strategyFor(dataProfile(eventType, total, range.duration()));
    }

    /**
     * Current volume combined with the shape seen when the event type was last analyzed.
     */
    DataProfile dataProfile(String eventType, long total, Duration window) {
        return knownShapes.get(eventType)
                .map(shape -> new DataProfile(total, window, shape.hasTimeSeries(), shape.hasHighCardinality()))
                .orElseGet(() -> DataProfile.volumeOnly(total, window));
    }

    private void rememberShape(String eventType, long total, Duration window, List<Attribute> attributes) {
        DataProfile shape = DataProfile.fromAttributes(total, window, attributes);
        knownShapes.put(eventType, shape);
        log.debug("Shape of {}: time series {}, high cardinality {}", eventType,
                shape.hasTimeSeries(), shape.hasHighCardinality());
    }

    private SamplingStrategy strategyFor(DataProfile profile) {
        return strategies.get(strategySelector.select(profile));
    }

    private SamplingStrategy strategyNamed(String name) throws DiscoveryException {
        SamplingStrategy strategy = strategies.get(name.toLowerCase(Locale.ROOT));
        if (strategy == null) {
            throw new DiscoveryException("Unknown sampling strategy: " + name
                    + ". Available strategies: " + String.join(", ", SamplingStrategies.names()));
        }
        return strategy;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Discovery engine is closed");
        }
    }

    public DiscoveryConfig getConfig() {
        return config;
    }

    public CacheStats getCacheStats() {
        return combinedCacheStats();
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }
}
