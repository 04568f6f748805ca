package org.carball.discovery.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.model.discovery.ProfileDepth;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final String ARG_PREFIX = "--discovery.";
    private static final String ENV_PREFIX = "DISCOVERY_";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public DiscoveryConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        DiscoveryConfig.DiscoveryConfigBuilder builder = DiscoveryConfig.defaults().toBuilder();

        applyEnvironmentVariables(builder);
        applyArguments(builder, args);

        DiscoveryConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public DiscoveryConfig loadProfile(String profileName) {
        try {
            DiscoveryProfile profile = DiscoveryProfile.fromName(profileName);
            DiscoveryConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with other configuration sources.
     */
    public DiscoveryConfig loadConfigurationWithProfile(String profileName, String[] args) {
        DiscoveryConfig.DiscoveryConfigBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyArguments(builder, args);

        DiscoveryConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads a YAML or JSON file (optionally naming a {@code profile}), then overlays env vars and args.
     */
    public DiscoveryConfig loadFromFile(Path configFile, String[] args) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }

        ObjectMapper mapper = createMapper(configFile);
        JsonNode root = mapper.readTree(Files.readString(configFile));
        if (root == null || !root.isObject()) {
            throw new IOException("Configuration file must contain an object: " + configFile);
        }

        DiscoveryConfig.DiscoveryConfigBuilder builder = root.hasNonNull("profile")
                ? loadProfile(root.get("profile").asText()).toBuilder()
                : DiscoveryConfig.defaults().toBuilder();

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = normalizeKey(field.getKey());
            JsonNode value = field.getValue();

            if ("profile".equals(key)) {
                continue;
            }
            if ("quality".equals(key)) {
                builder.qualityThresholds(mapper.treeToValue(value, QualityThresholds.class));
            } else if (value.isArray()) {
                List<String> items = new ArrayList<>();
                value.forEach(item -> items.add(item.asText()));
                applyProperty(builder, key, String.join(",", items));
            } else {
                applyProperty(builder, key, value.asText());
            }
        }

        applyEnvironmentVariables(builder);
        applyArguments(builder, args);

        DiscoveryConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded from {}: {}", configFile, config.getConfigurationSummary());
        return config;
    }

    private ObjectMapper createMapper(Path configFile) {
        String fileName = configFile.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private void applyEnvironmentVariables(DiscoveryConfig.DiscoveryConfigBuilder builder) {
        if (environment.containsKey("NEWRELIC_API_KEY")) {
            builder.apiKey(environment.get("NEWRELIC_API_KEY"));
        }
        if (environment.containsKey("NEWRELIC_ACCOUNT_ID")) {
            builder.accountId(environment.get("NEWRELIC_ACCOUNT_ID"));
        }
        if (environment.containsKey("NEWRELIC_BASE_URL")) {
            builder.baseUrl(environment.get("NEWRELIC_BASE_URL"));
        }

        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                String key = normalizeKey(entry.getKey().substring(ENV_PREFIX.length()));
                applyProperty(builder, key, entry.getValue());
            }
        }
    }

    private void applyArguments(DiscoveryConfig.DiscoveryConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(ARG_PREFIX)) {
                applyProperty(builder, normalizeKey(args[i].substring(ARG_PREFIX.length())), args[i + 1]);
                i++;
            }
        }
    }

    /**
     * Applies one kebab-case setting. Returns false when the key is unknown or the value is invalid.
     */
    boolean applyProperty(DiscoveryConfig.DiscoveryConfigBuilder builder, String key, String value) {
        try {
            switch (key) {
                case "api-key" -> builder.apiKey(value);
                case "account-id" -> builder.accountId(value);
                case "base-url" -> builder.baseUrl(value);
                case "query-timeout" -> builder.queryTimeout(parseDuration(value));
                case "rate-limit" -> builder.rateLimitPerMinute(Integer.parseInt(value));
                case "rate-limit-burst" -> builder.rateLimitBurst(Integer.parseInt(value));
                case "max-attempts" -> builder.maxAttempts(Integer.parseInt(value));
                case "initial-retry-interval" -> builder.initialRetryInterval(parseDuration(value));
                case "max-retry-interval" -> builder.maxRetryInterval(parseDuration(value));
                case "retry-multiplier" -> builder.retryMultiplier(Double.parseDouble(value));
                case "retry-jitter" -> builder.retryJitter(Double.parseDouble(value));
                case "failure-threshold" -> builder.failureThreshold(Integer.parseInt(value));
                case "success-threshold" -> builder.successThreshold(Integer.parseInt(value));
                case "open-duration" -> builder.openDuration(parseDuration(value));
                case "half-open-requests" -> builder.halfOpenRequests(Integer.parseInt(value));
                case "max-concurrency" -> builder.maxConcurrency(Integer.parseInt(value));
                case "worker-pool-size" -> builder.workerPoolSize(Integer.parseInt(value));
                case "default-sample-size" -> builder.defaultSampleSize(Integer.parseInt(value));
                case "max-sample-size" -> builder.maxSampleSize(Integer.parseInt(value));
                case "discovery-timeout" -> builder.discoveryTimeout(parseDuration(value));
                case "cache-enabled" -> builder.cacheEnabled(Boolean.parseBoolean(value));
                case "cache-ttl" -> builder.cacheTtl(parseDuration(value));
                case "min-schema-records" -> builder.minSchemaRecords(Long.parseLong(value));
                case "profile-depth" -> builder.profileDepth(ProfileDepth.fromName(value));
                case "sample-window" -> builder.sampleWindow(parseDuration(value));
                case "quality-window" -> builder.qualityWindow(parseDuration(value));
                case "sampling-strategies" -> builder.samplingStrategies(
                        Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList());
                default -> {
                    log.debug("Ignoring unknown configuration key: {}", key);
                    return false;
                }
            }
            return true;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            // NumberFormatException is an IllegalArgumentException
            log.warn("Invalid value for {}: {}", key, value);
            return false;
        }
    }

    private static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parses {@code 250ms}, {@code 30s}, {@code 5m}, {@code 1h}, {@code 2d} or an ISO-8601 duration.
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        String text = value.trim().toLowerCase(Locale.ROOT);
        if (text.startsWith("p")) {
            return Duration.parse(text.toUpperCase(Locale.ROOT));
        }
        if (text.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
        }
        long amount = Long.parseLong(text.substring(0, text.length() - 1));
        return switch (text.charAt(text.length() - 1)) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unsupported duration: " + value);
        };
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Discovery Configuration Options:

            Arguments (--discovery.<key> <value>), env vars (DISCOVERY_<KEY>) and file keys:
              max-concurrency <num>        Schemas profiled in parallel
              default-sample-size <num>    Records sampled per schema
              max-sample-size <num>        Upper bound for any sample
              rate-limit <num>             Queries per minute against NRDB
              max-attempts <num>           Attempts per query, including the first
              failure-threshold <num>      Failures before the circuit opens
              open-duration <duration>     Time the circuit stays open
              cache-ttl <duration>         Lifetime of cached discovery results
              profile-depth <depth>        basic, standard or full

            Credentials:
              NEWRELIC_API_KEY, NEWRELIC_ACCOUNT_ID, NEWRELIC_BASE_URL

            Priority Order (highest to lowest):
              1. Arguments
              2. Environment variables
              3. Configuration file
              4. Profile defaults or built-in defaults
            """;
    }
}
