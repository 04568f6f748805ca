package org.carball.discovery.config;

import org.carball.discovery.model.discovery.ProfileDepth;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    private ConfigurationLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    public void shouldLoadDefaultConfiguration() {
        // When
        DiscoveryConfig config = loader.loadConfiguration(new String[]{});

        // Then
        assertThat(config.getMaxConcurrency()).isEqualTo(10);
        assertThat(config.getDefaultSampleSize()).isEqualTo(1000);
        assertThat(config.getMaxSampleSize()).isEqualTo(10000);
        assertThat(config.getRateLimitPerMinute()).isEqualTo(60);
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.getProfileDepth()).isEqualTo(ProfileDepth.STANDARD);
        assertThat(config.getProfileName()).isEqualTo("default");
    }

    @Test
    public void shouldOverrideDefaultsFromArguments() {
        // Given
        String[] args = {
                "--discovery.max-concurrency", "4",
                "--discovery.default-sample-size", "500",
                "--discovery.cache-ttl", "10m",
                "--discovery.profile-depth", "full"
        };

        // When
        DiscoveryConfig config = loader.loadConfiguration(args);

        // Then
        assertThat(config.getMaxConcurrency()).isEqualTo(4);
        assertThat(config.getDefaultSampleSize()).isEqualTo(500);
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.getProfileDepth()).isEqualTo(ProfileDepth.FULL);
    }

    @Test
    public void shouldReadCredentialsAndSettingsFromEnvironment() {
        // Given
        loader = new ConfigurationLoader(Map.of(
                "NEWRELIC_API_KEY", "NRAK-test",
                "NEWRELIC_ACCOUNT_ID", "12345",
                "DISCOVERY_RATE_LIMIT", "30",
                "DISCOVERY_SAMPLING_STRATEGIES", "random, reservoir"));

        // When
        DiscoveryConfig config = loader.loadConfiguration(new String[]{});

        // Then
        assertThat(config.getApiKey()).isEqualTo("NRAK-test");
        assertThat(config.getAccountId()).isEqualTo("12345");
        assertThat(config.getRateLimitPerMinute()).isEqualTo(30);
        assertThat(config.getSamplingStrategies()).containsExactly("random", "reservoir");
    }

    @Test
    public void shouldPreferArgumentsOverEnvironment() {
        // Given
        loader = new ConfigurationLoader(Map.of("DISCOVERY_MAX_CONCURRENCY", "3"));

        // When
        DiscoveryConfig config = loader.loadConfiguration(new String[]{"--discovery.max-concurrency", "7"});

        // Then
        assertThat(config.getMaxConcurrency()).isEqualTo(7);
    }

    @Test
    public void shouldIgnoreInvalidValues() {
        // Given
        DiscoveryConfig.DiscoveryConfigBuilder builder = DiscoveryConfig.defaults().toBuilder();

        // When
        boolean applied = loader.applyProperty(builder, "max-concurrency", "lots");
        boolean unknown = loader.applyProperty(builder, "no-such-key", "1");

        // Then
        assertThat(applied).isFalse();
        assertThat(unknown).isFalse();
        assertThat(builder.build().getMaxConcurrency()).isEqualTo(10);
    }

    @Test
    public void shouldLoadProfile() {
        // When
        DiscoveryConfig config = loader.loadProfile("quick");

        // Then
        assertThat(config.getProfileName()).isEqualTo("quick");
        assertThat(config.getDefaultSampleSize()).isEqualTo(250);
        assertThat(config.getProfileDepth()).isEqualTo(ProfileDepth.BASIC);
    }

    @Test
    public void shouldOverlayArgumentsOnProfile() {
        // When
        DiscoveryConfig config = loader.loadConfigurationWithProfile("thorough",
                new String[]{"--discovery.max-concurrency", "2"});

        // Then
        assertThat(config.getProfileName()).isEqualTo("thorough");
        assertThat(config.getDefaultSampleSize()).isEqualTo(5000);
        assertThat(config.getMaxConcurrency()).isEqualTo(2);
    }

    @Test
    public void shouldRejectUnknownProfile() {
        // When/Then
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown discovery profile: nonexistent");
    }

    @Test
    public void shouldLoadYamlFileWithProfileAndQualitySection() throws IOException {
        // Given
        Path file = tempDir.resolve("discovery.yaml");
        Files.writeString(file, """
                profile: low-quota
                max_concurrency: 2
                sampling-strategies:
                  - reservoir
                  - random
                quality:
                  expectedCompleteness: 0.8
                  maxFreshnessDelaySeconds: 600
                """);

        // When
        DiscoveryConfig config = loader.loadFromFile(file, new String[]{});

        // Then
        assertThat(config.getProfileName()).isEqualTo("low-quota");
        assertThat(config.getDefaultSampleSize()).isEqualTo(500);
        assertThat(config.getMaxConcurrency()).isEqualTo(2);
        assertThat(config.getSamplingStrategies()).containsExactly("reservoir", "random");
        assertThat(config.getQualityThresholds().getExpectedCompleteness()).isEqualTo(0.8);
        assertThat(config.getQualityThresholds().getMaxFreshnessDelay()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    public void shouldLoadJsonFile() throws IOException {
        // Given
        Path file = tempDir.resolve("discovery.json");
        Files.writeString(file, "{\"rate-limit\": 20, \"cache-enabled\": false}");

        // When
        DiscoveryConfig config = loader.loadFromFile(file, new String[]{"--discovery.rate-limit", "25"});

        // Then
        assertThat(config.getRateLimitPerMinute()).isEqualTo(25);
        assertThat(config.isCacheEnabled()).isFalse();
    }

    @Test
    public void shouldFailForMissingFile() {
        // When/Then
        assertThatThrownBy(() -> loader.loadFromFile(tempDir.resolve("missing.yaml"), new String[]{}))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    public void shouldRejectInvalidConfiguration() {
        // When/Then
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--discovery.max-concurrency", "0"}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxConcurrency");
    }

    @Test
    public void shouldRejectSuccessThresholdAboveHalfOpenRequests() {
        // Given
        String[] args = {"--discovery.success-threshold", "3", "--discovery.half-open-requests", "2"};

        // When/Then
        assertThatThrownBy(() -> loader.loadConfiguration(args))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("successThreshold (3) must not exceed halfOpenRequests (2)");
    }

    @Test
    public void shouldKeepDefaultForEmptyDurationInEnvironment() {
        // Given
        loader = new ConfigurationLoader(Map.of("DISCOVERY_CACHE_TTL", ""));

        // When
        DiscoveryConfig config = loader.loadConfiguration(new String[]{});

        // Then
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    public void shouldRejectBlankDurations() {
        assertThatThrownBy(() -> ConfigurationLoader.parseDuration(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("blank");
        assertThatThrownBy(() -> ConfigurationLoader.parseDuration("   "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConfigurationLoader.parseDuration("s"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldParseDurations() {
        assertThat(ConfigurationLoader.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(ConfigurationLoader.parseDuration("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(ConfigurationLoader.parseDuration("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(ConfigurationLoader.parseDuration("1h")).isEqualTo(Duration.ofHours(1));
        assertThat(ConfigurationLoader.parseDuration("2d")).isEqualTo(Duration.ofDays(2));
        assertThat(ConfigurationLoader.parseDuration("PT90S")).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    public void shouldDescribeConfigurationOptions() {
        // When
        String help = ConfigurationLoader.getConfigurationHelp();

        // Then
        assertThat(help).contains("max-concurrency", "NEWRELIC_API_KEY", "Priority Order");
        assertThat(List.of(help.split("\n"))).isNotEmpty();
    }
}
