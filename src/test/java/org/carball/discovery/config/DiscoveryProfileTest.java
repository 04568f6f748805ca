package org.carball.discovery.config;

import org.carball.discovery.model.discovery.ProfileDepth;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DiscoveryProfileTest {

    @Test
    public void shouldFindProfilesIgnoringCase() {
        assertThat(DiscoveryProfile.fromName("QUICK")).isEqualTo(DiscoveryProfile.QUICK);
        assertThat(DiscoveryProfile.fromName("Low-Quota")).isEqualTo(DiscoveryProfile.LOW_QUOTA);
    }

    @Test
    public void shouldListAvailableProfilesInError() {
        assertThatThrownBy(() -> DiscoveryProfile.fromName("fast"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Available profiles: quick, balanced, thorough, low-quota");
    }

    @Test
    public void shouldScaleThoroughProfile() {
        // When
        DiscoveryConfig config = DiscoveryProfile.THOROUGH.buildConfig();

        // Then
        assertThat(config.getDefaultSampleSize()).isEqualTo(5000);
        assertThat(config.getMaxSampleSize()).isEqualTo(50000);
        assertThat(config.getMaxConcurrency()).isEqualTo(5);
        assertThat(config.getProfileDepth()).isEqualTo(ProfileDepth.FULL);
        assertThat(config.getDiscoveryTimeout()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.getQualityWindow()).isEqualTo(Duration.ofDays(7));
        assertThat(config.getSamplingStrategies()).startsWith("stratified");
    }

    @Test
    public void shouldConserveQueriesInLowQuotaProfile() {
        // When
        DiscoveryConfig config = DiscoveryProfile.LOW_QUOTA.buildConfig();

        // Then
        assertThat(config.getRateLimitPerMinute()).isEqualTo(15);
        assertThat(config.getMaxConcurrency()).isEqualTo(3);
        assertThat(config.getDefaultSampleSize()).isEqualTo(500);
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofHours(6));
        assertThat(config.getMaxAttempts()).isEqualTo(2);
    }

    @Test
    public void shouldBuildValidConfigForEveryProfile() {
        for (DiscoveryProfile profile : DiscoveryProfile.values()) {
            DiscoveryConfig config = profile.buildConfig();
            config.validate();
            assertThat(config.getMaxSampleSize()).isGreaterThanOrEqualTo(config.getDefaultSampleSize());
            assertThat(config.getProfileName()).isEqualTo(profile.getName());
        }
    }

    @Test
    public void shouldDescribeProfiles() {
        assertThat(DiscoveryProfile.getProfileHelp()).contains("quick", "balanced", "thorough", "low-quota");
    }
}
