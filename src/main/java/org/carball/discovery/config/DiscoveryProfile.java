package org.carball.discovery.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.discovery.model.discovery.ProfileDepth;

import java.time.Duration;
import java.util.List;

@Getter
@Slf4j
public enum DiscoveryProfile {

    QUICK("quick", "Quick scan - small samples, basic profiling",
            0.25, 1.0, 1.0, ProfileDepth.BASIC),

    BALANCED("balanced", "Balanced approach - default settings for most accounts",
            1.0, 1.0, 1.0, ProfileDepth.STANDARD),

    THOROUGH("thorough", "Thorough discovery - large samples, full profiling including sample values",
            5.0, 0.5, 1.0, ProfileDepth.FULL) {
        @Override
        public DiscoveryConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .discoveryTimeout(Duration.ofMinutes(15))
                    .qualityWindow(Duration.ofDays(7))
                    .samplingStrategies(List.of("stratified", "reservoir", "adaptive", "random"))
                    .build();
        }
    },

    LOW_QUOTA("low-quota", "Conservative query usage for accounts with tight NRDB limits",
            0.5, 0.3, 0.25, ProfileDepth.STANDARD) {
        @Override
        public DiscoveryConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .cacheTtl(Duration.ofHours(6)) // Re-query as rarely as possible
                    .maxAttempts(2)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double sampleMultiplier;
    private final double concurrencyMultiplier;
    private final double rateMultiplier;
    private final ProfileDepth depth;

    DiscoveryProfile(String name, String description,
                     double sampleMultiplier, double concurrencyMultiplier, double rateMultiplier,
                     ProfileDepth depth) {
        this.name = name;
        this.description = description;
        this.sampleMultiplier = sampleMultiplier;
        this.concurrencyMultiplier = concurrencyMultiplier;
        this.rateMultiplier = rateMultiplier;
        this.depth = depth;
    }

    /**
     * Creates a DiscoveryConfig based on this profile's settings.
     */
    public DiscoveryConfig buildConfig() {
        // Base values that profiles multiply against
        int baseSampleSize = 1000;
        int baseMaxSampleSize = 10000;
        int baseConcurrency = 10;
        int baseRate = 60;

        int sampleSize = Math.max(10, (int) (baseSampleSize * sampleMultiplier));
        int rate = Math.max(1, (int) (baseRate * rateMultiplier));

        return DiscoveryConfig.builder()
                .profileName(name)
                .profileDescription(description)
                .defaultSampleSize(sampleSize)
                .maxSampleSize(Math.max(sampleSize, (int) (baseMaxSampleSize * sampleMultiplier)))
                .maxConcurrency(Math.max(1, (int) (baseConcurrency * concurrencyMultiplier)))
                .rateLimitPerMinute(rate)
                .rateLimitBurst(rate)
                .profileDepth(depth)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static DiscoveryProfile fromName(String name) {
        for (DiscoveryProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown discovery profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    /**
     * Returns a comma-separated list of available profile names.
     */
    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (DiscoveryProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Discovery Profiles:\n\n");
        for (DiscoveryProfile profile : values()) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
        return help.toString();
    }
}
