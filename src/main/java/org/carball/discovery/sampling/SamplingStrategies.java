package org.carball.discovery.sampling;

import org.carball.discovery.client.QueryClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Factory for the closed set of sampling strategies.
 */
public final class SamplingStrategies {

    private static final List<String> NAMES = List.of(
            RandomSamplingStrategy.NAME,
            StratifiedSamplingStrategy.NAME,
            AdaptiveSamplingStrategy.NAME,
            ReservoirSamplingStrategy.NAME);

    private SamplingStrategies() {
    }

    public static SamplingStrategy create(String name, QueryClient client, Random random) {
        return switch (name.toLowerCase()) {
            case RandomSamplingStrategy.NAME -> new RandomSamplingStrategy(client, random);
            case StratifiedSamplingStrategy.NAME -> new StratifiedSamplingStrategy(client, random);
            case AdaptiveSamplingStrategy.NAME -> new AdaptiveSamplingStrategy(client, random);
            case ReservoirSamplingStrategy.NAME -> new ReservoirSamplingStrategy(client, random);
            default -> throw new IllegalArgumentException("Unknown sampling strategy: " + name
                    + ". Available strategies: " + String.join(", ", NAMES));
        };
    }

    public static Map<String, SamplingStrategy> createAll(QueryClient client, Random random) {
        Map<String, SamplingStrategy> strategies = new LinkedHashMap<>();
        for (String name : NAMES) {
            strategies.put(name, create(name, client, random));
        }
        return strategies;
    }

    public static List<String> names() {
        return NAMES;
    }
}
