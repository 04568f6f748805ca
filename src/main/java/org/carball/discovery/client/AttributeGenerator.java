package org.carball.discovery.client;

import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Produces one attribute value for a synthetic record. Returning null leaves the attribute unset.
 */
@FunctionalInterface
public interface AttributeGenerator {

    Object generate(int index, Random random);

    static AttributeGenerator constant(Object value) {
        return (index, random) -> value;
    }

    static AttributeGenerator choice(Object... values) {
        List<Object> options = List.of(values);
        return (index, random) -> options.get(random.nextInt(options.size()));
    }

    static AttributeGenerator gaussian(double mean, double stdDev) {
        return (index, random) -> mean + random.nextGaussian() * stdDev;
    }

    static AttributeGenerator uniform(double min, double max) {
        return (index, random) -> min + random.nextDouble() * (max - min);
    }

    /**
     * Identifiers drawn from a fixed pool, so values repeat across records and event types.
     */
    static AttributeGenerator pool(String prefix, int size) {
        return (index, random) -> prefix + random.nextInt(size);
    }

    static AttributeGenerator uuid() {
        return (index, random) -> new UUID(random.nextLong(), random.nextLong()).toString();
    }

    /**
     * Wraps another generator so roughly {@code nullRatio} of values are missing.
     */
    static AttributeGenerator withNulls(AttributeGenerator delegate, double nullRatio) {
        return (index, random) -> random.nextDouble() < nullRatio ? null : delegate.generate(index, random);
    }
}
