package org.carball.discovery.sampling;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fixed-size uniform sample over a stream of unknown length. After {@code n} offers every item has
 * been kept with probability {@code capacity / n}.
 */
public class Reservoir<T> {

    private final int capacity;
    private final Random random;
    private final List<T> items;
    private long seen;

    public Reservoir(int capacity, Random random) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Reservoir capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.random = random;
        this.items = new ArrayList<>(capacity);
    }

    public void offer(T item) {
        seen++;
        if (items.size() < capacity) {
            items.add(item);
            return;
        }
        long slot = (long) (random.nextDouble() * seen);
        if (slot < capacity) {
            items.set((int) slot, item);
        }
    }

    public List<T> items() {
        return List.copyOf(items);
    }

    public long seen() {
        return seen;
    }

    public int capacity() {
        return capacity;
    }
}
