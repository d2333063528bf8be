package com.neuroscape.util;

import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random source for level generation.
 *
 * <p>All randomness used while building a level flows through one instance, so a seeded
 * instance reproduces the same level for the same parameters.
 */
@Singleton
public class Randomization {

    private final Random random;

    public Randomization() {
        this.random = ThreadLocalRandom.current();
    }

    /**
     * Constructor with seeded random for deterministic generation and testing.
     *
     * @param seed the random seed
     */
    public Randomization(long seed) {
        this.random = new Random(seed);
    }

    // ========================================================================
    // Uniform Distribution
    // ========================================================================

    /**
     * Generate a random integer uniformly distributed in [min, max].
     *
     * @param min the minimum value (inclusive)
     * @param max the maximum value (inclusive)
     * @return a random integer in [min, max]
     */
    public int uniformRandomInt(int min, int max) {
        if (min >= max) {
            return min;
        }
        return min + random.nextInt(max - min + 1);
    }

    /**
     * Check if an event with given probability should occur.
     *
     * @param probability the probability (0.0 to 1.0)
     * @return true if the event should occur
     */
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    // ========================================================================
    // Collections
    // ========================================================================

    /**
     * Pick one element uniformly.
     *
     * @param items non-empty list
     * @return a random element
     * @throws IllegalArgumentException if the list is empty
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(random.nextInt(items.size()));
    }

    /**
     * Draw {@code count} distinct elements without replacement (partial Fisher-Yates).
     *
     * <p>The source list is not modified. The order of the result is random.
     *
     * @param items source elements
     * @param count how many to draw; clamped to the list size
     * @return the sample
     */
    public <T> List<T> sample(List<T> items, int count) {
        int k = Math.max(0, Math.min(count, items.size()));
        List<T> pool = new ArrayList<>(items);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return new ArrayList<>(pool.subList(0, k));
    }

    /**
     * Shuffle a list in place.
     */
    public <T> void shuffle(List<T> items) {
        Collections.shuffle(items, random);
    }
}
