package com.reliquary.util;

import java.util.List;
import java.util.Random;

/**
 * Seeded random source for placement attempts.
 *
 * <p>Every attempt request owns one instance, derived from its salted seed, so
 * the sequence of draws depends only on (version, options, seed, nonce) and
 * never on thread scheduling. Instances are not thread-safe and must not be
 * shared between workers.
 */
public class Randomization {

    private final Random random;

    /**
     * Constructor with seeded random for deterministic draws.
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

    // ========================================================================
    // Selection
    // ========================================================================

    /**
     * Pick one element uniformly.
     *
     * @param items the candidates, must not be empty
     * @param <T>   the type of items
     * @return the selected item
     */
    public <T> T chooseRandom(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(uniformRandomInt(0, items.size() - 1));
    }
}
