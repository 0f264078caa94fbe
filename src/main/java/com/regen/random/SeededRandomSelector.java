package com.regen.random;

import java.util.Random;

/**
 * Deterministic selector for reproducible runs. The same seed always yields the same
 * sequence of choices, and therefore the same generated strings for the same patterns.
 */
public class SeededRandomSelector extends AbstractRandomSelector {

    private final long seed;
    private final Random random;

    public SeededRandomSelector(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    protected int nextBelow(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public String toString() {
        return "SeededRandomSelector{seed=" + seed + "}";
    }
}
