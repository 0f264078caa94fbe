package com.regen.random;

/**
 * Source of uniformly distributed choices for every non-deterministic decision
 * made while generating a string.
 */
public interface RandomSelector {

    /**
     * Returns a value in {@code [0, n)} with uniform probability.
     * For {@code n} of 0 or 1 this is always 0 and no entropy is consumed.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     * @throws com.regen.generator.exception.EntropyUnavailableException if the source fails
     */
    int uniform(int n);
}
