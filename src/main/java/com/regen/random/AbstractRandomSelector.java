package com.regen.random;

/**
 * Handles the bounds contract of {@link RandomSelector} so implementations only draw
 * from their source when there is an actual choice to make.
 */
public abstract class AbstractRandomSelector implements RandomSelector {

    @Override
    public final int uniform(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("uniform: n < 0 (" + n + ")");
        }
        if (n <= 1) {
            return 0;
        }
        return nextBelow(n);
    }

    /**
     * Draws a value in {@code [0, bound)}; {@code bound} is always at least 2.
     */
    protected abstract int nextBelow(int bound);
}
