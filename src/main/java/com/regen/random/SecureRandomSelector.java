package com.regen.random;

import java.security.ProviderException;
import java.security.SecureRandom;

import com.regen.generator.exception.EntropyUnavailableException;

/**
 * Default selector backed by {@link SecureRandom}. Safe to share between threads.
 */
public class SecureRandomSelector extends AbstractRandomSelector {

    private final SecureRandom random;

    public SecureRandomSelector() {
        this(new SecureRandom());
    }

    public SecureRandomSelector(SecureRandom random) {
        this.random = random;
    }

    @Override
    protected int nextBelow(int bound) {
        try {
            return random.nextInt(bound);
        } catch (ProviderException e) {
            throw new EntropyUnavailableException("Random source failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "SecureRandomSelector{algorithm=" + random.getAlgorithm() + "}";
    }
}
