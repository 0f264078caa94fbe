package com.regen.random;

import lombok.experimental.UtilityClass;

@UtilityClass
public class RandomSelectors {

    /**
     * Returns a seeded selector when {@code seed} is set, otherwise a {@link SecureRandomSelector}.
     */
    public static RandomSelector forSeed(Long seed) {
        if (seed == null) {
            return new SecureRandomSelector();
        }
        return new SeededRandomSelector(seed);
    }
}
