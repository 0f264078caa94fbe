package com.regen.random;

import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.regen.generator.exception.EntropyUnavailableException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the RandomSelector implementations.
 */
class RandomSelectorTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 1})
    void testTrivialBoundsDoNotTouchEntropySource(int n) {
        SecureRandom failing = new FailingSecureRandom();
        RandomSelector selector = new SecureRandomSelector(failing);

        assertThat(selector.uniform(n)).isZero();
    }

    @Test
    void testNegativeBoundIsRejected() {
        RandomSelector selector = new SeededRandomSelector(1L);

        assertThatThrownBy(() -> selector.uniform(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("n < 0");
    }

    @Test
    void testSourceFailureRaisesEntropyUnavailable() {
        RandomSelector selector = new SecureRandomSelector(new FailingSecureRandom());

        assertThatThrownBy(() -> selector.uniform(10))
                .isInstanceOf(EntropyUnavailableException.class)
                .hasCauseInstanceOf(ProviderException.class);
    }

    @Test
    void testSecureSelectorStaysInRange() {
        RandomSelector selector = new SecureRandomSelector();

        IntStream.range(0, 1000).forEach(i -> assertThat(selector.uniform(7)).isBetween(0, 6));
    }

    @Test
    void testSeededSelectorIsReproducible() {
        RandomSelector first = new SeededRandomSelector(42L);
        RandomSelector second = new SeededRandomSelector(42L);

        int[] a = IntStream.range(0, 100).map(i -> first.uniform(1000)).toArray();
        int[] b = IntStream.range(0, 100).map(i -> second.uniform(1000)).toArray();

        assertThat(a).isEqualTo(b);
    }

    @Test
    void testSeededSelectorCoversEveryValue() {
        RandomSelector selector = new SeededRandomSelector(7L);
        boolean[] seen = new boolean[5];

        for (int i = 0; i < 500; i++) {
            seen[selector.uniform(5)] = true;
        }

        assertThat(seen).containsOnly(true);
    }

    @Test
    void testForSeedPicksImplementation() {
        assertThat(RandomSelectors.forSeed(null)).isInstanceOf(SecureRandomSelector.class);
        assertThat(RandomSelectors.forSeed(5L))
                .isInstanceOf(SeededRandomSelector.class)
                .extracting(s -> ((SeededRandomSelector) s).getSeed())
                .isEqualTo(5L);
    }

    private static final class FailingSecureRandom extends SecureRandom {

        private static final long serialVersionUID = 1L;

        @Override
        public int nextInt(int bound) {
            throw new ProviderException("entropy source closed");
        }
    }
}
