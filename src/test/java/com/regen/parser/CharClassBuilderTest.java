package com.regen.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.regen.model.CharClassNode;
import com.regen.model.RuneRange;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CharClassBuilder.
 */
class CharClassBuilderTest {

    @Test
    void testNormalizeMergesOverlappingAndAdjacentRanges() {
        List<RuneRange> normalized = CharClassBuilder.normalize(List.of(
                new RuneRange('m', 'p'), new RuneRange('a', 'c'), new RuneRange('d', 'f'), new RuneRange('n', 'z')));

        assertThat(normalized).containsExactly(new RuneRange('a', 'f'), new RuneRange('m', 'z'));
    }

    @Test
    void testComplementCoversTheRestOfUnicode() {
        List<RuneRange> complement = CharClassBuilder.complement(List.of(new RuneRange('b', 'c'), RuneRange.single('x')));

        assertThat(complement).containsExactly(
                new RuneRange(0, 'a'),
                new RuneRange('d', 'w'),
                new RuneRange('y', CharClassBuilder.MAX_RUNE));
    }

    @Test
    void testComplementOfEverythingIsEmpty() {
        assertThat(CharClassBuilder.complement(List.of(new RuneRange(0, CharClassBuilder.MAX_RUNE)))).isEmpty();
        assertThat(CharClassBuilder.complement(List.of()))
                .containsExactly(new RuneRange(0, CharClassBuilder.MAX_RUNE));
    }

    @Test
    void testNegateTwiceRestoresClass() {
        CharClassNode node = new CharClassBuilder()
                .addRange('0', '9')
                .addRange('a', 'f')
                .negate()
                .negate()
                .build();

        assertThat(node.getRanges()).containsExactly(new RuneRange('0', '9'), new RuneRange('a', 'f'));
    }

    @Test
    void testFoldedRangeAddsOtherCases() {
        CharClassNode node = new CharClassBuilder().addFoldedRange('x', 'z').build();

        assertThat(node.getRanges()).containsExactly(new RuneRange('X', 'Z'), new RuneRange('x', 'z'));
    }

    @Test
    void testFoldedRangeLeavesCaselessRunesAlone() {
        CharClassNode node = new CharClassBuilder().addFoldedRange('0', '9').build();

        assertThat(node.getRanges()).containsExactly(new RuneRange('0', '9'));
    }

    @Test
    void testNegatedRangesAreAddedAsComplement() {
        CharClassNode node = new CharClassBuilder()
                .addNegatedRanges(List.of(new RuneRange(1, CharClassBuilder.MAX_RUNE)))
                .build();

        assertThat(node.getRanges()).containsExactly(RuneRange.single(0));
        assertThat(node.size()).isEqualTo(1);
    }

    @Test
    void testSizeCountsEveryCodePoint() {
        CharClassNode node = new CharClassBuilder().addRange('a', 'z').addRange(0x10000, 0x1FFFF).build();

        assertThat(node.size()).isEqualTo(26 + 0x10000);
        assertThat(node.contains(0x1F600)).isTrue();
        assertThat(node.contains('A')).isFalse();
    }
}
