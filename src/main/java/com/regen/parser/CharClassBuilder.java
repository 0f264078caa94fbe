package com.regen.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.regen.model.CharClassNode;
import com.regen.model.RuneRange;

/**
 * Accumulates code point ranges for a character class and normalizes them into the
 * sorted, merged form held by {@link CharClassNode}.
 */
public class CharClassBuilder {

    public static final int MAX_RUNE = Character.MAX_CODE_POINT;

    private final List<RuneRange> ranges = new ArrayList<>();

    public CharClassBuilder addRange(int lo, int hi) {
        ranges.add(new RuneRange(lo, hi));
        return this;
    }

    public CharClassBuilder addRanges(List<RuneRange> other) {
        ranges.addAll(other);
        return this;
    }

    public CharClassBuilder addNegatedRanges(List<RuneRange> other) {
        ranges.addAll(complement(normalize(other)));
        return this;
    }

    /**
     * Adds {@code lo..hi} plus the simple upper, lower and title case forms of every member.
     */
    public CharClassBuilder addFoldedRange(int lo, int hi) {
        ranges.add(new RuneRange(lo, hi));
        for (int rune = lo; rune <= hi; rune++) {
            addIfOutside(Character.toUpperCase(rune), lo, hi);
            addIfOutside(Character.toLowerCase(rune), lo, hi);
            addIfOutside(Character.toTitleCase(rune), lo, hi);
        }
        return this;
    }

    public CharClassBuilder addFoldedRanges(List<RuneRange> other) {
        for (RuneRange range : other) {
            addFoldedRange(range.lo(), range.hi());
        }
        return this;
    }

    /**
     * Replaces the accumulated ranges with their complement over {@code 0..MAX_RUNE}.
     */
    public CharClassBuilder negate() {
        List<RuneRange> negated = complement(normalize(ranges));
        ranges.clear();
        ranges.addAll(negated);
        return this;
    }

    public CharClassNode build() {
        return new CharClassNode(normalize(ranges));
    }

    private void addIfOutside(int rune, int lo, int hi) {
        if (rune < lo || rune > hi) {
            ranges.add(RuneRange.single(rune));
        }
    }

    /**
     * Sorts ranges and merges the ones that overlap or touch.
     */
    static List<RuneRange> normalize(List<RuneRange> input) {
        List<RuneRange> sorted = new ArrayList<>(input);
        sorted.sort(Comparator.comparingInt(RuneRange::lo).thenComparingInt(RuneRange::hi));

        List<RuneRange> merged = new ArrayList<>();
        for (RuneRange range : sorted) {
            if (!merged.isEmpty()) {
                RuneRange last = merged.get(merged.size() - 1);
                if ((long) range.lo() <= (long) last.hi() + 1) {
                    merged.set(merged.size() - 1, new RuneRange(last.lo(), Math.max(last.hi(), range.hi())));
                    continue;
                }
            }
            merged.add(range);
        }
        return merged;
    }

    /**
     * Complement of already normalized ranges.
     */
    static List<RuneRange> complement(List<RuneRange> normalized) {
        List<RuneRange> result = new ArrayList<>();
        int next = 0;
        for (RuneRange range : normalized) {
            if (range.lo() > next) {
                result.add(new RuneRange(next, range.lo() - 1));
            }
            next = range.hi() + 1;
        }
        if (next <= MAX_RUNE) {
            result.add(new RuneRange(next, MAX_RUNE));
        }
        return result;
    }
}
