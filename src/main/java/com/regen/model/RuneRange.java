package com.regen.model;

/**
 * Inclusive range of Unicode code points.
 */
public record RuneRange(int lo, int hi) {

    public RuneRange {
        if (lo > hi) {
            throw new IllegalArgumentException("Invalid rune range: " + lo + " > " + hi);
        }
    }

    public static RuneRange single(int rune) {
        return new RuneRange(rune, rune);
    }

    public long size() {
        return (long) hi - lo + 1;
    }

    public boolean contains(int rune) {
        return rune >= lo && rune <= hi;
    }
}
