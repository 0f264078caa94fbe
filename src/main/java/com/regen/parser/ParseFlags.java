package com.regen.parser;

import lombok.Value;
import lombok.With;

/**
 * Flags in effect at a given point of the pattern, as changed by {@code (?imsU)} groups.
 */
@Value
@With
public class ParseFlags {
    /** {@code i}: case-insensitive. */
    boolean foldCase;
    /** {@code s}: {@code .} matches newline. */
    boolean dotMatchesNewline;
    /** {@code m}: {@code ^} and {@code $} match at line boundaries. */
    boolean multiLine;
    /** {@code U}: swap the meaning of {@code x*} and {@code x*?}. */
    boolean ungreedy;

    public static ParseFlags defaults(SyntaxMode mode) {
        return new ParseFlags(false, false, mode.isMultiLineByDefault(), false);
    }
}
