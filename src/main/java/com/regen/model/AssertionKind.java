package com.regen.model;

/**
 * Zero-width assertions supported by RE2 syntax.
 */
public enum AssertionKind {
    /** {@code ^} in multi-line mode. */
    BEGIN_LINE("(?m:^)"),
    /** {@code $} in multi-line mode. */
    END_LINE("(?m:$)"),
    /** {@code \A}, or {@code ^} outside multi-line mode. */
    BEGIN_TEXT("\\A"),
    /** {@code \z}, or {@code $} outside multi-line mode. */
    END_TEXT("\\z"),
    WORD_BOUNDARY("\\b"),
    NO_WORD_BOUNDARY("\\B");

    private final String syntax;

    AssertionKind(String syntax) {
        this.syntax = syntax;
    }

    public String getSyntax() {
        return syntax;
    }
}
