package com.regen.parser;

/**
 * Regular expression dialects accepted by {@link RegexParser}.
 */
public enum SyntaxMode {
    /**
     * RE2's default syntax: Perl escapes and flag groups, {@code ^}/{@code $} anchor the whole
     * text, negated classes may match newline, Unicode classes are available.
     */
    PERL(true, true, false),

    /**
     * POSIX egrep syntax: no Perl extensions, {@code ^}/{@code $} anchor lines and negated
     * classes never match newline.
     */
    POSIX(false, false, true);

    private final boolean perlExtensions;
    private final boolean negatedClassesMatchNewline;
    private final boolean multiLineByDefault;

    SyntaxMode(boolean perlExtensions, boolean negatedClassesMatchNewline, boolean multiLineByDefault) {
        this.perlExtensions = perlExtensions;
        this.negatedClassesMatchNewline = negatedClassesMatchNewline;
        this.multiLineByDefault = multiLineByDefault;
    }

    public boolean isPerlExtensions() {
        return perlExtensions;
    }

    public boolean isNegatedClassesMatchNewline() {
        return negatedClassesMatchNewline;
    }

    public boolean isMultiLineByDefault() {
        return multiLineByDefault;
    }
}
