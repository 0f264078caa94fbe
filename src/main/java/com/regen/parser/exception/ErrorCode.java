package com.regen.parser.exception;

/**
 * Kinds of regular expression syntax errors.
 */
public enum ErrorCode {
    INVALID_CHAR_CLASS("invalid character class"),
    INVALID_CHAR_RANGE("invalid character class range"),
    INVALID_ESCAPE("invalid escape sequence"),
    INVALID_NAMED_CAPTURE("invalid named capture"),
    INVALID_PERL_OP("invalid or unsupported Perl syntax"),
    INVALID_REPEAT_OP("invalid nested repetition operator"),
    INVALID_REPEAT_SIZE("invalid repeat count"),
    MISSING_BRACKET("missing closing ]"),
    MISSING_PAREN("missing closing )"),
    MISSING_REPEAT_ARGUMENT("missing argument to repetition operator"),
    TRAILING_BACKSLASH("trailing backslash at end of expression"),
    UNEXPECTED_PAREN("unexpected )"),
    NESTING_DEPTH("expression nests too deeply");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
