package com.regen.parser.exception;

/**
 * Thrown when a pattern cannot be parsed. {@code expression} is the offending part of the
 * pattern (the whole pattern for unbalanced parentheses).
 */
public class RegexSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final String expression;

    public RegexSyntaxException(ErrorCode code, String expression) {
        super("error parsing regexp: " + code.getDescription() + ": `" + expression + "`");
        this.code = code;
        this.expression = expression;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getExpression() {
        return expression;
    }
}
