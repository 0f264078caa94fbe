package com.regen.generator.exception;

/**
 * Raised when the expression contains a construct the generator declines to produce text for.
 */
public class UnsupportedConstructException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final String construct;

    public UnsupportedConstructException(String construct) {
        super("Unsupported construct: " + construct);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
