package com.regen.generator.exception;

/**
 * Raised when the randomness source cannot supply a value. Never retried by the generator.
 */
public class EntropyUnavailableException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public EntropyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
