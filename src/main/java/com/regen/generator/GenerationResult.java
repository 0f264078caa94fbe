package com.regen.generator;

/**
 * Outcome of generating one node.
 */
public enum GenerationResult {
    /** Generation proceeds normally with the next sibling. */
    CONTINUE,
    /**
     * An end-of-text marker was reached. Not an error: nothing further is appended in the
     * enclosing sequence, and the text written so far is kept.
     */
    STOP
}
