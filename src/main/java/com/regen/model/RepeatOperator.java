package com.regen.model;

/**
 * Repetition operators. {@link #COUNTED} covers {@code {n}}, {@code {n,}} and {@code {n,m}}.
 */
public enum RepeatOperator {
    STAR,
    PLUS,
    QUEST,
    COUNTED
}
