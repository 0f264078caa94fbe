package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Matches the empty string, e.g. {@code ()} or {@code x{0}}.
 */
@ToString
@EqualsAndHashCode(callSuper = false)
public final class EmptyMatchNode extends RegexNode {

    public static final EmptyMatchNode INSTANCE = new EmptyMatchNode();

    private EmptyMatchNode() {
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
