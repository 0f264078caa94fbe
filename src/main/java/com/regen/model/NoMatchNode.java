package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Matches nothing at all, e.g. an empty character class {@code [^\x00-\x{10FFFF}]}.
 */
@ToString
@EqualsAndHashCode(callSuper = false)
public final class NoMatchNode extends RegexNode {

    public static final NoMatchNode INSTANCE = new NoMatchNode();

    private NoMatchNode() {
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
