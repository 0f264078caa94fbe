package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * The {@code .} operator. {@code matchesNewline} is set under {@code (?s)}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class AnyCharNode extends RegexNode {
    boolean matchesNewline;

    public static AnyCharNode anyChar() {
        return new AnyCharNode(true);
    }

    public static AnyCharNode anyCharNotNewline() {
        return new AnyCharNode(false);
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
