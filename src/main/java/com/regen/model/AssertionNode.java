package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class AssertionNode extends RegexNode {
    @NonNull AssertionKind kind;

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
