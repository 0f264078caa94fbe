package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A capturing group. {@code name} is null for unnamed groups; {@code index} starts at 1.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class CaptureNode extends RegexNode {
    int index;
    String name;
    @NonNull RegexNode sub;

    public CaptureNode withSub(RegexNode newSub) {
        return new CaptureNode(index, name, newSub);
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
