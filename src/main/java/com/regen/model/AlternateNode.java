package com.regen.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Alternation between two or more branches, kept in source order.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class AlternateNode extends RegexNode {
    List<RegexNode> children;

    public AlternateNode(List<RegexNode> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
