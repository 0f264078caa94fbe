package com.regen.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class ConcatNode extends RegexNode {
    List<RegexNode> children;

    public ConcatNode(List<RegexNode> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
