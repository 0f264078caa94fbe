package com.regen.model;

/**
 * Base class for all regular expression AST nodes.
 * Nodes are immutable once built; consumers traverse them through a {@link RegexNodeVisitor}.
 */
public abstract class RegexNode {

    public abstract <R> R accept(RegexNodeVisitor<R> visitor);
}
