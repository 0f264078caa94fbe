package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A fixed run of characters. Adjacent literal characters are merged by the parser.
 * {@code foldCase} records that the text was parsed under {@code (?i)}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class LiteralNode extends RegexNode {
    @NonNull String text;
    boolean foldCase;

    public static LiteralNode of(String text) {
        return new LiteralNode(text, false);
    }

    public int codePointCount() {
        return text.codePointCount(0, text.length());
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
