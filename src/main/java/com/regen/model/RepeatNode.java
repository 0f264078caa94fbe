package com.regen.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A repeated sub-expression. {@code max == UNBOUNDED} means no upper limit.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class RepeatNode extends RegexNode {

    public static final int UNBOUNDED = -1;

    @NonNull RepeatOperator operator;
    @NonNull RegexNode sub;
    int min;
    int max;
    boolean greedy;

    public static RepeatNode star(RegexNode sub, boolean greedy) {
        return new RepeatNode(RepeatOperator.STAR, sub, 0, UNBOUNDED, greedy);
    }

    public static RepeatNode plus(RegexNode sub, boolean greedy) {
        return new RepeatNode(RepeatOperator.PLUS, sub, 1, UNBOUNDED, greedy);
    }

    public static RepeatNode quest(RegexNode sub, boolean greedy) {
        return new RepeatNode(RepeatOperator.QUEST, sub, 0, 1, greedy);
    }

    public static RepeatNode counted(RegexNode sub, int min, int max, boolean greedy) {
        return new RepeatNode(RepeatOperator.COUNTED, sub, min, max, greedy);
    }

    public boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    public RepeatNode withSub(RegexNode newSub) {
        return new RepeatNode(operator, newSub, min, max, greedy);
    }

    @Override
    public <R> R accept(RegexNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
