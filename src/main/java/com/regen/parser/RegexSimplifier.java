package com.regen.parser;

import java.util.ArrayList;
import java.util.List;

import com.regen.model.AlternateNode;
import com.regen.model.AnyCharNode;
import com.regen.model.AssertionNode;
import com.regen.model.CaptureNode;
import com.regen.model.CharClassNode;
import com.regen.model.ConcatNode;
import com.regen.model.EmptyMatchNode;
import com.regen.model.LiteralNode;
import com.regen.model.NoMatchNode;
import com.regen.model.RegexNode;
import com.regen.model.RegexNodeVisitor;
import com.regen.model.RepeatNode;
import com.regen.model.RepeatOperator;

/**
 * Rewrites counted repetitions into chains of star, plus and optional operators:
 * {@code x{2,4}} becomes {@code xx(?:xx?)?} and {@code x{3,}} becomes {@code xxx+}.
 *
 * <p>Each optional link in the chain is a separate coin toss, so simplified patterns favor
 * short repetitions more strongly than the uniform count used for {@code {m,n}}.
 * Subtrees that need no rewriting are returned as-is.
 */
public class RegexSimplifier implements RegexNodeVisitor<RegexNode> {

    public RegexNode simplify(RegexNode node) {
        return node.accept(this);
    }

    @Override
    public RegexNode visit(NoMatchNode noMatch) {
        return noMatch;
    }

    @Override
    public RegexNode visit(EmptyMatchNode emptyMatch) {
        return emptyMatch;
    }

    @Override
    public RegexNode visit(LiteralNode literal) {
        return literal;
    }

    @Override
    public RegexNode visit(CharClassNode charClass) {
        return charClass;
    }

    @Override
    public RegexNode visit(AnyCharNode anyChar) {
        return anyChar;
    }

    @Override
    public RegexNode visit(AssertionNode assertion) {
        return assertion;
    }

    @Override
    public RegexNode visit(RepeatNode repeat) {
        RegexNode sub = repeat.getSub().accept(this);
        if (repeat.getOperator() == RepeatOperator.COUNTED) {
            return expandCounted(sub, repeat.getMin(), repeat.getMax(), repeat.isGreedy());
        }
        return sub == repeat.getSub() ? repeat : repeat.withSub(sub);
    }

    @Override
    public RegexNode visit(ConcatNode concat) {
        List<RegexNode> children = simplifyAll(concat.getChildren());
        return children == null ? concat : new ConcatNode(children);
    }

    @Override
    public RegexNode visit(CaptureNode capture) {
        RegexNode sub = capture.getSub().accept(this);
        return sub == capture.getSub() ? capture : capture.withSub(sub);
    }

    @Override
    public RegexNode visit(AlternateNode alternate) {
        List<RegexNode> children = simplifyAll(alternate.getChildren());
        return children == null ? alternate : new AlternateNode(children);
    }

    private RegexNode expandCounted(RegexNode sub, int min, int max, boolean greedy) {
        if (max == RepeatNode.UNBOUNDED) {
            if (min == 0) {
                return RepeatNode.star(sub, greedy);
            }
            if (min == 1) {
                return RepeatNode.plus(sub, greedy);
            }
            List<RegexNode> parts = new ArrayList<>();
            for (int i = 0; i < min - 1; i++) {
                parts.add(sub);
            }
            parts.add(RepeatNode.plus(sub, greedy));
            return new ConcatNode(parts);
        }
        if (max == 0) {
            return EmptyMatchNode.INSTANCE;
        }
        if (min == 1 && max == 1) {
            return sub;
        }

        List<RegexNode> parts = new ArrayList<>();
        for (int i = 0; i < min; i++) {
            parts.add(sub);
        }
        if (max > min) {
            RegexNode suffix = RepeatNode.quest(sub, greedy);
            for (int i = min + 1; i < max; i++) {
                suffix = RepeatNode.quest(new ConcatNode(List.of(sub, suffix)), greedy);
            }
            parts.add(suffix);
        }
        return parts.size() == 1 ? parts.get(0) : new ConcatNode(parts);
    }

    /**
     * Simplifies every child; returns null if none of them changed.
     */
    private List<RegexNode> simplifyAll(List<RegexNode> children) {
        List<RegexNode> result = new ArrayList<>(children.size());
        boolean changed = false;
        for (RegexNode child : children) {
            RegexNode simplified = child.accept(this);
            changed |= simplified != child;
            result.add(simplified);
        }
        return changed ? result : null;
    }
}
