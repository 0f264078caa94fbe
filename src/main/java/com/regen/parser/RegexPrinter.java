package com.regen.parser;

import java.util.List;
import java.util.stream.Collectors;

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
import com.regen.model.RuneRange;

/**
 * Renders an AST back to Perl-mode RE2 syntax. The output parses to an equivalent tree,
 * using non-capturing groups wherever precedence requires one.
 */
public class RegexPrinter implements RegexNodeVisitor<String> {

    private static final String LITERAL_SPECIALS = "\\.+*?()|[]{}^$";
    private static final String CLASS_SPECIALS = "\\[]^-";

    public String print(RegexNode node) {
        return node.accept(this);
    }

    @Override
    public String visit(NoMatchNode noMatch) {
        return "[^\\x00-\\x{10FFFF}]";
    }

    @Override
    public String visit(EmptyMatchNode emptyMatch) {
        return "(?:)";
    }

    @Override
    public String visit(LiteralNode literal) {
        StringBuilder sb = new StringBuilder();
        literal.getText().codePoints().forEach(rune -> appendEscaped(sb, rune, LITERAL_SPECIALS));
        return literal.isFoldCase() ? "(?i:" + sb + ")" : sb.toString();
    }

    @Override
    public String visit(CharClassNode charClass) {
        List<RuneRange> ranges = charClass.getRanges();
        boolean negate = !ranges.isEmpty()
                && ranges.get(0).lo() == 0
                && ranges.get(ranges.size() - 1).hi() == CharClassBuilder.MAX_RUNE
                && ranges.size() > 1;

        StringBuilder sb = new StringBuilder("[");
        if (negate) {
            sb.append('^');
            ranges = CharClassBuilder.complement(ranges);
        }
        for (RuneRange range : ranges) {
            appendEscaped(sb, range.lo(), CLASS_SPECIALS);
            if (range.hi() > range.lo()) {
                if (range.hi() > range.lo() + 1) {
                    sb.append('-');
                }
                appendEscaped(sb, range.hi(), CLASS_SPECIALS);
            }
        }
        return sb.append(']').toString();
    }

    @Override
    public String visit(AnyCharNode anyChar) {
        return anyChar.isMatchesNewline() ? "(?s:.)" : ".";
    }

    @Override
    public String visit(AssertionNode assertion) {
        return assertion.getKind().getSyntax();
    }

    @Override
    public String visit(RepeatNode repeat) {
        String operand = repeat.getSub().accept(this);
        if (needsGroupForRepeat(repeat.getSub())) {
            operand = "(?:" + operand + ")";
        }
        String operator = switch (repeat.getOperator()) {
            case STAR -> "*";
            case PLUS -> "+";
            case QUEST -> "?";
            case COUNTED -> {
                if (repeat.isUnbounded()) {
                    yield "{" + repeat.getMin() + ",}";
                }
                if (repeat.getMin() == repeat.getMax()) {
                    yield "{" + repeat.getMin() + "}";
                }
                yield "{" + repeat.getMin() + "," + repeat.getMax() + "}";
            }
        };
        return operand + operator + (repeat.isGreedy() ? "" : "?");
    }

    @Override
    public String visit(ConcatNode concat) {
        return concat.getChildren().stream()
                .map(child -> child instanceof AlternateNode ? "(?:" + child.accept(this) + ")" : child.accept(this))
                .collect(Collectors.joining());
    }

    @Override
    public String visit(CaptureNode capture) {
        String body = capture.getSub().accept(this);
        return capture.getName() == null ? "(" + body + ")" : "(?P<" + capture.getName() + ">" + body + ")";
    }

    @Override
    public String visit(AlternateNode alternate) {
        return alternate.getChildren().stream()
                .map(child -> child.accept(this))
                .collect(Collectors.joining("|"));
    }

    private static boolean needsGroupForRepeat(RegexNode sub) {
        if (sub instanceof LiteralNode literal) {
            return !literal.isFoldCase() && literal.codePointCount() > 1;
        }
        return sub instanceof ConcatNode || sub instanceof AlternateNode || sub instanceof RepeatNode;
    }

    private static void appendEscaped(StringBuilder sb, int rune, String specials) {
        switch (rune) {
            case '\n' -> sb.append("\\n");
            case '\t' -> sb.append("\\t");
            case '\r' -> sb.append("\\r");
            case '\f' -> sb.append("\\f");
            default -> {
                if (rune < 0x80 && specials.indexOf(rune) >= 0) {
                    sb.append('\\').appendCodePoint(rune);
                } else if (rune < 0x20 || rune == 0x7F || !isPrintable(rune)) {
                    sb.append("\\x{").append(Integer.toHexString(rune).toUpperCase()).append('}');
                } else {
                    sb.appendCodePoint(rune);
                }
            }
        }
    }

    private static boolean isPrintable(int rune) {
        int type = Character.getType(rune);
        return type != Character.UNASSIGNED && type != Character.CONTROL && type != Character.SURROGATE
                && type != Character.PRIVATE_USE && type != Character.FORMAT && !Character.isSpaceChar(rune)
                || rune == ' ';
    }
}
