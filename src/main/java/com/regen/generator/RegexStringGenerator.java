package com.regen.generator;

import com.regen.generator.exception.UnsupportedConstructException;
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
import com.regen.random.RandomSelector;

/**
 * Produces strings that plausibly match a regular expression by walking its AST and
 * resolving every choice (repeat counts, class members, alternation branches) through a
 * {@link RandomSelector}.
 *
 * <p>The generator keeps no per-call state. Each call writes into the buffer it is given,
 * so concurrent calls are independent as long as they use separate buffers and the
 * selector is thread-safe.
 *
 * <p>This is a best-effort generator: anchors are approximated and word boundaries are
 * rejected with {@link UnsupportedConstructException}.
 */
public class RegexStringGenerator {

    public static final int DEFAULT_MAX_UNBOUNDED_REPEAT = 32;

    /** Printable ASCII window used for {@code .}: space through tilde. */
    static final int PRINTABLE_START = ' ';
    static final int PRINTABLE_COUNT = 95;

    private final RandomSelector selector;

    public RegexStringGenerator(RandomSelector selector) {
        this.selector = selector;
    }

    /**
     * Generates text for {@code node}, appending it to {@code output}.
     *
     * @param maxUnboundedRepeat extra iterations allowed beyond the minimum for {@code *},
     *                           {@code +} and {@code {n,}}
     * @return {@link GenerationResult#STOP} if an end-of-text marker cut generation short
     */
    public GenerationResult generate(RegexNode node, StringBuilder output, int maxUnboundedRepeat) {
        if (maxUnboundedRepeat < 0) {
            throw new IllegalArgumentException("maxUnboundedRepeat must be >= 0. Got: " + maxUnboundedRepeat);
        }
        return node.accept(new Walker(output, maxUnboundedRepeat));
    }

    /**
     * Generates one complete string. A {@link GenerationResult#STOP} is treated as the end
     * of the string; fatal errors propagate and no partial text is returned.
     */
    public String generateString(RegexNode node, int maxUnboundedRepeat) {
        StringBuilder output = new StringBuilder();
        generate(node, output, maxUnboundedRepeat);
        return output.toString();
    }

    private final class Walker implements RegexNodeVisitor<GenerationResult> {

        private final StringBuilder output;
        private final int maxUnboundedRepeat;

        private Walker(StringBuilder output, int maxUnboundedRepeat) {
            this.output = output;
            this.maxUnboundedRepeat = maxUnboundedRepeat;
        }

        @Override
        public GenerationResult visit(NoMatchNode noMatch) {
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(EmptyMatchNode emptyMatch) {
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(LiteralNode literal) {
            output.append(literal.getText());
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(CharClassNode charClass) {
            // Uniform over members, so wide ranges are proportionally more likely than narrow ones
            int nth = selector.uniform(Math.toIntExact(charClass.size()));
            for (RuneRange range : charClass.getRanges()) {
                if (nth < range.size()) {
                    output.appendCodePoint(range.lo() + nth);
                    return GenerationResult.CONTINUE;
                }
                nth -= (int) range.size();
            }
            // Only reachable for an empty class, which matches nothing
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(AnyCharNode anyChar) {
            if (!anyChar.isMatchesNewline()) {
                output.appendCodePoint(PRINTABLE_START + selector.uniform(PRINTABLE_COUNT));
                return GenerationResult.CONTINUE;
            }
            int slot = selector.uniform(PRINTABLE_COUNT + 1);
            output.appendCodePoint(slot == PRINTABLE_COUNT ? '\n' : PRINTABLE_START + slot);
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(AssertionNode assertion) {
            return switch (assertion.getKind()) {
                case BEGIN_LINE -> {
                    if (output.length() != 0) {
                        output.append('\n');
                    }
                    yield GenerationResult.CONTINUE;
                }
                case END_LINE -> {
                    if (output.length() == 0) {
                        yield GenerationResult.STOP;
                    }
                    output.append('\n');
                    yield GenerationResult.CONTINUE;
                }
                case BEGIN_TEXT -> GenerationResult.CONTINUE;
                case END_TEXT -> GenerationResult.STOP;
                case WORD_BOUNDARY, NO_WORD_BOUNDARY ->
                        throw new UnsupportedConstructException("word boundary " + assertion.getKind().getSyntax());
            };
        }

        @Override
        public GenerationResult visit(RepeatNode repeat) {
            return switch (repeat.getOperator()) {
                case STAR -> repeatBetween(repeat.getSub(), 0, maxUnboundedRepeat);
                case PLUS -> repeatBetween(repeat.getSub(), 1, 1L + maxUnboundedRepeat);
                case QUEST -> selector.uniform(2) == 1 ? repeat.getSub().accept(this) : GenerationResult.CONTINUE;
                case COUNTED -> {
                    long min = repeat.getMin();
                    long max = repeat.isUnbounded() ? min + maxUnboundedRepeat : Math.max(min, repeat.getMax());
                    yield repeatBetween(repeat.getSub(), min, max);
                }
            };
        }

        /**
         * Repeats {@code sub} between {@code min} and {@code max} times. A span wider than the
         * selector can draw from is clamped to {@link Integer#MAX_VALUE}.
         */
        private GenerationResult repeatBetween(RegexNode sub, long min, long max) {
            long span = Math.min(max - min + 1, Integer.MAX_VALUE);
            long count = min + selector.uniform((int) span);
            for (long i = 0; i < count; i++) {
                if (sub.accept(this) == GenerationResult.STOP) {
                    return GenerationResult.STOP;
                }
            }
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(ConcatNode concat) {
            for (RegexNode child : concat.getChildren()) {
                if (child.accept(this) == GenerationResult.STOP) {
                    return GenerationResult.STOP;
                }
            }
            return GenerationResult.CONTINUE;
        }

        @Override
        public GenerationResult visit(CaptureNode capture) {
            return capture.getSub().accept(this);
        }

        @Override
        public GenerationResult visit(AlternateNode alternate) {
            int nth = selector.uniform(alternate.getChildren().size());
            return alternate.getChildren().get(nth).accept(this);
        }
    }
}
