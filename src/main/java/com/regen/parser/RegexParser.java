package com.regen.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.regen.model.AlternateNode;
import com.regen.model.AnyCharNode;
import com.regen.model.AssertionKind;
import com.regen.model.AssertionNode;
import com.regen.model.CaptureNode;
import com.regen.model.CharClassNode;
import com.regen.model.ConcatNode;
import com.regen.model.EmptyMatchNode;
import com.regen.model.LiteralNode;
import com.regen.model.NoMatchNode;
import com.regen.model.RegexNode;
import com.regen.model.RepeatNode;
import com.regen.model.RepeatOperator;
import com.regen.model.RuneRange;
import com.regen.parser.exception.ErrorCode;
import com.regen.parser.exception.RegexSyntaxException;

/**
 * Recursive descent parser for RE2-syntax regular expressions.
 * Converts pattern text into an immutable {@link RegexNode} tree.
 *
 * Parsing only:
 * - Builds the AST
 * - Merges adjacent literal characters
 * - Reports the first syntax error as a {@link RegexSyntaxException}
 *
 * A parser instance handles a single pattern and is not reusable.
 */
public class RegexParser {
    private static final Logger log = LoggerFactory.getLogger(RegexParser.class);

    static final int MAX_REPEAT = 1000;
    static final int MAX_NESTING_DEPTH = 1000;

    private static final List<RuneRange> ANY_CHAR_RANGES = List.of(new RuneRange(0, CharClassBuilder.MAX_RUNE));
    private static final List<RuneRange> ANY_CHAR_NOT_NEWLINE_RANGES = List.of(
            new RuneRange(0, '\n' - 1), new RuneRange('\n' + 1, CharClassBuilder.MAX_RUNE));

    private final String pattern;
    private final SyntaxMode mode;
    private final int[] runes;
    private int pos = 0;

    private ParseFlags flags;
    private int captureCount = 0;
    private int depth = 0;
    private final Set<String> captureNames = new HashSet<>();

    public RegexParser(String pattern) {
        this(pattern, SyntaxMode.PERL);
    }

    public RegexParser(String pattern, SyntaxMode mode) {
        this.pattern = pattern;
        this.mode = mode;
        this.runes = pattern.codePoints().toArray();
        this.flags = ParseFlags.defaults(mode);
    }

    public RegexNode parse() {
        RegexNode node = parseAlternation();
        if (!isAtEnd()) {
            // Only an unmatched ')' stops the top-level alternation early
            throw new RegexSyntaxException(ErrorCode.UNEXPECTED_PAREN, pattern);
        }
        log.debug("Parsed regexp `{}` ({} mode, {} capture groups)", pattern, mode, captureCount);
        return node;
    }

    public int getCaptureCount() {
        return captureCount;
    }

    private RegexNode parseAlternation() {
        List<RegexNode> branches = new ArrayList<>();
        branches.add(parseConcat());
        while (check('|')) {
            advance();
            branches.add(parseConcat());
        }
        return branches.size() == 1 ? branches.get(0) : new AlternateNode(branches);
    }

    private RegexNode parseConcat() {
        List<RegexNode> items = new ArrayList<>();
        int lastRepeatStart = -1;

        while (!isAtEnd() && !check('|') && !check(')')) {
            int opEnd = repeatOperatorEnd();
            if (opEnd >= 0) {
                if (items.isEmpty()) {
                    throw new RegexSyntaxException(ErrorCode.MISSING_REPEAT_ARGUMENT, text(pos, opEnd));
                }
                if (lastRepeatStart >= 0 && mode.isPerlExtensions()) {
                    throw new RegexSyntaxException(ErrorCode.INVALID_REPEAT_OP, text(lastRepeatStart, opEnd));
                }
                int start = pos;
                RegexNode operand = items.remove(items.size() - 1);
                items.add(parseRepeat(operand, opEnd));
                lastRepeatStart = start;
                continue;
            }
            lastRepeatStart = -1;

            if (mode.isPerlExtensions() && check('\\') && peekAt(1) == 'Q') {
                parseQuoted(items);
                continue;
            }

            if (mode.isPerlExtensions() && check('(') && peekAt(1) == '?') {
                RegexNode group = parsePerlGroup();
                if (group != null) {
                    items.add(group);
                }
                continue;
            }

            items.add(parseAtom());
        }

        return concatenate(items);
    }

    private RegexNode parseAtom() {
        int c = peek();
        switch (c) {
            case '(':
                return parseCaptureGroup();
            case '[':
                return parseCharClass();
            case '.':
                advance();
                return new AnyCharNode(flags.isDotMatchesNewline());
            case '^':
                advance();
                return new AssertionNode(flags.isMultiLine() ? AssertionKind.BEGIN_LINE : AssertionKind.BEGIN_TEXT);
            case '$':
                advance();
                return new AssertionNode(flags.isMultiLine() ? AssertionKind.END_LINE : AssertionKind.END_TEXT);
            case '\\':
                return parseBackslash();
            default:
                advance();
                return literal(c);
        }
    }

    // ---- Groups ----

    private RegexNode parseCaptureGroup() {
        int start = pos;
        advance(); // (
        int index = ++captureCount;
        ParseFlags saved = flags;
        RegexNode body = parseGroupBody();
        flags = saved;
        log.trace("Parsed capture group {} at offset {}", index, start);
        return new CaptureNode(index, null, body);
    }

    /**
     * Handles everything starting with {@code (?}: named captures, flag changes and
     * non-capturing groups. Returns null when the group only changed flags.
     */
    private RegexNode parsePerlGroup() {
        int start = pos;
        pos += 2; // (?

        if (check('P') && peekAt(1) == '<') {
            pos += 2;
            return parseNamedCapture(start);
        }
        if (check('<') && peekAt(1) != '=' && peekAt(1) != '!') {
            pos += 1;
            return parseNamedCapture(start);
        }

        ParseFlags updated = flags;
        boolean negate = false;
        boolean sawFlag = false;
        while (!isAtEnd()) {
            int c = advance();
            switch (c) {
                case 'i' -> {
                    updated = updated.withFoldCase(!negate);
                    sawFlag = true;
                }
                case 'm' -> {
                    updated = updated.withMultiLine(!negate);
                    sawFlag = true;
                }
                case 's' -> {
                    updated = updated.withDotMatchesNewline(!negate);
                    sawFlag = true;
                }
                case 'U' -> {
                    updated = updated.withUngreedy(!negate);
                    sawFlag = true;
                }
                case '-' -> {
                    if (negate) {
                        throw new RegexSyntaxException(ErrorCode.INVALID_PERL_OP, text(start, pos));
                    }
                    negate = true;
                    sawFlag = false;
                }
                case ':', ')' -> {
                    if (negate && !sawFlag) {
                        throw new RegexSyntaxException(ErrorCode.INVALID_PERL_OP, text(start, pos));
                    }
                    if (c == ')') {
                        // Applies until the end of the enclosing group
                        flags = updated;
                        return null;
                    }
                    ParseFlags saved = flags;
                    flags = updated;
                    RegexNode body = parseGroupBody();
                    flags = saved;
                    return body;
                }
                default -> throw new RegexSyntaxException(ErrorCode.INVALID_PERL_OP, text(start, pos));
            }
        }
        throw new RegexSyntaxException(ErrorCode.MISSING_PAREN, pattern);
    }

    private RegexNode parseNamedCapture(int start) {
        int nameStart = pos;
        while (!isAtEnd() && peek() != '>') {
            advance();
        }
        if (isAtEnd()) {
            throw new RegexSyntaxException(ErrorCode.INVALID_NAMED_CAPTURE, text(start, runes.length));
        }
        String name = text(nameStart, pos);
        advance(); // >
        if (!isValidCaptureName(name) || !captureNames.add(name)) {
            throw new RegexSyntaxException(ErrorCode.INVALID_NAMED_CAPTURE, text(start, pos));
        }

        int index = ++captureCount;
        ParseFlags saved = flags;
        RegexNode body = parseGroupBody();
        flags = saved;
        return new CaptureNode(index, name, body);
    }

    private RegexNode parseGroupBody() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new RegexSyntaxException(ErrorCode.NESTING_DEPTH, pattern);
        }
        RegexNode body = parseAlternation();
        if (!check(')')) {
            throw new RegexSyntaxException(ErrorCode.MISSING_PAREN, pattern);
        }
        advance();
        depth--;
        return body;
    }

    private static boolean isValidCaptureName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c != '_' && !isAsciiLetterOrDigit(c)) {
                return false;
            }
        }
        return true;
    }

    // ---- Repetition ----

    /**
     * End offset of the repetition operator at the current position (without a lazy
     * {@code ?} suffix), or -1 if there is none. A {@code {} that does not start a valid
     * count is a literal, not an operator.
     */
    private int repeatOperatorEnd() {
        int c = peek();
        if (c == '*' || c == '+' || c == '?') {
            return pos + 1;
        }
        if (c == '{') {
            RepeatBounds bounds = scanRepeatBounds();
            return bounds == null ? -1 : bounds.end();
        }
        return -1;
    }

    private RegexNode parseRepeat(RegexNode operand, int opEnd) {
        int start = pos;
        int c = peek();
        RepeatBounds bounds = c == '{' ? scanRepeatBounds() : null;
        pos = opEnd;

        boolean lazy = false;
        if (mode.isPerlExtensions() && check('?')) {
            advance();
            lazy = true;
        }
        boolean greedy = lazy == flags.isUngreedy();

        switch (c) {
            case '*':
                return RepeatNode.star(operand, greedy);
            case '+':
                return RepeatNode.plus(operand, greedy);
            case '?':
                return RepeatNode.quest(operand, greedy);
            default:
                break;
        }

        int min = bounds.min();
        int max = bounds.max();
        if (min > MAX_REPEAT || max > MAX_REPEAT || (max >= 0 && max < min)) {
            throw new RegexSyntaxException(ErrorCode.INVALID_REPEAT_SIZE, text(start, opEnd));
        }
        RepeatNode repeat = RepeatNode.counted(operand, min, max, greedy);
        if (!isRepeatValid(repeat, MAX_REPEAT)) {
            throw new RegexSyntaxException(ErrorCode.INVALID_REPEAT_SIZE, text(start, opEnd));
        }
        return repeat;
    }

    /**
     * Scans {@code {n}}, {@code {n,}} or {@code {n,m}} at the current position without
     * consuming it.
     */
    private RepeatBounds scanRepeatBounds() {
        int i = pos + 1;
        int minStart = i;
        while (i < runes.length && isDigit(runes[i])) {
            i++;
        }
        int min = parseCount(minStart, i);
        if (min < 0 || i >= runes.length) {
            return null;
        }
        int max = min;
        if (runes[i] == ',') {
            i++;
            if (i < runes.length && runes[i] == '}') {
                max = RepeatNode.UNBOUNDED;
            } else {
                int maxStart = i;
                while (i < runes.length && isDigit(runes[i])) {
                    i++;
                }
                max = parseCount(maxStart, i);
                if (max < 0) {
                    return null;
                }
            }
        }
        if (i >= runes.length || runes[i] != '}') {
            return null;
        }
        return new RepeatBounds(min, max, i + 1);
    }

    /**
     * Parses a decimal count. Returns -1 for no digits or a leading zero; very large values
     * are clamped so that they fail the size check instead of overflowing.
     */
    private int parseCount(int from, int to) {
        if (from == to || (to - from > 1 && runes[from] == '0')) {
            return -1;
        }
        if (to - from > 8) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(text(from, to));
    }

    /**
     * Nested counted repetitions may not multiply past {@code limit} iterations.
     */
    private static boolean isRepeatValid(RegexNode node, int limit) {
        if (node instanceof RepeatNode repeat) {
            int n = limit;
            if (repeat.getOperator() == RepeatOperator.COUNTED) {
                int m = repeat.isUnbounded() ? repeat.getMin() : repeat.getMax();
                if (m == 0) {
                    return true;
                }
                if (m > n) {
                    return false;
                }
                n /= m;
            }
            return isRepeatValid(repeat.getSub(), n);
        }
        if (node instanceof CaptureNode capture) {
            return isRepeatValid(capture.getSub(), limit);
        }
        List<RegexNode> children = node instanceof ConcatNode concat ? concat.getChildren()
                : node instanceof AlternateNode alternate ? alternate.getChildren()
                : List.of();
        for (RegexNode child : children) {
            if (!isRepeatValid(child, limit)) {
                return false;
            }
        }
        return true;
    }

    private record RepeatBounds(int min, int max, int end) {
    }

    // ---- Escapes ----

    private RegexNode parseBackslash() {
        int next = peekAt(1);
        if (mode.isPerlExtensions()) {
            switch (next) {
                case 'A':
                    pos += 2;
                    return new AssertionNode(AssertionKind.BEGIN_TEXT);
                case 'z':
                    pos += 2;
                    return new AssertionNode(AssertionKind.END_TEXT);
                case 'b':
                    pos += 2;
                    return new AssertionNode(AssertionKind.WORD_BOUNDARY);
                case 'B':
                    pos += 2;
                    return new AssertionNode(AssertionKind.NO_WORD_BOUNDARY);
                case 'C':
                    // Any single byte in RE2; the closest character-level equivalent is any character
                    pos += 2;
                    return AnyCharNode.anyChar();
                case 'p':
                case 'P': {
                    CharClassBuilder builder = new CharClassBuilder();
                    parseUnicodeClass(builder);
                    return toClassNode(builder);
                }
                default:
                    if (UnicodeTables.isPerlClassLetter(next)) {
                        CharClassBuilder builder = new CharClassBuilder();
                        parsePerlClass(builder);
                        return toClassNode(builder);
                    }
                    break;
            }
        }
        return literal(parseEscape());
    }

    private void parseQuoted(List<RegexNode> items) {
        pos += 2; // \Q
        while (!isAtEnd()) {
            if (check('\\') && peekAt(1) == 'E') {
                pos += 2;
                return;
            }
            items.add(literal(advance()));
        }
    }

    /**
     * Parses a single-character escape at the current backslash and returns its code point.
     */
    private int parseEscape() {
        int start = pos;
        advance(); // backslash
        if (isAtEnd()) {
            throw new RegexSyntaxException(ErrorCode.TRAILING_BACKSLASH, "");
        }
        int c = advance();

        // A lone \1-\7 would be a backreference, which RE2 does not support
        if (c >= '1' && c <= '7' && (isAtEnd() || !isOctal(peek()))) {
            throw new RegexSyntaxException(ErrorCode.INVALID_ESCAPE, text(start, pos));
        }
        if (c >= '0' && c <= '7') {
            int value = c - '0';
            for (int i = 1; i < 3 && !isAtEnd() && isOctal(peek()); i++) {
                value = value * 8 + advance() - '0';
            }
            return value;
        }

        switch (c) {
            case 'x':
                return parseHexEscape(start);
            case 'a':
                return 0x07;
            case 'f':
                return '\f';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 'v':
                return 0x0B;
            default:
                if (c < 0x80 && !isAsciiLetterOrDigit(c)) {
                    return c;
                }
                throw new RegexSyntaxException(ErrorCode.INVALID_ESCAPE, text(start, pos));
        }
    }

    private int parseHexEscape(int start) {
        if (isAtEnd()) {
            throw new RegexSyntaxException(ErrorCode.INVALID_ESCAPE, text(start, pos));
        }
        if (check('{')) {
            advance();
            int digits = 0;
            long value = 0;
            while (!isAtEnd() && isHex(peek())) {
                value = value * 16 + Character.digit(advance(), 16);
                digits++;
                if (value > Character.MAX_CODE_POINT) {
                    throw new RegexSyntaxException(ErrorCode.INVALID_ESCAPE, text(start, pos));
                }
            }
            if (digits == 0 || isAtEnd() || !check('}')) {
                throw new RegexSyntaxException(ErrorCode.INVALID_ESCAPE, text(start, Math.min(pos + 1, runes.length)));
            }
            advance();
            return (int) value;
        }
        int hi = advance();
        if (isAtEnd() || !isHex(hi) || !isHex(peek())) {
            throw new RegexSyntaxException(ErrorCode.INVALID_ESCAPE, text(start, Math.min(pos + 1, runes.length)));
        }
        int lo = advance();
        return Character.digit(hi, 16) * 16 + Character.digit(lo, 16);
    }

    // ---- Character classes ----

    private RegexNode parseCharClass() {
        int start = pos;
        advance(); // [
        CharClassBuilder builder = new CharClassBuilder();

        boolean negated = false;
        if (check('^')) {
            advance();
            negated = true;
            if (!mode.isNegatedClassesMatchNewline()) {
                // Excluded once the class is negated
                builder.addRange('\n', '\n');
            }
        }

        boolean first = true;
        while (isAtEnd() || peek() != ']' || first) {
            if (isAtEnd()) {
                throw new RegexSyntaxException(ErrorCode.MISSING_BRACKET, text(start, runes.length));
            }
            // POSIX only allows an unescaped '-' first or last
            if (!mode.isPerlExtensions() && check('-') && !first && peekAt(1) != ']') {
                throw new RegexSyntaxException(ErrorCode.INVALID_CHAR_RANGE, text(pos, Math.min(pos + 2, runes.length)));
            }
            first = false;

            if (check('[') && peekAt(1) == ':' && parseNamedClass(builder)) {
                continue;
            }
            if (mode.isPerlExtensions() && check('\\') && (peekAt(1) == 'p' || peekAt(1) == 'P')) {
                parseUnicodeClass(builder);
                continue;
            }
            if (mode.isPerlExtensions() && check('\\') && UnicodeTables.isPerlClassLetter(peekAt(1))) {
                parsePerlClass(builder);
                continue;
            }

            int rangeStart = pos;
            int lo = parseClassChar(start);
            int hi = lo;
            if (check('-') && peekAt(1) != ']' && peekAt(1) != -1) {
                advance();
                hi = parseClassChar(start);
                if (hi < lo) {
                    throw new RegexSyntaxException(ErrorCode.INVALID_CHAR_RANGE, text(rangeStart, pos));
                }
            }
            addClassRange(builder, lo, hi);
        }
        advance(); // ]

        if (negated) {
            builder.negate();
        }
        return toClassNode(builder);
    }

    private int parseClassChar(int classStart) {
        if (isAtEnd()) {
            throw new RegexSyntaxException(ErrorCode.MISSING_BRACKET, text(classStart, runes.length));
        }
        if (check('\\')) {
            return parseEscape();
        }
        return advance();
    }

    /**
     * Parses {@code [:name:]} or {@code [:^name:]}. Returns false, consuming nothing, when
     * the text is not a complete bracket name, in which case {@code [} is an ordinary member.
     */
    private boolean parseNamedClass(CharClassBuilder builder) {
        int start = pos;
        int end = -1;
        for (int i = pos + 2; i + 1 < runes.length; i++) {
            if (runes[i] == ':' && runes[i + 1] == ']') {
                end = i;
                break;
            }
        }
        if (end < 0) {
            return false;
        }
        int close = end + 2;
        String name = text(start + 2, end);
        boolean negated = name.startsWith("^");
        if (negated) {
            name = name.substring(1);
        }
        List<RuneRange> ranges = UnicodeTables.posixClass(name)
                .orElseThrow(() -> new RegexSyntaxException(ErrorCode.INVALID_CHAR_RANGE, text(start, close)));
        pos = close;
        addClassRanges(builder, ranges, negated);
        return true;
    }

    /**
     * Parses {@code \pX}, {@code \p{Name}}, {@code \PX} or {@code \p{^Name}} into {@code builder}.
     */
    private void parseUnicodeClass(CharClassBuilder builder) {
        int start = pos;
        boolean negated = peekAt(1) == 'P';
        pos += 2;
        if (isAtEnd()) {
            throw new RegexSyntaxException(ErrorCode.INVALID_CHAR_RANGE, text(start, pos));
        }

        String name;
        if (check('{')) {
            int nameStart = pos + 1;
            while (!isAtEnd() && peek() != '}') {
                advance();
            }
            if (isAtEnd()) {
                throw new RegexSyntaxException(ErrorCode.INVALID_CHAR_RANGE, text(start, runes.length));
            }
            name = text(nameStart, pos);
            advance(); // }
        } else {
            name = text(pos, pos + 1);
            advance();
        }
        if (name.startsWith("^")) {
            negated = !negated;
            name = name.substring(1);
        }

        List<RuneRange> ranges = UnicodeTables.unicodeClass(name)
                .orElseThrow(() -> new RegexSyntaxException(ErrorCode.INVALID_CHAR_CLASS, text(start, pos)));
        addClassRanges(builder, ranges, negated);
    }

    private void parsePerlClass(CharClassBuilder builder) {
        int letter = peekAt(1);
        pos += 2;
        List<RuneRange> ranges = UnicodeTables.perlClass(letter).orElseThrow();
        if (Character.isUpperCase(letter)) {
            builder.addNegatedRanges(ranges);
        } else {
            builder.addRanges(ranges);
        }
    }

    private void addClassRange(CharClassBuilder builder, int lo, int hi) {
        if (flags.isFoldCase()) {
            builder.addFoldedRange(lo, hi);
        } else {
            builder.addRange(lo, hi);
        }
    }

    private void addClassRanges(CharClassBuilder builder, List<RuneRange> ranges, boolean negated) {
        if (flags.isFoldCase()) {
            CharClassBuilder folded = new CharClassBuilder().addFoldedRanges(ranges);
            ranges = folded.build().getRanges();
        }
        if (negated) {
            builder.addNegatedRanges(ranges);
        } else {
            builder.addRanges(ranges);
        }
    }

    /**
     * Builds the class node, collapsing the empty class to no-match, the full range to
     * any-char and everything but {@code \n} to any-char-except-newline.
     */
    private static RegexNode toClassNode(CharClassBuilder builder) {
        CharClassNode node = builder.build();
        List<RuneRange> ranges = node.getRanges();
        if (ranges.isEmpty()) {
            return NoMatchNode.INSTANCE;
        }
        if (ranges.equals(ANY_CHAR_RANGES)) {
            return AnyCharNode.anyChar();
        }
        if (ranges.equals(ANY_CHAR_NOT_NEWLINE_RANGES)) {
            return AnyCharNode.anyCharNotNewline();
        }
        return node;
    }

    // ---- Node helpers ----

    private LiteralNode literal(int rune) {
        return new LiteralNode(new String(Character.toChars(rune)), flags.isFoldCase());
    }

    /**
     * Builds a concatenation, merging runs of literals that share the same case handling.
     */
    private static RegexNode concatenate(List<RegexNode> items) {
        List<RegexNode> merged = new ArrayList<>();
        for (RegexNode item : items) {
            if (!merged.isEmpty()
                    && item instanceof LiteralNode literal
                    && merged.get(merged.size() - 1) instanceof LiteralNode previous
                    && previous.isFoldCase() == literal.isFoldCase()) {
                merged.set(merged.size() - 1,
                        new LiteralNode(previous.getText() + literal.getText(), literal.isFoldCase()));
            } else {
                merged.add(item);
            }
        }
        if (merged.isEmpty()) {
            return EmptyMatchNode.INSTANCE;
        }
        return merged.size() == 1 ? merged.get(0) : new ConcatNode(merged);
    }

    // ---- Cursor ----

    private boolean isAtEnd() {
        return pos >= runes.length;
    }

    private int peek() {
        return runes[pos];
    }

    private int peekAt(int offset) {
        int i = pos + offset;
        return i < runes.length ? runes[i] : -1;
    }

    private boolean check(int rune) {
        return !isAtEnd() && runes[pos] == rune;
    }

    private int advance() {
        return runes[pos++];
    }

    private String text(int from, int to) {
        return new String(runes, from, to - from);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isOctal(int c) {
        return c >= '0' && c <= '7';
    }

    private static boolean isHex(int c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAsciiLetterOrDigit(int c) {
        return isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
