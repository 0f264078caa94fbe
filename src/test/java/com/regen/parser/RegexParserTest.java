package com.regen.parser;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.regen.model.AlternateNode;
import com.regen.model.AnyCharNode;
import com.regen.model.AssertionKind;
import com.regen.model.AssertionNode;
import com.regen.model.CaptureNode;
import com.regen.model.CharClassNode;
import com.regen.model.ConcatNode;
import com.regen.model.EmptyMatchNode;
import com.regen.model.LiteralNode;
import com.regen.model.RegexNode;
import com.regen.model.RepeatNode;
import com.regen.model.RuneRange;
import com.regen.parser.exception.ErrorCode;
import com.regen.parser.exception.RegexSyntaxException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RegexParser.
 */
class RegexParserTest {

    private static final int MAX = CharClassBuilder.MAX_RUNE;
    private static final CharClassNode DIGITS = new CharClassNode(List.of(new RuneRange('0', '9')));

    private static RegexNode parse(String pattern) {
        return new RegexParser(pattern).parse();
    }

    private static RegexNode parsePosix(String pattern) {
        return new RegexParser(pattern, SyntaxMode.POSIX).parse();
    }

    private static LiteralNode lit(String text) {
        return LiteralNode.of(text);
    }

    private static AssertionNode anchor(AssertionKind kind) {
        return new AssertionNode(kind);
    }

    @Test
    void testAdjacentLiteralsAreMerged() {
        assertThat(parse("abc")).isEqualTo(lit("abc"));
    }

    @Test
    void testEmptyPatternIsEmptyMatch() {
        assertThat(parse("")).isSameAs(EmptyMatchNode.INSTANCE);
    }

    @Test
    void testAlternationKeepsBranchOrder() {
        assertThat(parse("a|bc|d")).isEqualTo(new AlternateNode(List.of(lit("a"), lit("bc"), lit("d"))));
        assertThat(parse("a|")).isEqualTo(new AlternateNode(List.of(lit("a"), EmptyMatchNode.INSTANCE)));
    }

    @Test
    void testRepeatBindsToPrecedingAtom() {
        assertThat(parse("ab*")).isEqualTo(new ConcatNode(List.of(lit("a"), RepeatNode.star(lit("b"), true))));
    }

    @Test
    void testCaptureGroupsAreNumbered() {
        RegexParser parser = new RegexParser("(ab)+(c)");

        RegexNode root = parser.parse();

        assertThat(root).isEqualTo(new ConcatNode(List.of(
                RepeatNode.plus(new CaptureNode(1, null, lit("ab")), true),
                new CaptureNode(2, null, lit("c")))));
        assertThat(parser.getCaptureCount()).isEqualTo(2);
    }

    @Test
    void testNamedCaptures() {
        RegexNode root = parse("(?P<year>\\d{4})-(?<month>\\d\\d)");

        assertThat(root).isEqualTo(new ConcatNode(List.of(
                new CaptureNode(1, "year", RepeatNode.counted(DIGITS, 4, 4, true)),
                lit("-"),
                new CaptureNode(2, "month", new ConcatNode(List.of(DIGITS, DIGITS))))));
    }

    @Test
    void testNonCapturingGroupAndEmptyGroup() {
        assertThat(parse("(?:ab)*?")).isEqualTo(RepeatNode.star(lit("ab"), false));
        assertThat(parse("()")).isEqualTo(new CaptureNode(1, null, EmptyMatchNode.INSTANCE));
    }

    @ParameterizedTest
    @CsvSource({
            "'x{2,4}', 2, 4",
            "'x{3}', 3, 3",
            "'x{2,}', 2, -1",
            "'x{0}', 0, 0"
    })
    void testCountedRepeats(String pattern, int min, int max) {
        assertThat(parse(pattern)).isEqualTo(RepeatNode.counted(lit("x"), min, max, true));
    }

    @ParameterizedTest
    @CsvSource({
            "'x{,3}'",
            "'a{'",
            "'a{1,2'",
            "'a{x}'"
    })
    void testInvalidBraceIsLiteral(String pattern) {
        assertThat(parse(pattern)).isEqualTo(lit(pattern));
    }

    @Test
    void testUngreedyFlagSwapsLaziness() {
        assertThat(parse("(?U)a*")).isEqualTo(RepeatNode.star(lit("a"), false));
        assertThat(parse("(?U)a*?")).isEqualTo(RepeatNode.star(lit("a"), true));
    }

    @Test
    void testCharClassRangesAreNormalized() {
        assertThat(parse("[x-za-cb]")).isEqualTo(new CharClassNode(List.of(
                new RuneRange('a', 'c'), new RuneRange('x', 'z'))));
    }

    @Test
    void testCloseBracketFirstAndDashLastAreMembers() {
        assertThat(parse("[]a]")).isEqualTo(new CharClassNode(List.of(
                RuneRange.single(']'), RuneRange.single('a'))));
        assertThat(parse("[a-]")).isEqualTo(new CharClassNode(List.of(
                RuneRange.single('-'), RuneRange.single('a'))));
    }

    @Test
    void testNegatedClassInPerlModeIncludesNewline() {
        assertThat(parse("[^a]")).isEqualTo(new CharClassNode(List.of(
                new RuneRange(0, 'a' - 1), new RuneRange('a' + 1, MAX))));
    }

    @Test
    void testNegatedClassInPosixModeExcludesNewline() {
        assertThat(parsePosix("[^a]")).isEqualTo(new CharClassNode(List.of(
                new RuneRange(0, '\n' - 1), new RuneRange('\n' + 1, 'a' - 1), new RuneRange('a' + 1, MAX))));
    }

    @Test
    void testPerlClasses() {
        assertThat(parse("\\d")).isEqualTo(DIGITS);
        assertThat(parse("\\D")).isEqualTo(new CharClassNode(List.of(
                new RuneRange(0, '0' - 1), new RuneRange('9' + 1, MAX))));
        assertThat(parse("[\\d\\s]")).isEqualTo(new CharClassNode(List.of(
                new RuneRange('\t', '\n'), new RuneRange('\f', '\r'), RuneRange.single(' '),
                new RuneRange('0', '9'))));
    }

    @Test
    void testPosixNamedClasses() {
        assertThat(parse("[[:alpha:]]")).isEqualTo(new CharClassNode(List.of(
                new RuneRange('A', 'Z'), new RuneRange('a', 'z'))));
        assertThat(parse("[[:^digit:]x]")).isEqualTo(parse("[^0-9]"));
    }

    @Test
    void testUnicodeClasses() {
        CharClassNode letters = (CharClassNode) parse("\\pL");
        assertThat(letters.contains('a')).isTrue();
        assertThat(letters.contains(0x416)).isTrue();
        assertThat(letters.contains('1')).isFalse();

        CharClassNode notLetters = (CharClassNode) parse("\\PL");
        assertThat(notLetters.contains('a')).isFalse();
        assertThat(notLetters.contains('1')).isTrue();

        CharClassNode greek = (CharClassNode) parse("\\p{Greek}");
        assertThat(greek.contains(0x3B1)).isTrue();
        assertThat(greek.contains('a')).isFalse();

        CharClassNode notGreek = (CharClassNode) parse("\\p{^Greek}");
        assertThat(notGreek.contains('a')).isTrue();
    }

    @Test
    void testFoldCaseOnLiteralsAndClasses() {
        assertThat(parse("(?i)ab")).isEqualTo(new LiteralNode("ab", true));
        assertThat(parse("(?i)a(?-i)b")).isEqualTo(new ConcatNode(List.of(
                new LiteralNode("a", true), new LiteralNode("b", false))));
        assertThat(parse("(?i)[a-c]")).isEqualTo(new CharClassNode(List.of(
                new RuneRange('A', 'C'), new RuneRange('a', 'c'))));
    }

    @Test
    void testFlagsAreScopedToTheirGroup() {
        assertThat(parse("(?i:a)b")).isEqualTo(new ConcatNode(List.of(
                new LiteralNode("a", true), new LiteralNode("b", false))));
        assertThat(parse("((?i)a)b")).isEqualTo(new ConcatNode(List.of(
                new CaptureNode(1, null, new LiteralNode("a", true)), new LiteralNode("b", false))));
    }

    @Test
    void testDot() {
        assertThat(parse(".")).isEqualTo(AnyCharNode.anyCharNotNewline());
        assertThat(parse("(?s).")).isEqualTo(AnyCharNode.anyChar());
        assertThat(parse("\\C")).isEqualTo(AnyCharNode.anyChar());
    }

    @ParameterizedTest
    @CsvSource({
            "'[\\s\\S]'",
            "'[\\x00-\\x{10FFFF}]'",
            "'[\\d\\D]'",
            "'\\p{Any}'"
    })
    void testFullRangeClassIsAnyChar(String pattern) {
        assertThat(parse(pattern)).isEqualTo(AnyCharNode.anyChar());
    }

    @Test
    void testClassOfAllButNewlineIsAnyCharNotNewline() {
        assertThat(parse("[^\\n]")).isEqualTo(AnyCharNode.anyCharNotNewline());
        assertThat(parsePosix("[^\\n]")).isEqualTo(AnyCharNode.anyCharNotNewline());
        assertThat(parsePosix("[^a]")).isInstanceOf(CharClassNode.class);
    }

    @Test
    void testAnchorsInPerlModeMatchText() {
        assertThat(parse("^a$")).isEqualTo(new ConcatNode(List.of(
                anchor(AssertionKind.BEGIN_TEXT), lit("a"), anchor(AssertionKind.END_TEXT))));
        assertThat(parse("\\Aa\\z")).isEqualTo(parse("^a$"));
    }

    @Test
    void testAnchorsMatchLinesUnderMultiLineOrPosix() {
        RegexNode lines = new ConcatNode(List.of(
                anchor(AssertionKind.BEGIN_LINE), lit("a"), anchor(AssertionKind.END_LINE)));

        assertThat(parse("(?m)^a$")).isEqualTo(lines);
        assertThat(parsePosix("^a$")).isEqualTo(lines);
    }

    @Test
    void testWordBoundaries() {
        assertThat(parse("\\bfoo\\B")).isEqualTo(new ConcatNode(List.of(
                anchor(AssertionKind.WORD_BOUNDARY), lit("foo"), anchor(AssertionKind.NO_WORD_BOUNDARY))));
    }

    @Test
    void testEscapes() {
        assertThat(parse("\\x41\\x{1F600}\\101\\0")).isEqualTo(lit("A😀A\0"));
        assertThat(parse("\\n\\t\\.\\*")).isEqualTo(lit("\n\t.*"));
        assertThat(parse("[\\x{41}-\\x43]")).isEqualTo(new CharClassNode(List.of(new RuneRange('A', 'C'))));
    }

    @Test
    void testQuotedText() {
        assertThat(parse("\\Qa.b*\\E+")).isEqualTo(new ConcatNode(List.of(
                lit("a.b"), RepeatNode.plus(lit("*"), true))));
        assertThat(parse("\\Q(unterminated")).isEqualTo(lit("(unterminated"));
    }

    @Test
    void testSupplementaryCharactersAreSingleAtoms() {
        assertThat(parse("😀+")).isEqualTo(RepeatNode.plus(lit("😀"), true));
    }

    @Test
    void testPosixModeAllowsStackedRepeats() {
        assertThat(parsePosix("a**")).isEqualTo(RepeatNode.star(RepeatNode.star(lit("a"), true), true));
        assertThat(parsePosix("a*?")).isEqualTo(RepeatNode.quest(RepeatNode.star(lit("a"), true), true));
    }

    @Test
    void testFlagOnlyGroupLeavesPreviousAtomRepeatable() {
        assertThat(parse("a(?i)*")).isEqualTo(RepeatNode.star(lit("a"), true));
        assertThatThrownBy(() -> parse("(?i)*"))
                .isInstanceOfSatisfying(RegexSyntaxException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.MISSING_REPEAT_ARGUMENT));
    }

    @Test
    void testPerlModeLazyRepeat() {
        assertThat(parse("a*?")).isEqualTo(RepeatNode.star(lit("a"), false));
    }

    @ParameterizedTest
    @CsvSource({
            "'(a',            MISSING_PAREN,           '(a'",
            "'(?:a',          MISSING_PAREN,           '(?:a'",
            "'a)',            UNEXPECTED_PAREN,        'a)'",
            "'[a',            MISSING_BRACKET,         '[a'",
            "'a\\',           TRAILING_BACKSLASH,      ''",
            "'\\8',           INVALID_ESCAPE,          '\\8'",
            "'\\1',           INVALID_ESCAPE,          '\\1'",
            "'\\q',           INVALID_ESCAPE,          '\\q'",
            "'\\x{110000}',   INVALID_ESCAPE,          '\\x{110000'",
            "'[z-a]',         INVALID_CHAR_RANGE,      'z-a'",
            "'[[:foo:]]',     INVALID_CHAR_RANGE,      '[:foo:]'",
            "'\\p{Foo}',      INVALID_CHAR_CLASS,      '\\p{Foo}'",
            "'(?x)',          INVALID_PERL_OP,         '(?x'",
            "'(?i-)',         INVALID_PERL_OP,         '(?i-)'",
            "'(?P<a-b>x)',    INVALID_NAMED_CAPTURE,   '(?P<a-b>'",
            "'(?P<n>a)(?P<n>b)', INVALID_NAMED_CAPTURE, '(?P<n>'",
            "'a**',           INVALID_REPEAT_OP,       '**'",
            "'a+*?',          INVALID_REPEAT_OP,       '+*'",
            "'*a',            MISSING_REPEAT_ARGUMENT, '*'",
            "'{2}',           MISSING_REPEAT_ARGUMENT, '{2}'",
            "'(|+)',          MISSING_REPEAT_ARGUMENT, '+'",
            "'a{1001}',       INVALID_REPEAT_SIZE,     '{1001}'",
            "'a{3,2}',        INVALID_REPEAT_SIZE,     '{3,2}'",
            "'(a{500}){3}',   INVALID_REPEAT_SIZE,     '{3}'"
    })
    void testSyntaxErrors(String pattern, ErrorCode code, String expression) {
        assertThatThrownBy(() -> parse(pattern))
                .isInstanceOfSatisfying(RegexSyntaxException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(code);
                    assertThat(e.getExpression()).isEqualTo(expression);
                });
    }

    @ParameterizedTest
    @CsvSource({
            "'\\d',      INVALID_ESCAPE",
            "'(?i)a',    MISSING_REPEAT_ARGUMENT",
            "'[a-b-c]',  INVALID_CHAR_RANGE"
    })
    void testPosixModeRejectsPerlExtensions(String pattern, ErrorCode code) {
        assertThatThrownBy(() -> parsePosix(pattern))
                .isInstanceOfSatisfying(RegexSyntaxException.class, e -> assertThat(e.getCode()).isEqualTo(code));
    }

    @Test
    void testErrorMessageFormat() {
        assertThatThrownBy(() -> parse("a)"))
                .isInstanceOf(RegexSyntaxException.class)
                .hasMessage("error parsing regexp: unexpected ): `a)`");
    }

    @Test
    void testNestingDepthIsLimited() {
        String deep = "(".repeat(RegexParser.MAX_NESTING_DEPTH + 1) + ")".repeat(RegexParser.MAX_NESTING_DEPTH + 1);
        String allowed = "(".repeat(RegexParser.MAX_NESTING_DEPTH) + ")".repeat(RegexParser.MAX_NESTING_DEPTH);

        assertThatThrownBy(() -> parse(deep))
                .isInstanceOfSatisfying(RegexSyntaxException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NESTING_DEPTH));
        assertThatCode(() -> parse(allowed)).doesNotThrowAnyException();
    }
}
