package com.regen.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;

import com.regen.model.RuneRange;

import lombok.experimental.UtilityClass;

/**
 * Named character classes: Perl escapes ({@code \d \s \w}), POSIX bracket names
 * ({@code [:alpha:]}) and Unicode general categories and scripts ({@code \pL}, {@code \p{Greek}}).
 */
@UtilityClass
public class UnicodeTables {

    private static final Map<Integer, List<RuneRange>> PERL_CLASSES = Map.of(
            (int) 'd', List.of(new RuneRange('0', '9')),
            (int) 's', List.of(new RuneRange('\t', '\n'), new RuneRange('\f', '\r'), RuneRange.single(' ')),
            (int) 'w', List.of(new RuneRange('0', '9'), new RuneRange('A', 'Z'), RuneRange.single('_'),
                    new RuneRange('a', 'z'))
    );

    private static final Map<String, List<RuneRange>> POSIX_CLASSES = Map.ofEntries(
            Map.entry("alnum", List.of(new RuneRange('0', '9'), new RuneRange('A', 'Z'), new RuneRange('a', 'z'))),
            Map.entry("alpha", List.of(new RuneRange('A', 'Z'), new RuneRange('a', 'z'))),
            Map.entry("ascii", List.of(new RuneRange(0x00, 0x7F))),
            Map.entry("blank", List.of(RuneRange.single('\t'), RuneRange.single(' '))),
            Map.entry("cntrl", List.of(new RuneRange(0x00, 0x1F), RuneRange.single(0x7F))),
            Map.entry("digit", List.of(new RuneRange('0', '9'))),
            Map.entry("graph", List.of(new RuneRange('!', '~'))),
            Map.entry("lower", List.of(new RuneRange('a', 'z'))),
            Map.entry("print", List.of(new RuneRange(' ', '~'))),
            Map.entry("punct", List.of(new RuneRange('!', '/'), new RuneRange(':', '@'), new RuneRange('[', '`'),
                    new RuneRange('{', '~'))),
            Map.entry("space", List.of(new RuneRange('\t', '\r'), RuneRange.single(' '))),
            Map.entry("upper", List.of(new RuneRange('A', 'Z'))),
            Map.entry("word", List.of(new RuneRange('0', '9'), new RuneRange('A', 'Z'), RuneRange.single('_'),
                    new RuneRange('a', 'z'))),
            Map.entry("xdigit", List.of(new RuneRange('0', '9'), new RuneRange('A', 'F'), new RuneRange('a', 'f')))
    );

    private static final Map<String, byte[]> CATEGORIES = Map.ofEntries(
            Map.entry("L", new byte[] {Character.UPPERCASE_LETTER, Character.LOWERCASE_LETTER,
                    Character.TITLECASE_LETTER, Character.MODIFIER_LETTER, Character.OTHER_LETTER}),
            Map.entry("Lu", new byte[] {Character.UPPERCASE_LETTER}),
            Map.entry("Ll", new byte[] {Character.LOWERCASE_LETTER}),
            Map.entry("Lt", new byte[] {Character.TITLECASE_LETTER}),
            Map.entry("Lm", new byte[] {Character.MODIFIER_LETTER}),
            Map.entry("Lo", new byte[] {Character.OTHER_LETTER}),
            Map.entry("M", new byte[] {Character.NON_SPACING_MARK, Character.COMBINING_SPACING_MARK,
                    Character.ENCLOSING_MARK}),
            Map.entry("Mn", new byte[] {Character.NON_SPACING_MARK}),
            Map.entry("Mc", new byte[] {Character.COMBINING_SPACING_MARK}),
            Map.entry("Me", new byte[] {Character.ENCLOSING_MARK}),
            Map.entry("N", new byte[] {Character.DECIMAL_DIGIT_NUMBER, Character.LETTER_NUMBER,
                    Character.OTHER_NUMBER}),
            Map.entry("Nd", new byte[] {Character.DECIMAL_DIGIT_NUMBER}),
            Map.entry("Nl", new byte[] {Character.LETTER_NUMBER}),
            Map.entry("No", new byte[] {Character.OTHER_NUMBER}),
            Map.entry("P", new byte[] {Character.CONNECTOR_PUNCTUATION, Character.DASH_PUNCTUATION,
                    Character.START_PUNCTUATION, Character.END_PUNCTUATION, Character.INITIAL_QUOTE_PUNCTUATION,
                    Character.FINAL_QUOTE_PUNCTUATION, Character.OTHER_PUNCTUATION}),
            Map.entry("Pc", new byte[] {Character.CONNECTOR_PUNCTUATION}),
            Map.entry("Pd", new byte[] {Character.DASH_PUNCTUATION}),
            Map.entry("Ps", new byte[] {Character.START_PUNCTUATION}),
            Map.entry("Pe", new byte[] {Character.END_PUNCTUATION}),
            Map.entry("Pi", new byte[] {Character.INITIAL_QUOTE_PUNCTUATION}),
            Map.entry("Pf", new byte[] {Character.FINAL_QUOTE_PUNCTUATION}),
            Map.entry("Po", new byte[] {Character.OTHER_PUNCTUATION}),
            Map.entry("S", new byte[] {Character.MATH_SYMBOL, Character.CURRENCY_SYMBOL,
                    Character.MODIFIER_SYMBOL, Character.OTHER_SYMBOL}),
            Map.entry("Sm", new byte[] {Character.MATH_SYMBOL}),
            Map.entry("Sc", new byte[] {Character.CURRENCY_SYMBOL}),
            Map.entry("Sk", new byte[] {Character.MODIFIER_SYMBOL}),
            Map.entry("So", new byte[] {Character.OTHER_SYMBOL}),
            Map.entry("Z", new byte[] {Character.SPACE_SEPARATOR, Character.LINE_SEPARATOR,
                    Character.PARAGRAPH_SEPARATOR}),
            Map.entry("Zs", new byte[] {Character.SPACE_SEPARATOR}),
            Map.entry("Zl", new byte[] {Character.LINE_SEPARATOR}),
            Map.entry("Zp", new byte[] {Character.PARAGRAPH_SEPARATOR}),
            Map.entry("C", new byte[] {Character.CONTROL, Character.FORMAT, Character.SURROGATE,
                    Character.PRIVATE_USE}),
            Map.entry("Cc", new byte[] {Character.CONTROL}),
            Map.entry("Cf", new byte[] {Character.FORMAT}),
            Map.entry("Cs", new byte[] {Character.SURROGATE}),
            Map.entry("Co", new byte[] {Character.PRIVATE_USE})
    );

    // Scanning every code point is slow enough that each table is built once
    private static final Map<String, List<RuneRange>> UNICODE_CACHE = new ConcurrentHashMap<>();

    /**
     * Ranges for a Perl class letter ({@code d}, {@code s} or {@code w}), ignoring case.
     */
    public static Optional<List<RuneRange>> perlClass(int letter) {
        return Optional.ofNullable(PERL_CLASSES.get(Character.toLowerCase(letter)));
    }

    public static boolean isPerlClassLetter(int letter) {
        return PERL_CLASSES.containsKey(Character.toLowerCase(letter));
    }

    public static Optional<List<RuneRange>> posixClass(String name) {
        return Optional.ofNullable(POSIX_CLASSES.get(name));
    }

    /**
     * Ranges for a Unicode general category ({@code L}, {@code Nd}, ...), a script known to
     * {@link Character.UnicodeScript}, or {@code Any}.
     */
    public static Optional<List<RuneRange>> unicodeClass(String name) {
        if ("Any".equals(name)) {
            return Optional.of(List.of(new RuneRange(0, Character.MAX_CODE_POINT)));
        }
        IntPredicate predicate = categoryPredicate(name);
        if (predicate == null) {
            predicate = scriptPredicate(name);
        }
        if (predicate == null) {
            return Optional.empty();
        }
        IntPredicate members = predicate;
        return Optional.of(UNICODE_CACHE.computeIfAbsent(name, key -> scan(members)));
    }

    private static IntPredicate categoryPredicate(String name) {
        byte[] types = CATEGORIES.get(name);
        if (types == null) {
            return null;
        }
        return rune -> {
            int type = Character.getType(rune);
            for (byte t : types) {
                if (t == type) {
                    return true;
                }
            }
            return false;
        };
    }

    private static IntPredicate scriptPredicate(String name) {
        Character.UnicodeScript script;
        try {
            script = Character.UnicodeScript.forName(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
        return rune -> Character.UnicodeScript.of(rune) == script;
    }

    private static List<RuneRange> scan(IntPredicate members) {
        List<RuneRange> ranges = new ArrayList<>();
        int start = -1;
        for (int rune = 0; rune <= Character.MAX_CODE_POINT; rune++) {
            boolean member = members.test(rune);
            if (member && start < 0) {
                start = rune;
            } else if (!member && start >= 0) {
                ranges.add(new RuneRange(start, rune - 1));
                start = -1;
            }
        }
        if (start >= 0) {
            ranges.add(new RuneRange(start, Character.MAX_CODE_POINT));
        }
        return List.copyOf(ranges);
    }
}
