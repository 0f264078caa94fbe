package com.regen.cli.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the regen command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--count", "-n" }, defaultValue = "1", paramLabel = "NUMBER",
			description = "The number of strings to generate per regexp (default: ${DEFAULT-VALUE})")
	private int count;

	@Option(names = { "--max" }, defaultValue = "32", paramLabel = "REPETITIONS",
			description = "The max repetitions to use for unlimited repetitions/matches (default: ${DEFAULT-VALUE})")
	private int maxUnboundedRepeat;

	@Option(names = { "--simplify" }, description = "Whether to simplify the parsed regular expressions. "
			+ "{m,n} repetitions become chains of zero-or-one repetitions, which gives less variance")
	private boolean simplify;

	@Option(names = { "--posix" }, description = "Use POSIX syntax instead of Perl-like syntax")
	private boolean posix;

	@Option(names = { "--zip" }, description = "Whether to interleave patterns or go pattern by pattern")
	private boolean zip;

	@Option(names = { "--seed" }, description = "Seed for reproducible output (default: secure random)")
	private Long seed;

	@Option(names = { "--verbose", "-v" }, description = "Log the parsed form of every regexp to stderr")
	private boolean verbose;

	@Parameters(paramLabel = "PATTERN", arity = "0..*",
			description = "RE2 regular expression, see https://github.com/google/re2/wiki/Syntax")
	private List<String> patterns = new ArrayList<>();
}
