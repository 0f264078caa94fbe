package com.regen.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.regen.cli.exception.OptionsValidationException;
import com.regen.cli.model.GenerateOptions;
import com.regen.parser.SyntaxMode;
import com.regen.service.GeneratorConfig;

public class GenerateOptionsValidator {

	/** Upper limit for {@code --max}. */
	public static final int MAX_REPETITIONS = 1_000_000;

	public GeneratorConfig validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getCount() < 0) {
			errors.add("Count must be >= 0 (--count / -n). Got: " + o.getCount());
		}
		if (o.getMaxUnboundedRepeat() <= 0) {
			errors.add("Max repetitions must be > 0 (--max). Got: " + o.getMaxUnboundedRepeat());
		} else if (o.getMaxUnboundedRepeat() > MAX_REPETITIONS) {
			errors.add("Max repetitions must be <= " + MAX_REPETITIONS + " (--max). Got: " + o.getMaxUnboundedRepeat());
		}
		if (o.getPatterns().isEmpty()) {
			errors.add("At least one regexp is required.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return GeneratorConfig.builder()
				.count(o.getCount())
				.maxUnboundedRepeat(o.getMaxUnboundedRepeat())
				.syntaxMode(o.isPosix() ? SyntaxMode.POSIX : SyntaxMode.PERL)
				.simplify(o.isSimplify())
				.zip(o.isZip())
				.seed(o.getSeed())
				.verbose(o.isVerbose())
				.build();
	}
}
