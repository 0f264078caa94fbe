package com.regen.service;

import com.regen.generator.RegexStringGenerator;
import com.regen.parser.SyntaxMode;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for a batch generation run.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    /** Extra iterations allowed for {@code *}, {@code +} and {@code {n,}}. */
    @Builder.Default
    int maxUnboundedRepeat = RegexStringGenerator.DEFAULT_MAX_UNBOUNDED_REPEAT;

    /** Number of strings to generate per pattern. */
    @Builder.Default
    int count = 1;

    @Builder.Default
    SyntaxMode syntaxMode = SyntaxMode.PERL;

    /** Rewrite counted repetitions before generating. */
    boolean simplify;

    /** Interleave patterns instead of finishing one pattern before the next. */
    boolean zip;

    /** Seed for reproducible output; null selects a secure random source. */
    Long seed;

    /** Log the parsed tree of every pattern. */
    boolean verbose;
}
