package com.regen.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.regen.generator.GenerationResult;
import com.regen.generator.RegexStringGenerator;
import com.regen.generator.exception.GenerationException;
import com.regen.model.RegexNode;
import com.regen.parser.RegexParser;
import com.regen.parser.RegexPrinter;
import com.regen.parser.RegexSimplifier;
import com.regen.parser.exception.RegexSyntaxException;
import com.regen.random.RandomSelector;
import com.regen.random.RandomSelectors;

/**
 * Parses a list of patterns and generates {@code count} strings for each of them.
 *
 * All patterns are parsed before any string is generated, so a syntax error in the last
 * pattern fails the run without producing output. A fatal generation error also fails the
 * run and discards the strings generated so far.
 */
public class PatternBatchGenerator {
    private static final Logger log = LoggerFactory.getLogger(PatternBatchGenerator.class);

    private final GeneratorConfig config;
    private final RandomSelector selector;
    private final RegexStringGenerator generator;
    private final RegexPrinter printer = new RegexPrinter();

    public PatternBatchGenerator(GeneratorConfig config) {
        this(config, RandomSelectors.forSeed(config.getSeed()));
    }

    public PatternBatchGenerator(GeneratorConfig config, RandomSelector selector) {
        this.config = config;
        this.selector = selector;
        this.generator = new RegexStringGenerator(selector);
    }

    public GeneratorResult generate(List<String> patterns) {
        log.debug("Generating {} string(s) for {} pattern(s) using {}", config.getCount(), patterns.size(), selector);

        List<CompiledPattern> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                compiled.add(compile(pattern));
            } catch (RegexSyntaxException e) {
                return GeneratorResult.failure(pattern,
                        "error parsing regular expression \"" + pattern + "\":" + System.lineSeparator() + e.getMessage());
            }
        }

        GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                .success(true)
                .patternsParsed(compiled.size());
        int generated = 0;
        int stopped = 0;

        long total = (long) compiled.size() * config.getCount();
        for (long k = 0; k < total; k++) {
            CompiledPattern pattern = patternAt(compiled, k);
            StringBuilder output = new StringBuilder();
            try {
                if (generator.generate(pattern.root(), output, config.getMaxUnboundedRepeat()) == GenerationResult.STOP) {
                    stopped++;
                }
            } catch (GenerationException e) {
                log.debug("Generation failed for `{}` after {} characters", pattern.source(), output.length());
                return GeneratorResult.failure(pattern.source(), "Error generating string: " + e.getMessage());
            }
            result.output(output.toString());
            generated++;
        }

        log.debug("Generated {} string(s), {} ended early", generated, stopped);
        return result.stringsGenerated(generated).stoppedEarly(stopped).build();
    }

    private CompiledPattern compile(String pattern) {
        RegexNode root = new RegexParser(pattern, config.getSyntaxMode()).parse();
        if (config.isSimplify()) {
            root = new RegexSimplifier().simplify(root);
        }
        if (config.isVerbose()) {
            log.info("{} => {}", pattern, printer.print(root));
        }
        return new CompiledPattern(pattern, root);
    }

    /**
     * The pattern for the {@code k}-th string: pattern-by-pattern by default, round-robin
     * across patterns when zipping.
     */
    private CompiledPattern patternAt(List<CompiledPattern> compiled, long k) {
        if (config.isZip()) {
            return compiled.get((int) (k % compiled.size()));
        }
        return compiled.get((int) (k / config.getCount()));
    }

    private record CompiledPattern(String source, RegexNode root) {
    }
}
