package com.regen.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.regen.service.GeneratorResult;

/**
 * Responsible only for printing CLI output for the regen command.
 * Generated strings go to standard output; everything else is logged to standard error.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    /**
     * Writes the generated strings separated by newlines. The final newline is only added
     * for a terminal so that piped output can be consumed verbatim.
     */
    public void printOutputs(GeneratorResult result, PrintWriter out, boolean terminal) {
        out.print(String.join("\n", result.getOutputs()));
        if (terminal && !result.getOutputs().isEmpty()) {
            out.print('\n');
        }
        out.flush();

        log.debug("Patterns: {}, strings: {}, ended early: {}",
                result.getPatternsParsed(), result.getStringsGenerated(), result.getStoppedEarly());
    }

    public void printFailure(GeneratorResult result) {
        log.error(result.getErrorMessage());
    }
}
