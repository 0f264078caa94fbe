package com.regen.cli;

import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.regen.cli.exception.OptionsValidationException;
import com.regen.cli.model.GenerateOptions;
import com.regen.cli.output.GenerateResultsPrinter;
import com.regen.cli.validation.GenerateOptionsValidator;
import com.regen.service.GeneratorConfig;
import com.regen.service.GeneratorResult;
import com.regen.service.PatternBatchGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints random strings for each regular expression given.
 */
@Command(
        name = "regen",
        mixinStandardHelpOptions = true,
        version = "regen 1.0.0",
        description = "Generates random strings that match the given RE2 regular expressions, "
                + "one per line, in the order given.",
        footer = "Word boundaries (\\b, \\B) are not supported. End-of-text markers end the string early."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();
    private final BooleanSupplier terminalCheck;

    public GenerateCommand() {
        this(() -> System.console() != null);
    }

    GenerateCommand(BooleanSupplier terminalCheck) {
        this.terminalCheck = terminalCheck;
    }

    @Override
    public Integer call() {
        if (options.getPatterns().isEmpty()) {
            log.info("no regexp given");
            return 0;
        }

        GeneratorConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        try {
            GeneratorResult result = new PatternBatchGenerator(config).generate(options.getPatterns());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printOutputs(result, spec.commandLine().getOut(), terminalCheck.getAsBoolean());
            return 0;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
