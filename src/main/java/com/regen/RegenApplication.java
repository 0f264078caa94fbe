package com.regen;

import com.regen.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for regen.
 * Generates random strings that match the regular expressions given on the command line.
 */
public class RegenApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
