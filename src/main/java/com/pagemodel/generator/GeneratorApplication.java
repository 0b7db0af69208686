package com.pagemodel.generator;

import com.pagemodel.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the page-object test id generator.
 * This CLI tool assigns stable automation identifiers to the interactive elements of Vue
 * single-file components and derives the members of a typed page-object API for them.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
