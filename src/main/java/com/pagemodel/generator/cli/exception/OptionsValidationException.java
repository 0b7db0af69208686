package com.pagemodel.generator.cli.exception;

import java.util.List;

/**
 * Raised by the generate command's option validation. Carries every problem found in the
 * source directories, mapping files and output location, one message per problem.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
