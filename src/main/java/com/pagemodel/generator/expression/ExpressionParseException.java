package com.pagemodel.generator.expression;

import lombok.Getter;

/**
 * Raised when expression source text falls outside the supported grammar.
 */
@Getter
public class ExpressionParseException extends RuntimeException {

    private final int position;

    public ExpressionParseException(String message, int position) {
        super(message + " at offset " + position);
        this.position = position;
    }
}
