package com.pagemodel.generator.expression;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the expression tokenizer.
 */
@Data
@AllArgsConstructor
public class ExpressionToken {
    private TokenType type;
    private String value;
    private int position;
    /** True when at least one line break separates this token from the previous one. */
    private boolean newlineBefore;

    public enum TokenType {
        IDENTIFIER,
        NUMBER,
        STRING,
        TEMPLATE,
        PUNCTUATOR,
        EOF
    }

    public boolean is(TokenType expected, String text) {
        return type == expected && value.equals(text);
    }

    public boolean isPunctuator(String text) {
        return is(TokenType.PUNCTUATOR, text);
    }

    public boolean isIdentifier(String text) {
        return is(TokenType.IDENTIFIER, text);
    }
}
