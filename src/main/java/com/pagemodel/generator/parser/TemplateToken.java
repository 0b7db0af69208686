package com.pagemodel.generator.parser;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;

/**
 * Represents a token from the template tokenizer.
 */
@Data
@AllArgsConstructor
public class TemplateToken {
    private TokenType type;
    /** Tag name for tags, text for text/interpolation/comment tokens. */
    private String value;
    private List<RawAttribute> attributes;
    private boolean selfClosing;
    private int offset;

    public enum TokenType {
        START_TAG,
        END_TAG,
        TEXT,
        INTERPOLATION,
        COMMENT,
        EOF
    }

    /**
     * Attribute exactly as written; {@code value} is null for bare attributes.
     */
    @Value
    public static class RawAttribute {
        String name;
        String value;
        int offset;
    }
}
