package com.pagemodel.generator.model;

import lombok.Value;

/**
 * Position of a node in its source file; line and column are 1-based.
 */
@Value
public class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, -1);

    int line;
    int column;
    int offset;

    public boolean isKnown() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "unknown";
    }
}
