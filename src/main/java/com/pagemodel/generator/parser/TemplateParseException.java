package com.pagemodel.generator.parser;

import com.pagemodel.generator.model.SourceLocation;

import lombok.Getter;

/**
 * Unrecoverable template syntax error.
 */
@Getter
public class TemplateParseException extends RuntimeException {

    private final String fileName;
    private final SourceLocation location;

    public TemplateParseException(String message, String fileName, SourceLocation location) {
        super(fileName + ":" + location + ": " + message);
        this.fileName = fileName;
        this.location = location;
    }
}
