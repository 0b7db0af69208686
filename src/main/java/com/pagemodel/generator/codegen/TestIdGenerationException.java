package com.pagemodel.generator.codegen;

import com.pagemodel.generator.model.SourceLocation;

import lombok.Getter;

/**
 * Fatal error while synthesizing identifiers for a unit. The message always names the unit,
 * the source location and a remediation.
 */
@Getter
public class TestIdGenerationException extends RuntimeException {

    public enum Kind {
        EXISTING_ID_FORBIDDEN,
        EXISTING_ID_NOT_PRESERVABLE,
        SUBMIT_WITHOUT_IDENTITY,
        NAME_COLLISION
    }

    private final Kind kind;
    private final String unitName;
    private final String fileName;
    private final SourceLocation location;

    public TestIdGenerationException(Kind kind, String unitName, String fileName, SourceLocation location,
                                     String message) {
        super(message);
        this.kind = kind;
        this.unitName = unitName;
        this.fileName = fileName;
        this.location = location;
    }
}
