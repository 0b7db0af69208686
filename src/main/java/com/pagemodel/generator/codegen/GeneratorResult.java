package com.pagemodel.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generator run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    /** Unit whose compilation failed, if any. */
    private String failingUnit;
    private Path outputPath;

    private int componentsScanned;
    private int unitsCompiled;
    private int viewsCompiled;
    private int identifiersGenerated;
    private int identifiersPreserved;
    private int primaryMembers;
    private int extraMethods;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult unitFailure(String unitName, String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failingUnit(unitName)
                .build();
    }
}
