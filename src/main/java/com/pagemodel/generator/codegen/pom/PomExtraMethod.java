package com.pagemodel.generator.codegen.pom;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Member outside the one element to one member mapping, e.g. one method per enumerated
 * option of a radio group.
 */
@Value
@Builder(toBuilder = true)
public class PomExtraMethod {
    @Builder.Default
    String kind = "click";
    String name;
    /** Selector pattern, possibly holding a {@code ${key}} or {@code ${value}} placeholder. */
    String pattern;
    /** Fixed key substituted into the pattern, or null. */
    String keyLiteral;
    @Singular
    List<PomParameter> parameters;

    public MethodSignature signature() {
        return new MethodSignature(parameters);
    }

    /**
     * De-duplication key: kind, pattern, key literal and sorted parameters. The name is left
     * out so repeated passes cannot mint new names for the same method.
     */
    public String structuralKey() {
        return String.join("|", kind, pattern, String.valueOf(keyLiteral), PomSpec.sortedParameters(parameters));
    }
}
