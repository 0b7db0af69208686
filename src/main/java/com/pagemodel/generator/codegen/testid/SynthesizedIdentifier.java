package com.pagemodel.generator.codegen.testid;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one synthesis category: the identifier plus the naming signals that go with it.
 */
@Value
@Builder
public class SynthesizedIdentifier {
    IdentifierValue identifier;
    /** Semantic hint for member names; may be null. */
    String hint;
    @Singular
    List<String> alternateHints;
    String mergeKey;
    /** Navigation target unit, or null. */
    String target;
    /** Value of the option-prefix correlation attribute, or null. */
    IdentifierValue optionPrefix;
}
