package com.pagemodel.generator.codegen.testid;

import java.util.List;

import com.pagemodel.generator.codegen.role.ResolvedRole;
import com.pagemodel.generator.model.SourceLocation;

import lombok.Builder;
import lombok.Value;

/**
 * Context gathered for one element before an identifier is synthesized.
 */
@Value
@Builder
public class ElementSignals {
    String unitName;
    String fileName;
    SourceLocation location;
    ResolvedRole role;
    /** Repeating-scope key placeholder such as {@code ${item.id}}, or null. */
    String keyPlaceholder;
    /** Literal values of a static enclosing loop, or null. */
    List<String> staticKeyValues;
    /** Conditional context hint, or null. */
    String conditionalHint;
    boolean insideScopedSlot;

    public boolean isKeyed() {
        return keyPlaceholder != null;
    }
}
