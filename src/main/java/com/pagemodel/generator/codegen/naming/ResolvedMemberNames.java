package com.pagemodel.generator.codegen.naming;

import com.pagemodel.generator.codegen.pom.PomSpec;

import lombok.Value;

/**
 * Unique getter and action names for one element, or the primary it was merged into.
 */
@Value
public class ResolvedMemberNames {
    /** Base name including the {@code ByKey} marker for keyed members. */
    String baseName;
    String getterName;
    String actionName;
    /** Existing primary the element was folded into, or null. */
    PomSpec mergedInto;

    public boolean isMerged() {
        return mergedInto != null;
    }
}
