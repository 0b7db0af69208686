package com.pagemodel.generator.codegen.role;

import lombok.Value;

/**
 * Role decision for one element.
 */
@Value
public class ResolvedRole {
    /** Raw role: the wrapper role, or the tag lower-cased without dashes. */
    String rawRole;
    /** Naming role; anything unrecognized is treated as a button. */
    Role role;
    /** Wrapper entry behind the decision, or null for the tag fallback. */
    RoleConfig config;

    /**
     * Identifier suffix, e.g. {@code -button} or {@code -routerlink}.
     */
    public String getTagSuffix() {
        return "-" + rawRole;
    }

    public boolean isWrapper() {
        return config != null;
    }

    /**
     * The raw role is one of the fixed interaction roles, not just a tag name.
     */
    public boolean isRecognizedInteractive() {
        return Role.isRecognized(rawRole);
    }
}
