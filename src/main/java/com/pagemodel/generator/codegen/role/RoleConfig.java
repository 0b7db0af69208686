package com.pagemodel.generator.codegen.role;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Wrapper configuration for one component tag.
 */
@Value
@Builder
public class RoleConfig {
    /** Raw role name, used verbatim as the identifier suffix. */
    @NonNull
    String role;
    /** Attribute whose value identifies the element instead of {@code v-model}. */
    String valueAttribute;
    /** Option children need an {@code option-data-testid-prefix} correlation attribute. */
    boolean requiresOptionPrefix;

    public static RoleConfig of(String role) {
        return RoleConfig.builder().role(role).build();
    }

    public boolean hasValueAttribute() {
        return valueAttribute != null && !valueAttribute.isBlank();
    }
}
