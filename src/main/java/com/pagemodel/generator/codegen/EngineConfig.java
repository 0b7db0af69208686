package com.pagemodel.generator.codegen;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import com.pagemodel.generator.codegen.role.RoleConfig;
import com.pagemodel.generator.codegen.routing.NavigationTargetResolver;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Settings of one {@link TestIdEngine}.
 */
@Value
@Builder
public class EngineConfig {

    public static final String DEFAULT_IDENTIFIER_ATTRIBUTE = "data-testid";
    public static final String OPTION_PREFIX_ATTRIBUTE = "option-data-testid-prefix";

    @NonNull
    @Builder.Default
    ExistingIdBehavior existingIdBehavior = ExistingIdBehavior.PRESERVE;

    @NonNull
    @Builder.Default
    NameCollisionBehavior nameCollisionBehavior = NameCollisionBehavior.SUFFIX;

    @NonNull
    @Builder.Default
    String identifierAttributeName = DEFAULT_IDENTIFIER_ATTRIBUTE;

    @Singular
    Map<String, RoleConfig> nativeWrappers;

    @Singular
    Set<String> excludedUnits;

    /** Units whose files lie under this directory are views. */
    Path viewsDir;

    /** Where {@code <Tag>.vue} definitions are looked up for role inference. */
    Path componentsDir;

    @NonNull
    @Builder.Default
    NavigationTargetResolver navigationTargetResolver = NavigationTargetResolver.NONE;

    /** Upper bound of the numeric suffix loop. */
    @Builder.Default
    int maxCollisionSuffix = 1000;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }
}
