package com.pagemodel.generator.codegen.routing;

/**
 * Resolves a navigation target descriptor to the name of the unit it renders.
 */
@FunctionalInterface
public interface NavigationTargetResolver {

    NavigationTargetResolver NONE = location -> null;

    /**
     * @return the target unit name, or null when the location cannot be resolved
     */
    String resolveNavigationTarget(RouteLocation location);

    /**
     * Tries this resolver first and {@code fallback} when it yields nothing.
     */
    default NavigationTargetResolver orElse(NavigationTargetResolver fallback) {
        return location -> {
            String resolved = resolveNavigationTarget(location);
            return resolved != null ? resolved : fallback.resolveNavigationTarget(location);
        };
    }
}
