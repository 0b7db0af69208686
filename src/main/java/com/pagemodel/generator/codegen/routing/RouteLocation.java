package com.pagemodel.generator.codegen.routing;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Statically known part of a navigation target: either a plain path string or an object
 * literal carrying a route {@code name} or {@code path} and the names of its params.
 */
@Value
@Builder
public class RouteLocation {
    String name;
    String path;
    @Singular
    List<String> paramKeys;

    public static RouteLocation ofPath(String path) {
        return RouteLocation.builder().path(path).build();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
