package com.pagemodel.generator.codegen.routing;

import java.util.Map;

import com.pagemodel.generator.codegen.naming.NamingUtil;

/**
 * Resolves named route locations through a route-key to unit map.
 */
public class RouteNameTargetResolver implements NavigationTargetResolver {

    private final Map<String, String> targetsByRouteKey;

    public RouteNameTargetResolver(Map<String, String> targetsByRouteKey) {
        this.targetsByRouteKey = Map.copyOf(targetsByRouteKey);
    }

    @Override
    public String resolveNavigationTarget(RouteLocation location) {
        if (location == null || !location.hasName()) {
            return null;
        }
        return targetsByRouteKey.get(NamingUtil.toPascalCaseRouteKey(location.getName()));
    }
}
