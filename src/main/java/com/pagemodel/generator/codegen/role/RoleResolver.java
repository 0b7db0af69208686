package com.pagemodel.generator.codegen.role;

import java.util.Locale;

import com.pagemodel.generator.model.ElementNode;

/**
 * Maps an element to its role: explicit configuration first, then single-root inference for
 * PascalCase component tags, then the tag itself.
 */
public class RoleResolver {

    private final NativeRoleConfiguration configuration;

    public RoleResolver(NativeRoleConfiguration configuration) {
        this.configuration = configuration;
    }

    public ResolvedRole resolve(ElementNode element) {
        String tag = element.getTag();
        RoleConfig config = configuration.resolve(tag);
        if (config != null) {
            return new ResolvedRole(config.getRole(), Role.normalize(config.getRole()), config);
        }
        String raw = tag.replace("-", "").toLowerCase(Locale.ROOT);
        return new ResolvedRole(raw, Role.normalize(raw), null);
    }
}
