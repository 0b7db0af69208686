package com.pagemodel.generator.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.pagemodel.generator.codegen.naming.NamingUtil;
import com.pagemodel.generator.codegen.role.RoleConfig;

import lombok.Data;

/**
 * Represents a parsed wrappers or routes file.
 */
@Data
public class MappingDocument {
    private final List<MappingEntry> allEntries = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addEntry(MappingEntry entry) {
        allEntries.add(entry);
    }

    /**
     * Wrapper entries as tag to {@link RoleConfig}; later lines win.
     */
    public Map<String, RoleConfig> toRoleConfigs() {
        Map<String, RoleConfig> configs = new LinkedHashMap<>();
        for (MappingEntry entry : allEntries) {
            if (entry.getType() != MappingEntry.MappingType.WRAPPER) {
                continue;
            }
            configs.put(entry.getSource(), RoleConfig.builder()
                    .role(entry.getTarget())
                    .valueAttribute(entry.getValueAttribute())
                    .requiresOptionPrefix(entry.isOptionPrefix())
                    .build());
        }
        return configs;
    }

    /**
     * Route entries keyed by the PascalCase route key.
     */
    public Map<String, String> toRouteTargets() {
        Map<String, String> targets = new LinkedHashMap<>();
        for (MappingEntry entry : allEntries) {
            if (entry.getType() == MappingEntry.MappingType.ROUTE) {
                targets.put(NamingUtil.toPascalCaseRouteKey(entry.getSource()), entry.getTarget());
            }
        }
        return targets;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
