package com.pagemodel.generator.cli.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pagemodel.generator.codegen.role.RoleConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedOutputDir;
    Map<String, RoleConfig> wrappers;
    Map<String, String> routeTargets;
    Set<String> excludedUnits;
    /** Non-fatal findings from the wrappers and routes files. */
    List<String> warnings;
}
