package com.pagemodel.generator.codegen.role;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tag to {@link RoleConfig} table: explicit configuration plus a cache of single-root
 * inference outcomes. Both positive and negative outcomes are kept, so every tag is
 * inspected at most once.
 */
public class NativeRoleConfiguration {
    private static final Logger log = LoggerFactory.getLogger(NativeRoleConfiguration.class);

    private final Map<String, RoleConfig> configured;
    private final Map<String, Optional<RoleConfig>> inferred = new ConcurrentHashMap<>();
    private final ComponentRootTagReader rootTagReader;

    public NativeRoleConfiguration(Map<String, RoleConfig> configured, ComponentRootTagReader rootTagReader) {
        this.configured = Map.copyOf(configured);
        this.rootTagReader = rootTagReader;
    }

    /**
     * Configured or previously inferred entry, without triggering inference.
     */
    public RoleConfig find(String tag) {
        RoleConfig config = configured.get(tag);
        if (config != null) {
            return config;
        }
        Optional<RoleConfig> cached = inferred.get(tag);
        return cached == null ? null : cached.orElse(null);
    }

    /**
     * Returns the configured entry, or infers one for a PascalCase tag from its component
     * definition: a root {@code input}/{@code textarea} means {@code input}, a root
     * {@code select} means {@code select}.
     */
    public RoleConfig resolve(String tag) {
        RoleConfig config = configured.get(tag);
        if (config != null) {
            return config;
        }
        if (tag == null || tag.isEmpty() || !Character.isUpperCase(tag.charAt(0))) {
            return null;
        }
        return inferred.computeIfAbsent(tag, this::infer).orElse(null);
    }

    private Optional<RoleConfig> infer(String tag) {
        Optional<String> rootTag = rootTagReader.readRootTag(tag);
        if (rootTag.isEmpty()) {
            return Optional.empty();
        }
        String role;
        switch (rootTag.get()) {
            case "input":
            case "textarea":
                role = "input";
                break;
            case "select":
                role = "select";
                break;
            default:
                return Optional.empty();
        }
        log.debug("Inferred role '{}' for component {} from its root <{}>", role, tag, rootTag.get());
        return Optional.of(RoleConfig.of(role));
    }
}
