package com.pagemodel.generator.codegen.pom;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import com.pagemodel.generator.codegen.role.Role;
import com.pagemodel.generator.codegen.testid.IdentifierValue;

import lombok.Builder;
import lombok.Data;

/**
 * Primary page-object member of one element: a getter for its locator and an action method.
 * Merged elements add their selector patterns to {@link #alternatePatterns}.
 */
@Data
public class PomSpec {
    private Role role;
    /** Resolved base name, including the {@code ByKey} marker for keyed members. */
    private String baseName;
    private String getterName;
    private String actionName;
    private IdentifierValue identifier;
    /** Selector pattern with every substitution normalized to {@code ${key}}. */
    private String pattern;
    private List<String> alternatePatterns = new ArrayList<>();
    /** Literal values of a static loop, narrowing the {@code key} parameter. */
    private List<String> keyValues;
    private List<PomParameter> parameters = new ArrayList<>();
    private boolean emitPrimary = true;
    private String mergeKey;
    /** Navigation target unit, or null. */
    private String target;

    @Builder
    public PomSpec(Role role, String baseName, String getterName, String actionName, IdentifierValue identifier,
                   String pattern, List<String> keyValues, List<PomParameter> parameters, String mergeKey,
                   String target) {
        this.role = role;
        this.baseName = baseName;
        this.getterName = getterName;
        this.actionName = actionName;
        this.identifier = identifier;
        this.pattern = pattern;
        this.keyValues = keyValues;
        this.parameters = parameters != null ? new ArrayList<>(parameters) : new ArrayList<>();
        this.mergeKey = mergeKey;
        this.target = target;
    }

    public boolean isKeyed() {
        return pattern != null && pattern.contains("${key}");
    }

    public boolean isNavigation() {
        return target != null;
    }

    public boolean hasParameter(String name) {
        return parameters.stream().anyMatch(p -> p.getName().equals(name));
    }

    /**
     * Adds a merged element's pattern unless it is already covered.
     */
    public void addAlternatePattern(String alternate) {
        if (!alternate.equals(pattern) && !alternatePatterns.contains(alternate)) {
            alternatePatterns.add(alternate);
        }
    }

    /**
     * De-duplication key built from structure (role, names, patterns, sorted parameters,
     * target), never from emitted text.
     */
    public String structuralKey() {
        return String.join("|",
                "primary",
                String.valueOf(role),
                baseName,
                getterName,
                pattern,
                new TreeSet<>(alternatePatterns).toString(),
                sortedParameters(parameters),
                String.valueOf(target),
                String.valueOf(emitPrimary));
    }

    static String sortedParameters(List<PomParameter> parameters) {
        TreeSet<String> sorted = new TreeSet<>();
        for (PomParameter parameter : parameters) {
            sorted.add(parameter.toString());
        }
        return sorted.toString();
    }
}
