package com.pagemodel.generator.codegen.pom;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Everything accumulated for one unit during one pass: identifier entries, primary members,
 * extra methods, reserved member names and the generated-method ledger. A re-compilation of
 * the unit starts from a fresh aggregate.
 */
@Getter
public class UnitAggregate {
    private final String unitName;
    private final String filePath;
    private final boolean view;

    private final List<GeneratedIdentifierEntry> entries = new ArrayList<>();
    private final List<PomSpec> primaries = new ArrayList<>();
    private final List<PomExtraMethod> extraMethods = new ArrayList<>();
    private final GeneratedMethodLedger ledger = new GeneratedMethodLedger();
    private final Set<String> usedComponents = new LinkedHashSet<>();
    private final Set<String> childComponents = new LinkedHashSet<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> reservedNames = new HashSet<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, PomSpec> primaryByActionName = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> structuralKeys = new HashSet<>();

    public UnitAggregate(String unitName, String filePath, boolean view) {
        this.unitName = unitName;
        this.filePath = filePath;
        this.view = view;
    }

    public boolean isReserved(String name) {
        return reservedNames.contains(name);
    }

    public void reserve(String name) {
        reservedNames.add(name);
    }

    /**
     * Frees a name reserved for a member that will not be emitted.
     */
    public void release(String name) {
        reservedNames.remove(name);
    }

    public PomSpec primaryForAction(String actionName) {
        return primaryByActionName.get(actionName);
    }

    /**
     * Makes an emitted primary reachable for merge-by-identity.
     */
    public void indexPrimary(PomSpec spec) {
        primaryByActionName.put(spec.getActionName(), spec);
    }

    public void addEntry(GeneratedIdentifierEntry entry) {
        entries.add(entry);
    }

    /**
     * Records a primary unless a structurally identical one is already present.
     *
     * @return true when the spec was added
     */
    public boolean registerPrimaryOnce(PomSpec spec) {
        if (!structuralKeys.add(spec.structuralKey())) {
            return false;
        }
        primaries.add(spec);
        return true;
    }

    public boolean hasExtraMethod(PomExtraMethod method) {
        return structuralKeys.contains("extra|" + method.structuralKey());
    }

    /**
     * Records an extra method unless a structurally identical one is already present.
     *
     * @return true when the method was added
     */
    public boolean addExtraMethod(PomExtraMethod method) {
        if (!structuralKeys.add("extra|" + method.structuralKey())) {
            return false;
        }
        extraMethods.add(method);
        return true;
    }

    /**
     * {@code base}, else {@code base2}, {@code base3}, ... : the first name neither reserved
     * nor in the ledger. The returned name is reserved.
     */
    public String reserveUniqueMethodName(String base) {
        String candidate = base;
        int i = 2;
        while (reservedNames.contains(candidate) || ledger.contains(candidate)) {
            candidate = base + i;
            i++;
        }
        reservedNames.add(candidate);
        return candidate;
    }

    /**
     * Every identifier text of the unit, sorted.
     */
    public List<String> getAllIdentifiers() {
        Set<String> identifiers = new TreeSet<>();
        for (GeneratedIdentifierEntry entry : entries) {
            identifiers.add(entry.getIdentifier().getText());
        }
        return new ArrayList<>(identifiers);
    }

    /**
     * Primaries that render a getter and action.
     */
    public List<PomSpec> getEmittedPrimaries() {
        List<PomSpec> emitted = new ArrayList<>();
        for (PomSpec spec : primaries) {
            if (spec.isEmitPrimary()) {
                emitted.add(spec);
            }
        }
        return emitted;
    }
}
