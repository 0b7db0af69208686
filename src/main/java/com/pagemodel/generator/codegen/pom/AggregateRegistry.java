package com.pagemodel.generator.codegen.pom;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-unit aggregates keyed by unit name. Different units may be compiled concurrently;
 * one unit's passes must be serialized by the caller.
 */
public class AggregateRegistry {

    private final Map<String, UnitAggregate> aggregates = new ConcurrentHashMap<>();

    /**
     * Replaces any previous aggregate of the unit with an empty one.
     */
    public UnitAggregate reset(String unitName, String filePath, boolean view) {
        UnitAggregate fresh = new UnitAggregate(unitName, filePath, view);
        aggregates.put(unitName, fresh);
        return fresh;
    }

    public UnitAggregate get(String unitName) {
        return aggregates.get(unitName);
    }

    public void remove(String unitName) {
        aggregates.remove(unitName);
    }

    /**
     * All aggregates ordered by unit name.
     */
    public List<UnitAggregate> all() {
        List<UnitAggregate> all = new ArrayList<>(aggregates.values());
        all.sort(Comparator.comparing(UnitAggregate::getUnitName));
        return all;
    }
}
