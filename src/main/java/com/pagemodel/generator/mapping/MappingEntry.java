package com.pagemodel.generator.mapping;

import lombok.Builder;
import lombok.Data;

/**
 * Represents a single rule from a wrappers or routes file.
 */
@Data
@Builder
public class MappingEntry {
    private MappingType type;
    /** Component tag for wrappers, route name for routes. */
    private String source;
    /** Role for wrappers, target unit for routes. */
    private String target;
    private String valueAttribute;
    private boolean optionPrefix;
    private int line;

    public enum MappingType {
        /**
         * Component tag that wraps a native control.
         */
        WRAPPER,

        /**
         * Route name rendered by a unit.
         */
        ROUTE
    }
}
