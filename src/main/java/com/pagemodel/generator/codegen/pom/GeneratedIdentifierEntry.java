package com.pagemodel.generator.codegen.pom;

import com.pagemodel.generator.codegen.testid.IdentifierValue;
import com.pagemodel.generator.model.SourceLocation;

import lombok.Builder;
import lombok.Data;

/**
 * One identifier assigned (or preserved) on an element during a unit's pass.
 */
@Data
@Builder
public class GeneratedIdentifierEntry {
    private IdentifierValue identifier;
    /** Navigation target unit, or null. */
    private String target;
    private PomSpec pom;
    private String tag;
    private SourceLocation location;
    /** Produced inside a {@code <template>} with slot-scope bindings. */
    private boolean insideScopedSlot;
    /** Taken from the author's own attribute rather than synthesized. */
    private boolean fromExisting;
}
