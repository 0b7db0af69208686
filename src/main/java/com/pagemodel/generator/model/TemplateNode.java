package com.pagemodel.generator.model;

import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for all template tree nodes.
 */
@Data
@NoArgsConstructor
public abstract class TemplateNode {
    protected SourceLocation loc = SourceLocation.UNKNOWN;

    public abstract NodeType getType();

    /**
     * Child nodes in document order; leaves return an empty list.
     */
    public abstract List<TemplateNode> getChildren();

    public enum NodeType {
        ROOT,
        ELEMENT,
        TEXT,
        INTERPOLATION,
        FOR,
        IF,
        IF_BRANCH
    }
}
