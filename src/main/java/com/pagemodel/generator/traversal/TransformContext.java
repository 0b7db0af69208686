package com.pagemodel.generator.traversal;

import com.pagemodel.generator.model.TemplateNode;

import lombok.Value;

/**
 * Traversal state handed to a {@link NodeTransform} alongside each node.
 */
@Value
public class TransformContext {
    String fileName;
    /** Immediate parent in the tree (loop and conditional wrappers included); null for the root. */
    TemplateNode parent;
    /** Number of enclosing {@code v-for} scopes. */
    int forDepth;

    TransformContext child(TemplateNode newParent, boolean entersLoop) {
        return new TransformContext(fileName, newParent, entersLoop ? forDepth + 1 : forDepth);
    }
}
