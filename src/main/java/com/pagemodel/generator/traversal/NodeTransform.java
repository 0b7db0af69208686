package com.pagemodel.generator.traversal;

import com.pagemodel.generator.model.TemplateNode;

/**
 * Per-node callback invoked by an external traversal driver, once per node, parents
 * before children.
 */
@FunctionalInterface
public interface NodeTransform {

    void transform(TemplateNode node, TransformContext context);
}
