package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Array literal. Holes are represented by {@code null} elements.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ArrayExpression extends JsNode {
    List<JsNode> elements;

    @Override
    public List<JsNode> children() {
        return childrenOf(elements);
    }
}
