package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class ExpressionStatement extends JsNode {
    JsNode expression;

    @Override
    public List<JsNode> children() {
        return childrenOf(expression);
    }
}
