package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class SequenceExpression extends JsNode {
    List<JsNode> expressions;

    @Override
    public List<JsNode> children() {
        return childrenOf(expressions);
    }

    public JsNode last() {
        return expressions.get(expressions.size() - 1);
    }
}
