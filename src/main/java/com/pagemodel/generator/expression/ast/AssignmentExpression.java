package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class AssignmentExpression extends JsNode {
    String operator;
    JsNode left;
    JsNode right;

    @Override
    public List<JsNode> children() {
        return childrenOf(left, right);
    }
}
