package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class ConditionalExpression extends JsNode {
    JsNode test;
    JsNode consequent;
    JsNode alternate;

    @Override
    public List<JsNode> children() {
        return childrenOf(test, consequent, alternate);
    }
}
