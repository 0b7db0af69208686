package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class CallExpression extends JsNode {
    JsNode callee;
    List<JsNode> arguments;
    boolean optional;

    @Override
    public List<JsNode> children() {
        return childrenOf(callee, arguments);
    }
}
