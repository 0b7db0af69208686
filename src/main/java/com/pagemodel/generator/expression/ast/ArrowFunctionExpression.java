package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Arrow function; the body is either an expression or a {@link BlockStatement}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ArrowFunctionExpression extends JsNode {
    List<String> params;
    JsNode body;

    @Override
    public List<JsNode> children() {
        return childrenOf(body);
    }
}
