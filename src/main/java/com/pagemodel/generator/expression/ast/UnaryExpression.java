package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Prefix operators ({@code !}, {@code typeof}, {@code new}, {@code await}, ...) and postfix updates.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class UnaryExpression extends JsNode {
    String operator;
    JsNode argument;
    boolean prefix;

    @Override
    public List<JsNode> children() {
        return childrenOf(argument);
    }
}
