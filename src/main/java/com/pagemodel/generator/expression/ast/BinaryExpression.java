package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Binary and logical operators. Logical ones are {@code &&}, {@code ||} and {@code ??}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class BinaryExpression extends JsNode {
    String operator;
    JsNode left;
    JsNode right;

    @Override
    public List<JsNode> children() {
        return childrenOf(left, right);
    }

    public boolean isLogical() {
        return "&&".equals(operator) || "||".equals(operator) || "??".equals(operator);
    }
}
