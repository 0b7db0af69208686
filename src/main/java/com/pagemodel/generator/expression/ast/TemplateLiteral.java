package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Backtick template. {@code quasis} has one more element than {@code expressions}.
 * {@code raw} is the text between the backticks.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class TemplateLiteral extends JsNode {
    List<String> quasis;
    List<JsNode> expressions;
    String raw;

    @Override
    public List<JsNode> children() {
        return childrenOf(expressions);
    }

    public boolean hasSubstitutions() {
        return !expressions.isEmpty();
    }

    public String cooked() {
        return String.join("", quasis);
    }
}
