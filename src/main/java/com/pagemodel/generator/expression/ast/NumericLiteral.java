package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Numeric literal; {@code raw} keeps the source spelling.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class NumericLiteral extends JsNode {
    String raw;

    @Override
    public List<JsNode> children() {
        return List.of();
    }
}
