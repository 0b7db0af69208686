package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class StringLiteral extends JsNode {
    String value;

    @Override
    public List<JsNode> children() {
        return List.of();
    }
}
