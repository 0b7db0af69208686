package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class NullLiteral extends JsNode {

    @Override
    public List<JsNode> children() {
        return List.of();
    }
}
