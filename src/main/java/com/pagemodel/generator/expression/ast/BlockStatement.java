package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class BlockStatement extends JsNode {
    List<JsNode> body;

    @Override
    public List<JsNode> children() {
        return childrenOf(body);
    }
}
