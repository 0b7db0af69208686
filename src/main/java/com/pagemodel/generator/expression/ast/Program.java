package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Statement list produced by the statement fallback of the parser.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class Program extends JsNode {
    List<JsNode> body;

    @Override
    public List<JsNode> children() {
        return childrenOf(body);
    }
}
