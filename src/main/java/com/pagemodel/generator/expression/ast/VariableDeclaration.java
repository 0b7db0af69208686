package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * {@code const|let|var name = init}; destructuring targets are not supported.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class VariableDeclaration extends JsNode {
    String kind;
    String name;
    JsNode init;

    @Override
    public List<JsNode> children() {
        return childrenOf(init);
    }
}
