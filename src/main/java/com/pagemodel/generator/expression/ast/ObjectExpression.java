package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

@Value
@EqualsAndHashCode(callSuper = false)
public class ObjectExpression extends JsNode {
    List<JsNode> properties;

    @Override
    public List<JsNode> children() {
        return childrenOf(properties);
    }

    /**
     * Finds a non-computed property by key name.
     */
    public ObjectProperty findProperty(String name) {
        for (JsNode node : properties) {
            if (node instanceof ObjectProperty prop && name.equals(prop.keyName())) {
                return prop;
            }
        }
        return null;
    }
}
