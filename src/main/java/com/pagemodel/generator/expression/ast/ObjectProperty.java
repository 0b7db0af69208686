package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * One {@code key: value} entry of an object literal; shorthand entries repeat the key as value.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ObjectProperty extends JsNode {
    JsNode key;
    JsNode value;
    boolean computed;
    boolean shorthand;

    @Override
    public List<JsNode> children() {
        return shorthand ? childrenOf(value) : childrenOf(key, value);
    }

    /**
     * Returns the static key name, or null for computed or numeric keys.
     */
    public String keyName() {
        if (computed) {
            return null;
        }
        if (key instanceof Identifier id) {
            return id.getName();
        }
        if (key instanceof StringLiteral str) {
            return str.getValue();
        }
        return null;
    }
}
