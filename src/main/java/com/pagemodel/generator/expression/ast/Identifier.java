package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * Bare identifier, including {@code this} and {@code undefined}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class Identifier extends JsNode {
    String name;

    @Override
    public List<JsNode> children() {
        return List.of();
    }

    public boolean startsUpperCase() {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }
}
