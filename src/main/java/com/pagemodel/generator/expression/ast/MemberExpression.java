package com.pagemodel.generator.expression.ast;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * {@code object.property}, {@code object[property]} and their optional-chaining forms.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MemberExpression extends JsNode {
    JsNode object;
    JsNode property;
    boolean computed;
    boolean optional;

    @Override
    public List<JsNode> children() {
        return childrenOf(object, property);
    }
}
