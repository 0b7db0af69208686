package com.pagemodel.generator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Mustache interpolation {@code {{ expression }}}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class InterpolationNode extends TemplateNode {
    private String expression;

    public InterpolationNode(String expression, SourceLocation loc) {
        this.expression = expression;
        this.loc = loc;
    }

    @Override
    public NodeType getType() {
        return NodeType.INTERPOLATION;
    }

    @Override
    public List<TemplateNode> getChildren() {
        return List.of();
    }
}
