package com.pagemodel.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Root of one template; its children are the top-level nodes.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class RootNode extends TemplateNode {
    private List<TemplateNode> children = new ArrayList<>();

    @Override
    public NodeType getType() {
        return NodeType.ROOT;
    }

    /**
     * First top-level element, looking through conditional and loop wrappers.
     */
    public ElementNode firstElement() {
        for (TemplateNode child : children) {
            ElementNode element = firstElementOf(child);
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    private static ElementNode firstElementOf(TemplateNode node) {
        if (node instanceof ElementNode element) {
            return element;
        }
        if (node instanceof ForNode || node instanceof IfNode || node instanceof IfBranchNode) {
            for (TemplateNode child : node.getChildren()) {
                ElementNode element = firstElementOf(child);
                if (element != null) {
                    return element;
                }
            }
        }
        return null;
    }
}
