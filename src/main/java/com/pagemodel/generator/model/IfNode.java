package com.pagemodel.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Conditional chain ({@code v-if} / {@code v-else-if} / {@code v-else}); children are the
 * {@link IfBranchNode}s in order.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class IfNode extends TemplateNode {
    private List<TemplateNode> children = new ArrayList<>();

    @Override
    public NodeType getType() {
        return NodeType.IF;
    }

    public List<IfBranchNode> getBranches() {
        List<IfBranchNode> branches = new ArrayList<>();
        for (TemplateNode child : children) {
            if (child instanceof IfBranchNode branch) {
                branches.add(branch);
            }
        }
        return branches;
    }
}
