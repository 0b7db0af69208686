package com.pagemodel.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * One branch of an {@link IfNode}. The condition is null for a {@code v-else} branch.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class IfBranchNode extends TemplateNode {
    private String condition;
    private List<TemplateNode> children = new ArrayList<>();

    public IfBranchNode(String condition, SourceLocation loc) {
        this.condition = condition;
        this.loc = loc;
    }

    @Override
    public NodeType getType() {
        return NodeType.IF_BRANCH;
    }

    public boolean isElse() {
        return condition == null;
    }
}
