package com.pagemodel.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Loop wrapper created for an element carrying {@code v-for}. The element itself (with its
 * directive) is the only child.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ForNode extends TemplateNode {
    /** Iterable expression source, e.g. {@code items} in {@code item in items}. */
    private String source;
    private String valueAlias;
    private String keyAlias;
    private String indexAlias;
    /** True when the iterable references no bindings. */
    private boolean constantSource;
    private List<TemplateNode> children = new ArrayList<>();

    @Builder
    public ForNode(String source, String valueAlias, String keyAlias, String indexAlias,
                   boolean constantSource, List<TemplateNode> children, SourceLocation loc) {
        this.source = source;
        this.valueAlias = valueAlias;
        this.keyAlias = keyAlias;
        this.indexAlias = indexAlias;
        this.constantSource = constantSource;
        this.children = children != null ? children : new ArrayList<>();
        this.loc = loc != null ? loc : SourceLocation.UNKNOWN;
    }

    @Override
    public NodeType getType() {
        return NodeType.FOR;
    }
}
