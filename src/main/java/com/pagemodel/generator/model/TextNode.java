package com.pagemodel.generator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class TextNode extends TemplateNode {
    private String content;

    public TextNode(String content, SourceLocation loc) {
        this.content = content;
        this.loc = loc;
    }

    @Override
    public NodeType getType() {
        return NodeType.TEXT;
    }

    @Override
    public List<TemplateNode> getChildren() {
        return List.of();
    }
}
