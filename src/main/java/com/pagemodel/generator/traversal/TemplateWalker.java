package com.pagemodel.generator.traversal;

import java.util.ArrayList;
import java.util.List;

import com.pagemodel.generator.model.ForNode;
import com.pagemodel.generator.model.RootNode;
import com.pagemodel.generator.model.TemplateNode;

/**
 * Pre-order traversal driver: every node is handed to the transforms before any of its
 * children.
 */
public class TemplateWalker {

    private final List<NodeTransform> transforms;

    public TemplateWalker(List<NodeTransform> transforms) {
        this.transforms = new ArrayList<>(transforms);
    }

    public void walk(RootNode root, String fileName) {
        visit(root, new TransformContext(fileName, null, 0));
    }

    private void visit(TemplateNode node, TransformContext context) {
        for (NodeTransform transform : transforms) {
            transform.transform(node, context);
        }
        TransformContext childContext = context.child(node, node instanceof ForNode);
        for (TemplateNode child : new ArrayList<>(node.getChildren())) {
            visit(child, childContext);
        }
    }
}
