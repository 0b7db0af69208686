package com.pagemodel.generator.codegen.ancestry;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.expression.StaticValueExtractor;
import com.pagemodel.generator.model.DirectiveProp;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.ForNode;
import com.pagemodel.generator.model.TemplateNode;

/**
 * Child to parent lookup built during a pre-order traversal. Nodes are keyed by identity;
 * every node must be recorded before its children are visited.
 */
public class AncestorIndex {

    private final Map<TemplateNode, TemplateNode> parents = new IdentityHashMap<>();
    private final ExpressionClassifier classifier;

    public AncestorIndex(ExpressionClassifier classifier) {
        this.classifier = classifier;
    }

    public void record(TemplateNode node, TemplateNode parent) {
        parents.putIfAbsent(node, parent);
    }

    /**
     * Nearest ancestor that is an element, looking through loop and conditional wrappers.
     */
    public ElementNode parentElement(TemplateNode node) {
        TemplateNode current = parents.get(node);
        while (current != null) {
            if (current instanceof ElementNode element) {
                return element;
            }
            current = parents.get(current);
        }
        return null;
    }

    /**
     * Key placeholder ({@code ${expr}}) identifying the element within its repeating scope:
     * its own {@code :key}, else (inside a loop) the {@code :key} of the nearest ancestor
     * element carrying {@code v-for}.
     *
     * @param forDepth number of enclosing loop scopes at the element
     * @return the placeholder, or null when the element is not keyed
     */
    public String nearestRepeatingKey(ElementNode element, int forDepth) {
        String own = keyPlaceholder(element);
        if (own != null) {
            return own;
        }
        if (forDepth <= 0) {
            return null;
        }
        ElementNode current = parentElement(element);
        while (current != null) {
            if (current.hasDirective("for")) {
                return keyPlaceholder(current);
            }
            current = parentElement(current);
        }
        return null;
    }

    /**
     * True when an enclosing {@code <template>} introduces slot-scope bindings.
     */
    public boolean isInsideScopedRegionWithParams(ElementNode element) {
        ElementNode current = parentElement(element);
        while (current != null) {
            if (current.isTemplateWithSlotScope()) {
                return true;
            }
            current = parentElement(current);
        }
        return false;
    }

    /**
     * Literal string values of the loop directly wrapping the element, e.g. {@code One, Two}
     * for {@code v-for="item in ['One', 'Two']"}.
     *
     * @param parent the element's immediate traversal parent
     * @return the values, or null when the iterable is not a literal string array
     */
    public List<String> staticLiteralsOfEnclosingLoop(TemplateNode parent, int forDepth) {
        if (forDepth <= 0 || !(parent instanceof ForNode loop) || !loop.isConstantSource()) {
            return null;
        }
        return StaticValueExtractor.staticStringArray(classifier.tryParseExpression(loop.getSource()));
    }

    private static String keyPlaceholder(ElementNode element) {
        DirectiveProp key = element.findBinding("key");
        if (key == null || !key.hasExpression()) {
            return null;
        }
        return "${" + key.trimmedExpression() + "}";
    }
}
