package com.pagemodel.generator.codegen.ancestry;

import java.util.IdentityHashMap;
import java.util.Map;

import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.model.DirectiveProp;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.IfBranchNode;
import com.pagemodel.generator.model.IfNode;
import com.pagemodel.generator.model.TemplateNode;

/**
 * Derives conditional context hints ({@code details}, {@code else details}) for elements
 * rendered under {@code v-if}/{@code v-else-if}/{@code v-else} or {@code v-show}.
 * Descendants without a hint of their own inherit the nearest ancestor's hint.
 */
public class ConditionalHintTracker {

    private final ExpressionClassifier classifier;
    private final AncestorIndex ancestors;

    private final Map<IfBranchNode, String> hintByBranch = new IdentityHashMap<>();
    private final Map<ElementNode, String> lastHintByParent = new IdentityHashMap<>();
    private final Map<ElementNode, String> hintByElement = new IdentityHashMap<>();

    public ConditionalHintTracker(ExpressionClassifier classifier, AncestorIndex ancestors) {
        this.classifier = classifier;
        this.ancestors = ancestors;
    }

    /**
     * Caches one hint per branch: the stable hint of its condition, {@code else <last>} for
     * an else branch after a hinted branch, otherwise {@code else} or {@code if}.
     */
    public void recordBranches(IfNode ifNode) {
        String lastHint = null;
        for (IfBranchNode branch : ifNode.getBranches()) {
            if (branch.isElse()) {
                hintByBranch.put(branch, lastHint != null ? "else " + lastHint : "else");
                continue;
            }
            String stable = classifier.stableConditionHint(branch.getCondition());
            if (stable != null) {
                hintByBranch.put(branch, stable);
                lastHint = stable;
            } else {
                hintByBranch.put(branch, "if");
            }
        }
    }

    /**
     * Resolves and remembers the hint of an element already recorded in the ancestor index.
     *
     * @param parent the element's immediate traversal parent
     * @return the hint, or null when no conditional context applies
     */
    public String resolve(ElementNode element, TemplateNode parent) {
        ElementNode parentElement = ancestors.parentElement(element);
        String hint = null;

        DirectiveProp vIf = element.findDirective("if", null);
        DirectiveProp vElseIf = element.findDirective("else-if", null);
        if (vIf != null || vElseIf != null) {
            String source = (vIf != null ? vIf : vElseIf).trimmedExpression();
            hint = classifier.stableConditionHint(source);
            if (hint != null && parentElement != null) {
                lastHintByParent.put(parentElement, hint);
            }
        } else if (element.hasDirective("else") && parentElement != null) {
            String previous = lastHintByParent.get(parentElement);
            hint = previous != null ? "else " + previous : null;
        }

        if (hint == null && parent instanceof IfBranchNode branch) {
            hint = hintByBranch.get(branch);
            if (hint == null) {
                hint = branch.isElse() ? "else" : orDefault(classifier.stableConditionHint(branch.getCondition()), "if");
            }
        }

        DirectiveProp vShow = element.findDirective("show", null);
        if (vShow != null && vShow.hasExpression()) {
            String showHint = classifier.stableConditionHint(vShow.trimmedExpression());
            if (showHint != null) {
                hint = hint != null ? hint + " " + showHint : showHint;
            }
        }

        if (hint == null) {
            ElementNode current = parentElement;
            while (current != null && hint == null) {
                hint = hintByElement.get(current);
                current = ancestors.parentElement(current);
            }
        }

        if (hint != null) {
            hintByElement.put(element, hint);
        }
        return hint;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
