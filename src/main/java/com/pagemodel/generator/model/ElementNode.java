package com.pagemodel.generator.model;

import java.util.ArrayList;
import java.util.List;

import com.pagemodel.generator.codegen.testid.IdentifierValue;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Element or component tag with its attributes, directives and children.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ElementNode extends TemplateNode {
    private String tag;
    private List<TemplateProp> props = new ArrayList<>();
    private List<TemplateNode> children = new ArrayList<>();
    private boolean selfClosing;

    @Builder
    public ElementNode(String tag, List<TemplateProp> props, List<TemplateNode> children,
                       boolean selfClosing, SourceLocation loc) {
        this.tag = tag;
        this.props = props != null ? props : new ArrayList<>();
        this.children = children != null ? children : new ArrayList<>();
        this.selfClosing = selfClosing;
        this.loc = loc != null ? loc : SourceLocation.UNKNOWN;
    }

    @Override
    public NodeType getType() {
        return NodeType.ELEMENT;
    }

    public AttributeProp findAttribute(String name) {
        for (TemplateProp prop : props) {
            if (prop instanceof AttributeProp attribute && attribute.getName().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Value of a static attribute, or null when absent or bare.
     */
    public String attributeValue(String name) {
        AttributeProp attribute = findAttribute(name);
        return attribute == null ? null : attribute.getValue();
    }

    /**
     * Finds a directive by name and, when {@code argument} is not null, by argument.
     */
    public DirectiveProp findDirective(String name, String argument) {
        for (TemplateProp prop : props) {
            if (prop instanceof DirectiveProp directive && directive.is(name, argument)) {
                return directive;
            }
        }
        return null;
    }

    public DirectiveProp findBinding(String argument) {
        return findDirective("bind", argument);
    }

    public boolean hasDirective(String name) {
        return findDirective(name, null) != null;
    }

    /**
     * The {@code @click} / {@code v-on:click} directive, or null.
     */
    public DirectiveProp findClickDirective() {
        return findDirective("on", "click");
    }

    /**
     * A {@code <template>} introducing slot-scope bindings, such as
     * {@code <template #item="{ data }">}.
     */
    public boolean isTemplateWithSlotScope() {
        if (!"template".equals(tag)) {
            return false;
        }
        DirectiveProp slot = findDirective("slot", null);
        return slot != null && slot.hasExpression();
    }

    /**
     * PascalCase or kebab-case tags name components rather than native elements.
     */
    public boolean isComponentLike() {
        return tag != null && !tag.isEmpty() && (Character.isUpperCase(tag.charAt(0)) || tag.contains("-"));
    }

    /**
     * Replaces any static or bound attribute called {@code name} with {@code value}: a static
     * attribute for literals, a bound template literal for templates.
     */
    public void upsertAttribute(String name, IdentifierValue value) {
        props.removeIf(prop -> (prop instanceof AttributeProp && prop.getName().equals(name))
                || (prop instanceof DirectiveProp directive && directive.is("bind", name)));
        if (value.isTemplate()) {
            props.add(new DirectiveProp("bind", name, "`" + value.getText() + "`", null, loc));
        } else {
            props.add(new AttributeProp(name, value.getText(), loc));
        }
    }
}
