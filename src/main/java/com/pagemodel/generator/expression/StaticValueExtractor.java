package com.pagemodel.generator.expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.pagemodel.generator.codegen.routing.RouteLocation;
import com.pagemodel.generator.expression.ast.ArrayExpression;
import com.pagemodel.generator.expression.ast.Identifier;
import com.pagemodel.generator.expression.ast.JsNode;
import com.pagemodel.generator.expression.ast.MemberExpression;
import com.pagemodel.generator.expression.ast.ObjectExpression;
import com.pagemodel.generator.expression.ast.ObjectProperty;
import com.pagemodel.generator.expression.ast.StringLiteral;
import com.pagemodel.generator.expression.ast.TemplateLiteral;

import lombok.experimental.UtilityClass;

/**
 * Reads statically provable values out of parsed expressions.
 */
@UtilityClass
public class StaticValueExtractor {

    private final Set<String> LABEL_KEYS = Set.of("text", "label", "name", "title");

    /**
     * Value of a string literal or a template literal without substitutions, else null.
     */
    public String staticString(JsNode node) {
        if (node instanceof StringLiteral str) {
            return str.getValue();
        }
        if (node instanceof TemplateLiteral template && !template.hasSubstitutions()) {
            return template.cooked();
        }
        return null;
    }

    /**
     * Values of a literal array of strings, de-duplicated in order with blanks skipped.
     * Holes, spreads or any non-literal element make the whole array non-static (null);
     * so does an array with no usable value.
     */
    public List<String> staticStringArray(JsNode node) {
        if (!(node instanceof ArrayExpression array)) {
            return null;
        }
        Set<String> values = new LinkedHashSet<>();
        for (JsNode element : array.getElements()) {
            String value = staticString(element);
            if (value == null) {
                return null;
            }
            if (!value.isBlank()) {
                values.add(value);
            }
        }
        return values.isEmpty() ? null : new ArrayList<>(values);
    }

    /**
     * Labels of an options array: plain strings, or objects with a literal
     * {@code text}/{@code label}/{@code name}/{@code title} field. Holes are skipped and blank
     * strings ignored; any other element makes the options non-static (null).
     */
    public List<String> staticOptionLabels(JsNode node) {
        if (!(node instanceof ArrayExpression array)) {
            return null;
        }
        List<String> labels = new ArrayList<>();
        for (JsNode element : array.getElements()) {
            if (element == null) {
                continue;
            }
            String literal = staticString(element);
            if (literal != null) {
                if (!literal.isBlank()) {
                    labels.add(literal);
                }
                continue;
            }
            if (!(element instanceof ObjectExpression object)) {
                return null;
            }
            ObjectProperty labelProperty = findLabelProperty(object);
            String label = labelProperty == null ? null : staticString(labelProperty.getValue());
            if (label == null || label.isBlank()) {
                return null;
            }
            labels.add(label);
        }
        return labels.isEmpty() ? null : labels;
    }

    /**
     * Route location of a navigation binding: a string path, or an object literal with a
     * literal {@code name} or {@code path}. Anything else is not statically known (null).
     */
    public RouteLocation routeLocation(JsNode node) {
        String path = staticString(node);
        if (node instanceof StringLiteral && path != null) {
            return RouteLocation.ofPath(path);
        }
        if (!(node instanceof ObjectExpression object)) {
            return null;
        }
        String name = literalField(object, "name");
        String routePath = literalField(object, "path");
        if (name == null && routePath == null) {
            return null;
        }
        RouteLocation.RouteLocationBuilder builder = RouteLocation.builder();
        if (name != null) {
            builder.name(name);
        } else {
            builder.path(routePath);
        }
        ObjectProperty params = object.findProperty("params");
        if (params != null && params.getValue() instanceof ObjectExpression paramObject) {
            Set<String> keys = new LinkedHashSet<>();
            for (JsNode entry : paramObject.getProperties()) {
                if (entry instanceof ObjectProperty prop && prop.keyName() != null) {
                    keys.add(prop.keyName());
                }
            }
            builder.paramKeys(keys);
        }
        return builder.build();
    }

    /**
     * True when the expression references no bindings, so its value is fixed at compile time.
     */
    public boolean isConstant(JsNode node) {
        if (node == null) {
            return false;
        }
        if (node instanceof Identifier) {
            return false;
        }
        if (node instanceof MemberExpression) {
            return false;
        }
        for (JsNode child : node.children()) {
            if (!isConstant(child) && !(node instanceof ObjectProperty prop && child == prop.getKey())) {
                return false;
            }
        }
        return true;
    }

    private String literalField(ObjectExpression object, String fieldName) {
        ObjectProperty property = object.findProperty(fieldName);
        if (property == null || !(property.getValue() instanceof StringLiteral literal)) {
            return null;
        }
        return literal.getValue();
    }

    private ObjectProperty findLabelProperty(ObjectExpression object) {
        for (JsNode entry : object.getProperties()) {
            if (entry instanceof ObjectProperty prop && prop.keyName() != null && LABEL_KEYS.contains(prop.keyName())) {
                return prop;
            }
        }
        return null;
    }
}
