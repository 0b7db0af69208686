package com.pagemodel.generator.codegen.testid;

import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.expression.TemplateText;
import com.pagemodel.generator.expression.ast.JsNode;
import com.pagemodel.generator.expression.ast.StringLiteral;
import com.pagemodel.generator.expression.ast.TemplateLiteral;
import com.pagemodel.generator.model.AttributeProp;
import com.pagemodel.generator.model.DirectiveProp;
import com.pagemodel.generator.model.ElementNode;

import lombok.Value;

/**
 * Identifier attribute the author already wrote on an element.
 */
@Value
public class ExistingIdentifier {

    public enum Kind {
        /** Static attribute, string literal or template literal without substitutions. */
        LITERAL,
        /** Template literal with substitutions; {@code value} is the text between the backticks. */
        TEMPLATE,
        /** Any other bound expression; {@code value} is its source. */
        DYNAMIC
    }

    Kind kind;
    String value;
    int substitutionCount;

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    /**
     * Reads the static or bound identifier attribute.
     *
     * @return the identifier, or null when absent or empty
     */
    public static ExistingIdentifier find(ElementNode element, String attributeName, ExpressionClassifier classifier) {
        AttributeProp attribute = element.findAttribute(attributeName);
        if (attribute != null) {
            String value = attribute.getValue();
            return value == null || value.isEmpty() ? null : new ExistingIdentifier(Kind.LITERAL, value, 0);
        }

        DirectiveProp binding = element.findBinding(attributeName);
        if (binding == null || !binding.hasExpression()) {
            return null;
        }
        String source = binding.trimmedExpression();
        JsNode expression = classifier.tryParseExpression(source);

        if (expression instanceof TemplateLiteral template) {
            if (!template.hasSubstitutions()) {
                return new ExistingIdentifier(Kind.LITERAL, template.cooked(), 0);
            }
            return new ExistingIdentifier(Kind.TEMPLATE, template.getRaw(), template.getExpressions().size());
        }
        if (expression == null && source.length() >= 2 && source.startsWith("`") && source.endsWith("`")) {
            String raw = source.substring(1, source.length() - 1);
            int count = TemplateText.countSubstitutions(raw);
            return count == 0
                    ? new ExistingIdentifier(Kind.LITERAL, TemplateText.cook(raw), 0)
                    : new ExistingIdentifier(Kind.TEMPLATE, raw, count);
        }
        if (expression instanceof StringLiteral literal) {
            String value = literal.getValue();
            return value.isEmpty() ? null : new ExistingIdentifier(Kind.LITERAL, value, 0);
        }
        return new ExistingIdentifier(Kind.DYNAMIC, source, 0);
    }
}
