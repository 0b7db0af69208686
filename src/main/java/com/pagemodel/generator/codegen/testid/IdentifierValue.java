package com.pagemodel.generator.codegen.testid;

import com.pagemodel.generator.expression.TemplateText;

import lombok.NonNull;
import lombok.Value;

/**
 * Automation identifier: a literal string, or a template text containing {@code ${...}}
 * substitutions that is rendered as a bound template literal.
 */
@Value
public class IdentifierValue {

    public enum Kind {
        LITERAL,
        TEMPLATE
    }

    @NonNull
    Kind kind;
    @NonNull
    String text;

    public static IdentifierValue literal(String value) {
        return new IdentifierValue(Kind.LITERAL, value);
    }

    public static IdentifierValue template(String template) {
        return new IdentifierValue(Kind.TEMPLATE, template);
    }

    public boolean isTemplate() {
        return kind == Kind.TEMPLATE;
    }

    /**
     * Selector pattern used by page-object members: every substitution of a template is
     * normalized to {@code ${key}}, literals are returned as is.
     */
    public String toPattern() {
        return isTemplate() ? TemplateText.normalizeSubstitutions(text) : text;
    }

    public boolean isKeyed() {
        return toPattern().contains(TemplateText.KEY_PLACEHOLDER);
    }

    @Override
    public String toString() {
        return isTemplate() ? "`" + text + "`" : text;
    }
}
