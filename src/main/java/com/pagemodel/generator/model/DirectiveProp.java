package com.pagemodel.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Directive such as {@code :to="..."} (name {@code bind}, argument {@code to}),
 * {@code @click.prevent="..."} (name {@code on}, argument {@code click}, modifier
 * {@code prevent}) or {@code v-model="..."}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DirectiveProp extends TemplateProp {
    private String argument;
    /** Raw expression source, or null when the directive has no value. */
    private String expression;
    private List<String> modifiers = new ArrayList<>();

    public DirectiveProp(String name, String argument, String expression, List<String> modifiers, SourceLocation loc) {
        super(name, loc);
        this.argument = argument;
        this.expression = expression;
        this.modifiers = modifiers != null ? modifiers : new ArrayList<>();
    }

    public boolean is(String directiveName, String directiveArgument) {
        if (!name.equals(directiveName)) {
            return false;
        }
        return directiveArgument == null || directiveArgument.equals(argument);
    }

    public boolean hasExpression() {
        return expression != null && !expression.isBlank();
    }

    public String trimmedExpression() {
        return expression == null ? "" : expression.trim();
    }
}
