package com.pagemodel.generator.codegen.pom;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Parameter of a generated page-object method, described independently of any target
 * language: a name, a type ({@code string}, {@code number}, {@code boolean} or a union of
 * quoted literals) and an optional default.
 */
@Value
public class PomParameter {
    String name;
    String type;
    String defaultValue;

    public static PomParameter key(List<String> literalValues) {
        if (literalValues == null || literalValues.isEmpty()) {
            return new PomParameter("key", "string", null);
        }
        String union = literalValues.stream()
                .map(PomParameter::quote)
                .collect(Collectors.joining(" | "));
        return new PomParameter("key", union, null);
    }

    public static PomParameter text() {
        return new PomParameter("text", "string", null);
    }

    public static PomParameter value() {
        return new PomParameter("value", "string", null);
    }

    public static PomParameter annotationText() {
        return new PomParameter("annotationText", "string", "\"\"");
    }

    public static PomParameter timeOut() {
        return new PomParameter("timeOut", "number", "500");
    }

    public static PomParameter waitForIt() {
        return new PomParameter("wait", "boolean", "true");
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String toString() {
        return name + ": " + type + (hasDefault() ? " = " + defaultValue : "");
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }
}
