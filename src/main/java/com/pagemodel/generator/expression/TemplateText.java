package com.pagemodel.generator.expression;

import lombok.Value;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Brace-aware scanning of template-literal text ({@code a-${b}-c}) without evaluating the
 * substitutions.
 */
@UtilityClass
public class TemplateText {

    public final String KEY_PLACEHOLDER = "${key}";

    /**
     * Raw template split into literal segments and substitution sources.
     * {@code segments.size() == substitutions.size() + 1} always holds.
     */
    @Value
    public class Parts {
        List<String> segments;
        List<String> substitutions;
    }

    public Parts split(String raw) {
        List<String> segments = new ArrayList<>();
        List<String> substitutions = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                current.append(c).append(raw.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '$' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                int end = findClosingBrace(raw, i + 2);
                if (end < 0) {
                    current.append(raw, i, raw.length());
                    break;
                }
                segments.add(current.toString());
                current.setLength(0);
                substitutions.add(raw.substring(i + 2, end));
                i = end + 1;
                continue;
            }
            current.append(c);
            i++;
        }
        segments.add(current.toString());
        return new Parts(segments, substitutions);
    }

    public int countSubstitutions(String raw) {
        return split(raw).getSubstitutions().size();
    }

    /**
     * Replaces every substitution with {@code ${key}}, keeping literal text.
     */
    public String normalizeSubstitutions(String raw) {
        Parts parts = split(raw);
        StringBuilder sb = new StringBuilder(parts.getSegments().get(0));
        for (int i = 0; i < parts.getSubstitutions().size(); i++) {
            sb.append(KEY_PLACEHOLDER).append(parts.getSegments().get(i + 1));
        }
        return sb.toString();
    }

    /**
     * Applies escape sequences of a raw literal segment.
     */
    public String cook(String segment) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < segment.length()) {
            char c = segment.charAt(i);
            if (c == '\\') {
                i = ExpressionTokenizer.appendEscape(segment, i + 1, sb);
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private int findClosingBrace(String raw, int from) {
        int depth = 1;
        char quote = 0;
        for (int i = from; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
