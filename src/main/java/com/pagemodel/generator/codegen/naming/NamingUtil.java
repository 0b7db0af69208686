package com.pagemodel.generator.codegen.naming;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility for the naming conventions shared by identifiers and page-object members.
 */
public class NamingUtil {

    private static final Pattern TEMPLATE_SUBSTITUTION = Pattern.compile("\\$\\{[^}]*\\}");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern INTERNAL_CAPS = Pattern.compile("[a-z][A-Z]");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts free text to PascalCase. Template substitutions and punctuation are dropped;
     * words that are already camelCase keep their internal capitals.
     */
    public static String toPascalCase(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = NON_ALPHANUMERIC.matcher(TEMPLATE_SUBSTITUTION.matcher(text).replaceAll(" "))
                .replaceAll(" ")
                .trim();
        if (cleaned.isEmpty()) {
            return "";
        }
        return Arrays.stream(cleaned.split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> INTERNAL_CAPS.matcher(word).find()
                        ? upperFirst(word)
                        : upperFirst(word.toLowerCase()))
                .collect(Collectors.joining(""));
    }

    /**
     * Route-name key: every alphanumeric run starts upper-case, the rest is kept as written.
     * {@code "tenant details"} becomes {@code TenantDetails}.
     */
    public static String toPascalCaseRouteKey(String value) {
        StringBuilder out = new StringBuilder();
        boolean newWord = true;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (!isAsciiLetterOrDigit(ch)) {
                newWord = true;
                continue;
            }
            out.append(newWord ? Character.toUpperCase(ch) : ch);
            newWord = false;
        }
        return out.toString();
    }

    /**
     * Converts kebab or snake text to a group-option segment: {@code first-name} becomes
     * {@code FirstName}, tails are kept as written.
     */
    public static String toGroupOptionSegment(String text) {
        if (text == null) {
            return "";
        }
        return Arrays.stream(text.replaceAll("[-_]", " ").split(" "))
                .filter(word -> !word.isEmpty())
                .map(NamingUtil::upperFirst)
                .collect(Collectors.joining(""));
    }

    public static String upperFirst(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * Reduces a name to Java identifier characters. Empty input becomes {@code Element};
     * a leading digit gets a {@code Value} prefix.
     */
    public static String toSafeMemberName(String name) {
        String stripped = stripNonIdentifierChars(name);
        if (stripped.isEmpty()) {
            return "Element";
        }
        if (Character.isDigit(stripped.charAt(0))) {
            return "Value" + stripped;
        }
        return stripped;
    }

    public static String stripNonIdentifierChars(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (isAsciiLetterOrDigit(ch) || ch == '_') {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * True when {@code name} already ends with {@code suffix} or is the suffix plus digits
     * ({@code Button2}).
     */
    public static boolean hasRoleSuffix(String name, String suffix) {
        if (name == null || suffix == null || suffix.isEmpty()) {
            return false;
        }
        return name.endsWith(suffix) || name.matches(Pattern.quote(suffix) + "\\d+");
    }

    private static boolean isAsciiLetterOrDigit(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
    }
}
