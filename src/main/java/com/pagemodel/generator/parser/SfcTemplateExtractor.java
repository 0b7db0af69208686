package com.pagemodel.generator.parser;

import java.util.Locale;
import java.util.Optional;

import lombok.Value;

/**
 * Locates the top-level {@code <template>} block of a single-file component, skipping
 * comments and {@code <script>} / {@code <style>} blocks.
 */
public class SfcTemplateExtractor {

    /**
     * Content range of the template block, exclusive of its own tags.
     */
    @Value
    public static class TemplateBlock {
        int start;
        int end;
        /** Offset of the opening {@code <template} tag. */
        int tagOffset;
    }

    public Optional<TemplateBlock> extract(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        int pos = 0;
        while (pos < content.length()) {
            int open = content.indexOf('<', pos);
            if (open < 0) {
                break;
            }
            if (content.startsWith("<!--", open)) {
                int close = content.indexOf("-->", open + 4);
                if (close < 0) {
                    break;
                }
                pos = close + 3;
                continue;
            }
            String name = tagNameAt(lower, open + 1);
            int tagEnd = content.indexOf('>', open);
            if (tagEnd < 0) {
                break;
            }
            if ("template".equals(name)) {
                int close = findMatchingClose(lower, tagEnd + 1);
                if (close < 0) {
                    return Optional.empty();
                }
                return Optional.of(new TemplateBlock(tagEnd + 1, close, open));
            }
            if ("script".equals(name) || "style".equals(name)) {
                int close = lower.indexOf("</" + name, tagEnd + 1);
                pos = close < 0 ? content.length() : close + name.length() + 2;
                continue;
            }
            pos = tagEnd + 1;
        }
        return Optional.empty();
    }

    private static int findMatchingClose(String lower, int from) {
        int depth = 1;
        int pos = from;
        while (pos < lower.length()) {
            int nextOpen = indexOfTag(lower, "<template", pos);
            int nextClose = lower.indexOf("</template", pos);
            if (nextClose < 0) {
                return -1;
            }
            if (nextOpen >= 0 && nextOpen < nextClose) {
                int tagEnd = lower.indexOf('>', nextOpen);
                if (tagEnd < 0) {
                    return -1;
                }
                if (lower.charAt(tagEnd - 1) != '/') {
                    depth++;
                }
                pos = tagEnd + 1;
            } else {
                depth--;
                if (depth == 0) {
                    return nextClose;
                }
                pos = nextClose + "</template".length();
            }
        }
        return -1;
    }

    private static int indexOfTag(String lower, String tag, int from) {
        int index = lower.indexOf(tag, from);
        while (index >= 0) {
            int after = index + tag.length();
            if (after >= lower.length() || !isNameChar(lower.charAt(after))) {
                return index;
            }
            index = lower.indexOf(tag, after);
        }
        return -1;
    }

    private static String tagNameAt(String lower, int from) {
        int pos = from;
        while (pos < lower.length() && isNameChar(lower.charAt(pos))) {
            pos++;
        }
        return lower.substring(from, pos);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_';
    }
}
