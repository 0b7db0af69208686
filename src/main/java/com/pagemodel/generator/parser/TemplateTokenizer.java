package com.pagemodel.generator.parser;

import java.util.ArrayList;
import java.util.List;

import com.pagemodel.generator.parser.TemplateToken.RawAttribute;
import com.pagemodel.generator.parser.TemplateToken.TokenType;

/**
 * Tokenizer for template markup: tags with attributes, text, {@code {{ }}} interpolations
 * and comments. Offsets refer to the enclosing file so locations stay accurate.
 */
public class TemplateTokenizer {

    private final SourceText text;
    private final String source;
    private final int end;
    private int pos;

    public TemplateTokenizer(SourceText text, int start, int end) {
        this.text = text;
        this.source = text.getContent();
        this.pos = start;
        this.end = end;
    }

    /**
     * @throws TemplateParseException on unterminated tags, comments or interpolations
     */
    public List<TemplateToken> tokenize() {
        List<TemplateToken> tokens = new ArrayList<>();
        while (pos < end) {
            if (source.startsWith("<!--", pos)) {
                tokens.add(readComment());
            } else if (source.startsWith("</", pos) && pos + 2 < end && Character.isLetter(source.charAt(pos + 2))) {
                tokens.add(readEndTag());
            } else if (source.charAt(pos) == '<' && pos + 1 < end && Character.isLetter(source.charAt(pos + 1))) {
                tokens.add(readStartTag());
            } else if (source.startsWith("{{", pos)) {
                tokens.add(readInterpolation());
            } else {
                tokens.add(readText());
            }
        }
        tokens.add(new TemplateToken(TokenType.EOF, "", List.of(), false, end));
        return tokens;
    }

    private TemplateToken readComment() {
        int start = pos;
        int close = indexOf("-->", pos + 4);
        if (close < 0) {
            throw new TemplateParseException("Unterminated comment", text.getFileName(), text.locationOf(start));
        }
        pos = close + 3;
        return new TemplateToken(TokenType.COMMENT, source.substring(start + 4, close), List.of(), false, start);
    }

    private TemplateToken readEndTag() {
        int start = pos;
        pos += 2;
        String name = readTagName();
        int close = indexOf(">", pos);
        if (close < 0) {
            throw new TemplateParseException("Unterminated end tag </" + name, text.getFileName(), text.locationOf(start));
        }
        pos = close + 1;
        return new TemplateToken(TokenType.END_TAG, name, List.of(), false, start);
    }

    private TemplateToken readStartTag() {
        int start = pos;
        pos++;
        String name = readTagName();
        List<RawAttribute> attributes = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= end) {
                throw new TemplateParseException("Unterminated start tag <" + name, text.getFileName(), text.locationOf(start));
            }
            if (source.startsWith("/>", pos)) {
                pos += 2;
                return new TemplateToken(TokenType.START_TAG, name, attributes, true, start);
            }
            if (source.charAt(pos) == '>') {
                pos++;
                return new TemplateToken(TokenType.START_TAG, name, attributes, false, start);
            }
            attributes.add(readAttribute());
        }
    }

    private RawAttribute readAttribute() {
        int start = pos;
        int bracketDepth = 0;
        while (pos < end) {
            char c = source.charAt(pos);
            if (c == '[') {
                bracketDepth++;
            } else if (c == ']') {
                bracketDepth--;
            } else if (bracketDepth <= 0
                    && (Character.isWhitespace(c) || c == '=' || c == '>' || source.startsWith("/>", pos))) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            // stray character such as a lone '/'
            pos++;
            return new RawAttribute(source.substring(start, pos), null, start);
        }
        String name = source.substring(start, pos);
        skipWhitespace();
        if (pos >= end || source.charAt(pos) != '=') {
            return new RawAttribute(name, null, start);
        }
        pos++;
        skipWhitespace();
        return new RawAttribute(name, readAttributeValue(start), start);
    }

    private String readAttributeValue(int attributeStart) {
        if (pos >= end) {
            return "";
        }
        char quote = source.charAt(pos);
        if (quote == '"' || quote == '\'') {
            int close = indexOf(String.valueOf(quote), pos + 1);
            if (close < 0) {
                throw new TemplateParseException("Unterminated attribute value", text.getFileName(),
                        text.locationOf(attributeStart));
            }
            String value = source.substring(pos + 1, close);
            pos = close + 1;
            return value;
        }
        int start = pos;
        while (pos < end && !Character.isWhitespace(source.charAt(pos)) && source.charAt(pos) != '>') {
            pos++;
        }
        return source.substring(start, pos);
    }

    private TemplateToken readInterpolation() {
        int start = pos;
        int close = indexOf("}}", pos + 2);
        if (close < 0) {
            throw new TemplateParseException("Unterminated interpolation", text.getFileName(), text.locationOf(start));
        }
        pos = close + 2;
        return new TemplateToken(TokenType.INTERPOLATION, source.substring(start + 2, close).trim(), List.of(), false, start);
    }

    private TemplateToken readText() {
        int start = pos;
        pos++;
        while (pos < end) {
            char c = source.charAt(pos);
            if (c == '<' && pos + 1 < end) {
                char next = source.charAt(pos + 1);
                if (Character.isLetter(next) || next == '/' || next == '!') {
                    break;
                }
            }
            if (source.startsWith("{{", pos)) {
                break;
            }
            pos++;
        }
        return new TemplateToken(TokenType.TEXT, source.substring(start, pos), List.of(), false, start);
    }

    private String readTagName() {
        int start = pos;
        while (pos < end) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == '>' || c == '/') {
                break;
            }
            pos++;
        }
        return source.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < end && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private int indexOf(String needle, int from) {
        int index = source.indexOf(needle, from);
        return index < 0 || index + needle.length() > end ? -1 : index;
    }
}
