package com.pagemodel.generator.expression;

import com.pagemodel.generator.expression.ExpressionToken.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for directive and attribute expression source text.
 * Regular-expression literals are not recognized; {@code /} is always an operator.
 */
public class ExpressionTokenizer {

    // Longest first so that greedy matching works.
    private static final String[] PUNCTUATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
        "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "**", "<<", ">>",
        "(", ")", "{", "}", "[", "]", ";", ",", ".", "?", ":", "+", "-", "*", "/", "%",
        "<", ">", "=", "!", "&", "|", "^", "~"
    };

    private final String source;
    private int pos = 0;
    private boolean sawNewline = false;

    public ExpressionTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Tokenize the entire source text.
     *
     * @throws ExpressionParseException on unterminated strings or unknown characters
     */
    public List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new ExpressionToken(TokenType.EOF, "", pos, sawNewline));
                return tokens;
            }
            tokens.add(nextToken());
            sawNewline = false;
        }
    }

    private ExpressionToken nextToken() {
        int start = pos;
        char c = source.charAt(pos);

        if (c == '"' || c == '\'') {
            return new ExpressionToken(TokenType.STRING, readStringLiteral(c), start, sawNewline);
        }
        if (c == '`') {
            return new ExpressionToken(TokenType.TEMPLATE, readTemplateLiteral(), start, sawNewline);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return new ExpressionToken(TokenType.NUMBER, readNumber(), start, sawNewline);
        }
        if (isIdentifierStart(c)) {
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return new ExpressionToken(TokenType.IDENTIFIER, source.substring(start, pos), start, sawNewline);
        }
        for (String punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator, pos)) {
                // "?." followed by a digit is a conditional operator and a number (a ?.5 : b)
                if ("?.".equals(punctuator) && pos + 2 < source.length() && Character.isDigit(source.charAt(pos + 2))) {
                    continue;
                }
                pos += punctuator.length();
                return new ExpressionToken(TokenType.PUNCTUATOR, punctuator, start, sawNewline);
            }
        }
        throw new ExpressionParseException("Unexpected character '" + c + "'", start);
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n' || c == '\r') {
                sawNewline = true;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (source.startsWith("//", pos)) {
                int end = source.indexOf('\n', pos);
                pos = end < 0 ? source.length() : end;
            } else if (source.startsWith("/*", pos)) {
                int end = source.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new ExpressionParseException("Unterminated comment", pos);
                }
                if (source.substring(pos, end).indexOf('\n') >= 0) {
                    sawNewline = true;
                }
                pos = end + 2;
            } else {
                return;
            }
        }
    }

    private String readStringLiteral(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                return sb.toString();
            }
            if (c == '\\') {
                pos++;
                pos = appendEscape(source, pos, sb);
                continue;
            }
            if (c == '\n') {
                break;
            }
            sb.append(c);
            pos++;
        }
        throw new ExpressionParseException("Unterminated string literal", start);
    }

    /**
     * Reads a template literal and returns its raw text without the backticks.
     * Substitutions are kept verbatim and split later by the parser.
     */
    private String readTemplateLiteral() {
        int start = pos;
        pos++;
        int contentStart = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '`') {
                String raw = source.substring(contentStart, pos);
                pos++;
                return raw;
            }
            if (c == '$' && pos + 1 < source.length() && source.charAt(pos + 1) == '{') {
                pos = skipSubstitution(pos + 2);
                continue;
            }
            pos++;
        }
        throw new ExpressionParseException("Unterminated template literal", start);
    }

    /**
     * Skips a {@code ${...}} body starting right after the opening brace and returns the
     * position after the matching closing brace.
     */
    private int skipSubstitution(int from) {
        int depth = 1;
        int i = from;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                int saved = pos;
                pos = i;
                readStringLiteral(c);
                i = pos;
                pos = saved;
                continue;
            }
            if (c == '`') {
                int saved = pos;
                pos = i;
                readTemplateLiteral();
                i = pos;
                pos = saved;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        throw new ExpressionParseException("Unterminated template substitution", from);
    }

    private String readNumber() {
        int start = pos;
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)
                || source.startsWith("0b", pos) || source.startsWith("0B", pos)
                || source.startsWith("0o", pos) || source.startsWith("0O", pos)) {
            pos += 2;
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return source.substring(start, pos);
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c) || c == '.' || c == '_') {
                pos++;
            } else if ((c == 'e' || c == 'E') && pos + 1 < source.length()) {
                pos++;
                if (source.charAt(pos) == '+' || source.charAt(pos) == '-') {
                    pos++;
                }
            } else {
                break;
            }
        }
        if (pos < source.length() && source.charAt(pos) == 'n') {
            pos++;
        }
        return source.substring(start, pos);
    }

    /**
     * Appends the character denoted by the escape sequence at {@code index} (just past the
     * backslash) and returns the index after the sequence.
     */
    static int appendEscape(String text, int index, StringBuilder sb) {
        if (index >= text.length()) {
            return index;
        }
        char e = text.charAt(index);
        switch (e) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\u000B');
            case '0' -> sb.append('\0');
            case '\r', '\n' -> {
                // line continuation
            }
            case 'u' -> {
                if (index + 5 <= text.length()
                        && text.substring(index + 1, index + 5).chars().allMatch(ExpressionTokenizer::isHexDigit)) {
                    sb.append((char) Integer.parseInt(text.substring(index + 1, index + 5), 16));
                    return index + 5;
                }
                sb.append('u');
            }
            default -> sb.append(e);
        }
        return index + 1;
    }

    private static boolean isHexDigit(int c) {
        return Character.digit(c, 16) >= 0;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '$' || c == '_' || Character.isLetterOrDigit(c);
    }
}
