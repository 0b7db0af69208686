package com.pagemodel.generator.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pagemodel.generator.expression.ExpressionToken.TokenType;
import com.pagemodel.generator.expression.ast.ArrayExpression;
import com.pagemodel.generator.expression.ast.ArrowFunctionExpression;
import com.pagemodel.generator.expression.ast.AssignmentExpression;
import com.pagemodel.generator.expression.ast.BinaryExpression;
import com.pagemodel.generator.expression.ast.BlockStatement;
import com.pagemodel.generator.expression.ast.BooleanLiteral;
import com.pagemodel.generator.expression.ast.CallExpression;
import com.pagemodel.generator.expression.ast.ConditionalExpression;
import com.pagemodel.generator.expression.ast.ExpressionStatement;
import com.pagemodel.generator.expression.ast.Identifier;
import com.pagemodel.generator.expression.ast.IfStatement;
import com.pagemodel.generator.expression.ast.JsNode;
import com.pagemodel.generator.expression.ast.MemberExpression;
import com.pagemodel.generator.expression.ast.NullLiteral;
import com.pagemodel.generator.expression.ast.NumericLiteral;
import com.pagemodel.generator.expression.ast.ObjectExpression;
import com.pagemodel.generator.expression.ast.ObjectProperty;
import com.pagemodel.generator.expression.ast.Program;
import com.pagemodel.generator.expression.ast.ReturnStatement;
import com.pagemodel.generator.expression.ast.SequenceExpression;
import com.pagemodel.generator.expression.ast.SpreadElement;
import com.pagemodel.generator.expression.ast.StringLiteral;
import com.pagemodel.generator.expression.ast.TemplateLiteral;
import com.pagemodel.generator.expression.ast.UnaryExpression;
import com.pagemodel.generator.expression.ast.VariableDeclaration;

/**
 * Recursive-descent parser for the expression subset found in template directives.
 *
 * Supported:
 * - literals, identifiers, member chains (including optional chaining), calls
 * - arrow functions with expression or block bodies
 * - unary, binary, logical, conditional, assignment and sequence expressions
 * - array and object literals, spread, template literals (substitutions parsed recursively)
 * - a statement fallback: blocks, if/else, return, single-name declarations
 *
 * TypeScript {@code as}/{@code satisfies} casts and non-null assertions are skipped.
 * Anything else raises {@link ExpressionParseException}.
 */
public class ExpressionParser {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", ">>>=", "&=", "|=", "^=",
            "&&=", "||=", "??=");

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("??", 1),
            Map.entry("||", 2),
            Map.entry("&&", 3),
            Map.entry("|", 4),
            Map.entry("^", 5),
            Map.entry("&", 6),
            Map.entry("==", 7), Map.entry("!=", 7), Map.entry("===", 7), Map.entry("!==", 7),
            Map.entry("<", 8), Map.entry(">", 8), Map.entry("<=", 8), Map.entry(">=", 8),
            Map.entry("instanceof", 8), Map.entry("in", 8),
            Map.entry("<<", 9), Map.entry(">>", 9), Map.entry(">>>", 9),
            Map.entry("+", 10), Map.entry("-", 10),
            Map.entry("*", 11), Map.entry("/", 11), Map.entry("%", 11),
            Map.entry("**", 12));

    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "-", "+", "~", "++", "--");
    private static final Set<String> PREFIX_KEYWORDS = Set.of("typeof", "void", "delete", "await");
    private static final Set<String> NON_NULL_FOLLOWERS = Set.of(".", "?.", ")", "]", ",", ";", "}", ":");

    private final List<ExpressionToken> tokens;
    private int pos = 0;

    public ExpressionParser(String source) {
        this.tokens = new ExpressionTokenizer(source).tokenize();
    }

    /**
     * Parses the source as one expression, trying the statement grammar when that fails.
     *
     * @throws ExpressionParseException when neither grammar accepts the text
     */
    public static JsNode parseExpressionOrStatements(String source) {
        try {
            return new ExpressionParser(source).parseExpression();
        } catch (ExpressionParseException e) {
            return new ExpressionParser(source).parseProgram();
        }
    }

    public JsNode parseExpression() {
        if (isAtEnd()) {
            throw new ExpressionParseException("Empty expression", peek().getPosition());
        }
        JsNode expression = parseSequence();
        if (!isAtEnd()) {
            throw unexpected();
        }
        return expression;
    }

    public Program parseProgram() {
        List<JsNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            if (checkPunctuator(";")) {
                advance();
                continue;
            }
            body.add(parseStatement());
        }
        return new Program(body);
    }

    // ---- statements ----

    private JsNode parseStatement() {
        ExpressionToken token = peek();
        if (token.isPunctuator("{")) {
            return parseBlock();
        }
        if (token.isIdentifier("if")) {
            advance();
            expectPunctuator("(");
            JsNode test = parseSequence();
            expectPunctuator(")");
            JsNode consequent = parseStatement();
            JsNode alternate = null;
            if (peek().isIdentifier("else")) {
                advance();
                alternate = parseStatement();
            }
            return new IfStatement(test, consequent, alternate);
        }
        if (token.isIdentifier("return")) {
            advance();
            JsNode argument = atStatementEnd() ? null : parseSequence();
            consumeTerminator();
            return new ReturnStatement(argument);
        }
        if (token.isIdentifier("const") || token.isIdentifier("let") || token.isIdentifier("var")) {
            return parseVariableDeclaration();
        }
        if (token.isIdentifier("function") || token.isIdentifier("for") || token.isIdentifier("while")
                || token.isIdentifier("switch") || token.isIdentifier("try")) {
            throw new ExpressionParseException("Unsupported statement '" + token.getValue() + "'",
                    token.getPosition());
        }
        JsNode expression = parseSequence();
        consumeTerminator();
        return new ExpressionStatement(expression);
    }

    private BlockStatement parseBlock() {
        expectPunctuator("{");
        List<JsNode> body = new ArrayList<>();
        while (!checkPunctuator("}")) {
            if (isAtEnd()) {
                throw new ExpressionParseException("Unterminated block", peek().getPosition());
            }
            if (checkPunctuator(";")) {
                advance();
                continue;
            }
            body.add(parseStatement());
        }
        expectPunctuator("}");
        return new BlockStatement(body);
    }

    private VariableDeclaration parseVariableDeclaration() {
        String kind = advance().getValue();
        ExpressionToken name = peek();
        if (name.getType() != TokenType.IDENTIFIER) {
            throw new ExpressionParseException("Destructuring declarations are not supported", name.getPosition());
        }
        advance();
        if (checkPunctuator(":")) {
            advance();
            skipType();
        }
        JsNode init = null;
        if (checkPunctuator("=")) {
            advance();
            init = parseAssignment();
        }
        if (checkPunctuator(",")) {
            throw new ExpressionParseException("Multiple declarators are not supported", peek().getPosition());
        }
        consumeTerminator();
        return new VariableDeclaration(kind, name.getValue(), init);
    }

    private boolean atStatementEnd() {
        ExpressionToken token = peek();
        return token.getType() == TokenType.EOF || token.isPunctuator(";") || token.isPunctuator("}")
                || token.isNewlineBefore();
    }

    private void consumeTerminator() {
        if (checkPunctuator(";")) {
            advance();
            return;
        }
        if (!atStatementEnd()) {
            throw unexpected();
        }
    }

    // ---- expressions ----

    private JsNode parseSequence() {
        JsNode first = parseAssignment();
        if (!checkPunctuator(",")) {
            return first;
        }
        List<JsNode> expressions = new ArrayList<>();
        expressions.add(first);
        while (checkPunctuator(",")) {
            advance();
            expressions.add(parseAssignment());
        }
        return new SequenceExpression(expressions);
    }

    private JsNode parseAssignment() {
        if (peek().isIdentifier("async") && isArrowAhead(pos + 1)) {
            advance();
        }
        if (isArrowAhead(pos)) {
            return parseArrow();
        }
        JsNode left = parseConditional();
        ExpressionToken token = peek();
        if (token.getType() == TokenType.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(token.getValue())) {
            advance();
            JsNode right = parseAssignment();
            return new AssignmentExpression(token.getValue(), left, right);
        }
        return left;
    }

    private boolean isArrowAhead(int index) {
        ExpressionToken token = tokenAt(index);
        if (token.getType() == TokenType.IDENTIFIER) {
            return tokenAt(index + 1).isPunctuator("=>");
        }
        if (!token.isPunctuator("(")) {
            return false;
        }
        int close = findClosingParen(index);
        if (close < 0) {
            return false;
        }
        ExpressionToken after = tokenAt(close + 1);
        // (a: string): void => ... return type annotation
        return after.isPunctuator("=>") || (after.isPunctuator(":") && findArrowAfterReturnType(close + 2) >= 0);
    }

    /**
     * Returns the index of {@code =>} when a simple return type annotation starts at {@code index}.
     */
    private int findArrowAfterReturnType(int index) {
        if (tokenAt(index).getType() == TokenType.IDENTIFIER && tokenAt(index + 1).isPunctuator("=>")) {
            return index + 1;
        }
        return -1;
    }

    private int findClosingParen(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            ExpressionToken token = tokens.get(i);
            if (token.isPunctuator("(") || token.isPunctuator("[") || token.isPunctuator("{")) {
                depth++;
            } else if (token.isPunctuator(")") || token.isPunctuator("]") || token.isPunctuator("}")) {
                depth--;
                if (depth == 0) {
                    return token.isPunctuator(")") ? i : -1;
                }
            } else if (token.getType() == TokenType.EOF) {
                return -1;
            }
        }
        return -1;
    }

    private ArrowFunctionExpression parseArrow() {
        List<String> params = new ArrayList<>();
        if (peek().getType() == TokenType.IDENTIFIER) {
            params.add(advance().getValue());
        } else {
            int close = findClosingParen(pos);
            advance();
            boolean expectName = true;
            int depth = 0;
            while (pos < close) {
                ExpressionToken token = advance();
                if (token.isPunctuator("(") || token.isPunctuator("[") || token.isPunctuator("{")) {
                    if (depth == 0 && expectName) {
                        params.add("_");
                        expectName = false;
                    }
                    depth++;
                } else if (token.isPunctuator(")") || token.isPunctuator("]") || token.isPunctuator("}")) {
                    depth--;
                } else if (depth == 0 && token.isPunctuator(",")) {
                    expectName = true;
                } else if (depth == 0 && expectName && token.getType() == TokenType.IDENTIFIER) {
                    params.add(token.getValue());
                    expectName = false;
                }
            }
            expectPunctuator(")");
            if (checkPunctuator(":")) {
                pos = findArrowAfterReturnType(pos);
            }
        }
        expectPunctuator("=>");
        JsNode body = checkPunctuator("{") ? parseBlock() : parseAssignment();
        return new ArrowFunctionExpression(params, body);
    }

    private JsNode parseConditional() {
        JsNode test = parseBinary(1);
        if (!checkPunctuator("?")) {
            return test;
        }
        advance();
        JsNode consequent = parseAssignment();
        expectPunctuator(":");
        JsNode alternate = parseAssignment();
        return new ConditionalExpression(test, consequent, alternate);
    }

    private JsNode parseBinary(int minPrecedence) {
        JsNode left = parseUnary();
        while (true) {
            ExpressionToken token = peek();
            if (token.isIdentifier("as") || token.isIdentifier("satisfies")) {
                advance();
                skipType();
                continue;
            }
            Integer precedence = binaryPrecedence(token);
            if (precedence == null || precedence < minPrecedence) {
                return left;
            }
            advance();
            // exponentiation is right-associative
            int next = "**".equals(token.getValue()) ? precedence : precedence + 1;
            JsNode right = parseBinary(next);
            left = new BinaryExpression(token.getValue(), left, right);
        }
    }

    private Integer binaryPrecedence(ExpressionToken token) {
        if (token.getType() == TokenType.PUNCTUATOR
                || token.isIdentifier("instanceof") || token.isIdentifier("in")) {
            return BINARY_PRECEDENCE.get(token.getValue());
        }
        return null;
    }

    private JsNode parseUnary() {
        ExpressionToken token = peek();
        if (token.getType() == TokenType.PUNCTUATOR && PREFIX_OPERATORS.contains(token.getValue())) {
            advance();
            return new UnaryExpression(token.getValue(), parseUnary(), true);
        }
        if (token.getType() == TokenType.IDENTIFIER && PREFIX_KEYWORDS.contains(token.getValue())
                && !startsExpressionEnd(tokenAt(pos + 1))) {
            advance();
            return new UnaryExpression(token.getValue(), parseUnary(), true);
        }
        if (token.isIdentifier("new")) {
            advance();
            return new UnaryExpression("new", parseUnary(), true);
        }
        return parsePostfix();
    }

    private boolean startsExpressionEnd(ExpressionToken token) {
        return token.getType() == TokenType.EOF || token.isPunctuator(")") || token.isPunctuator(",")
                || token.isPunctuator(";") || token.isPunctuator(".") || token.isPunctuator("=");
    }

    private JsNode parsePostfix() {
        JsNode expression = parseCallOrMember();
        ExpressionToken token = peek();
        if ((token.isPunctuator("++") || token.isPunctuator("--")) && !token.isNewlineBefore()) {
            advance();
            return new UnaryExpression(token.getValue(), expression, false);
        }
        return expression;
    }

    private JsNode parseCallOrMember() {
        JsNode expression = parsePrimary();
        while (true) {
            ExpressionToken token = peek();
            if (token.isPunctuator(".")) {
                advance();
                expression = new MemberExpression(expression, new Identifier(expectName()), false, false);
            } else if (token.isPunctuator("?.")) {
                advance();
                if (checkPunctuator("(")) {
                    expression = new CallExpression(expression, parseArguments(), true);
                } else if (checkPunctuator("[")) {
                    advance();
                    JsNode property = parseSequence();
                    expectPunctuator("]");
                    expression = new MemberExpression(expression, property, true, true);
                } else {
                    expression = new MemberExpression(expression, new Identifier(expectName()), false, true);
                }
            } else if (token.isPunctuator("[")) {
                advance();
                JsNode property = parseSequence();
                expectPunctuator("]");
                expression = new MemberExpression(expression, property, true, false);
            } else if (token.isPunctuator("(")) {
                expression = new CallExpression(expression, parseArguments(), false);
            } else if (token.getType() == TokenType.TEMPLATE) {
                advance();
                expression = new CallExpression(expression, List.of(parseTemplate(token)), false);
            } else if (token.isPunctuator("!") && !token.isNewlineBefore() && isNonNullAssertion()) {
                advance();
            } else {
                return expression;
            }
        }
    }

    private boolean isNonNullAssertion() {
        ExpressionToken next = tokenAt(pos + 1);
        return next.getType() == TokenType.EOF
                || (next.getType() == TokenType.PUNCTUATOR && NON_NULL_FOLLOWERS.contains(next.getValue()));
    }

    private List<JsNode> parseArguments() {
        expectPunctuator("(");
        List<JsNode> arguments = new ArrayList<>();
        while (!checkPunctuator(")")) {
            if (checkPunctuator("...")) {
                advance();
                arguments.add(new SpreadElement(parseAssignment()));
            } else {
                arguments.add(parseAssignment());
            }
            if (!checkPunctuator(")")) {
                expectPunctuator(",");
            }
        }
        expectPunctuator(")");
        return arguments;
    }

    private JsNode parsePrimary() {
        ExpressionToken token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new NumericLiteral(token.getValue());
            case STRING:
                advance();
                return new StringLiteral(token.getValue());
            case TEMPLATE:
                advance();
                return parseTemplate(token);
            case IDENTIFIER:
                return parseIdentifierLike(token);
            case PUNCTUATOR:
                if (token.isPunctuator("(")) {
                    advance();
                    JsNode inner = parseSequence();
                    expectPunctuator(")");
                    return inner;
                }
                if (token.isPunctuator("[")) {
                    return parseArray();
                }
                if (token.isPunctuator("{")) {
                    return parseObject();
                }
                throw unexpected();
            default:
                throw unexpected();
        }
    }

    private JsNode parseIdentifierLike(ExpressionToken token) {
        switch (token.getValue()) {
            case "true":
                advance();
                return new BooleanLiteral(true);
            case "false":
                advance();
                return new BooleanLiteral(false);
            case "null":
                advance();
                return new NullLiteral();
            case "function":
            case "class":
                throw new ExpressionParseException("Unsupported '" + token.getValue() + "' expression",
                        token.getPosition());
            default:
                advance();
                return new Identifier(token.getValue());
        }
    }

    private TemplateLiteral parseTemplate(ExpressionToken token) {
        String raw = token.getValue();
        TemplateText.Parts parts = TemplateText.split(raw);
        List<String> quasis = new ArrayList<>();
        for (String segment : parts.getSegments()) {
            quasis.add(TemplateText.cook(segment));
        }
        List<JsNode> expressions = new ArrayList<>();
        for (String substitution : parts.getSubstitutions()) {
            try {
                expressions.add(new ExpressionParser(substitution).parseExpression());
            } catch (ExpressionParseException e) {
                throw new ExpressionParseException("Invalid template substitution: " + e.getMessage(),
                        token.getPosition());
            }
        }
        return new TemplateLiteral(quasis, expressions, raw);
    }

    private ArrayExpression parseArray() {
        expectPunctuator("[");
        List<JsNode> elements = new ArrayList<>();
        while (!checkPunctuator("]")) {
            if (checkPunctuator(",")) {
                advance();
                elements.add(null);
                continue;
            }
            if (checkPunctuator("...")) {
                advance();
                elements.add(new SpreadElement(parseAssignment()));
            } else {
                elements.add(parseAssignment());
            }
            if (!checkPunctuator("]")) {
                expectPunctuator(",");
            }
        }
        expectPunctuator("]");
        return new ArrayExpression(elements);
    }

    private ObjectExpression parseObject() {
        expectPunctuator("{");
        List<JsNode> properties = new ArrayList<>();
        while (!checkPunctuator("}")) {
            if (checkPunctuator("...")) {
                advance();
                properties.add(new SpreadElement(parseAssignment()));
            } else {
                properties.add(parseProperty());
            }
            if (!checkPunctuator("}")) {
                expectPunctuator(",");
            }
        }
        expectPunctuator("}");
        return new ObjectExpression(properties);
    }

    private ObjectProperty parseProperty() {
        ExpressionToken token = peek();
        if (token.isPunctuator("[")) {
            advance();
            JsNode key = parseAssignment();
            expectPunctuator("]");
            expectPunctuator(":");
            return new ObjectProperty(key, parseAssignment(), true, false);
        }
        JsNode key;
        switch (token.getType()) {
            case IDENTIFIER:
                key = new Identifier(token.getValue());
                break;
            case STRING:
                key = new StringLiteral(token.getValue());
                break;
            case NUMBER:
                key = new NumericLiteral(token.getValue());
                break;
            default:
                throw unexpected();
        }
        advance();
        if (checkPunctuator(":")) {
            advance();
            return new ObjectProperty(key, parseAssignment(), false, false);
        }
        if (token.getType() != TokenType.IDENTIFIER) {
            throw unexpected();
        }
        if (checkPunctuator("(")) {
            throw new ExpressionParseException("Object methods are not supported", peek().getPosition());
        }
        return new ObjectProperty(key, key, false, true);
    }

    /**
     * Skips a TypeScript type: names, dotted names, generic arguments, array suffixes and unions.
     */
    private void skipType() {
        while (true) {
            ExpressionToken token = peek();
            if (token.getType() == TokenType.IDENTIFIER || token.getType() == TokenType.STRING
                    || token.getType() == TokenType.NUMBER) {
                advance();
            } else if (token.isPunctuator("<")) {
                skipBalanced("<", ">");
            } else if (token.isPunctuator("[")) {
                skipBalanced("[", "]");
            } else if (token.isPunctuator("{")) {
                skipBalanced("{", "}");
            } else {
                throw unexpected();
            }
            ExpressionToken next = peek();
            if (next.isPunctuator(".") || next.isPunctuator("|") || next.isPunctuator("&")) {
                advance();
                continue;
            }
            while (checkPunctuator("[") && tokenAt(pos + 1).isPunctuator("]")) {
                advance();
                advance();
            }
            if (checkPunctuator("<")) {
                skipBalanced("<", ">");
            }
            return;
        }
    }

    private void skipBalanced(String open, String close) {
        int depth = 0;
        while (!isAtEnd()) {
            ExpressionToken token = advance();
            if (token.isPunctuator(open)) {
                depth++;
            } else if (token.isPunctuator(close)) {
                depth--;
                if (depth == 0) {
                    return;
                }
            } else if ("<".equals(open) && token.isPunctuator(">>")) {
                depth -= 2;
                if (depth <= 0) {
                    return;
                }
            }
        }
        throw new ExpressionParseException("Unbalanced '" + open + "'", peek().getPosition());
    }

    // ---- token helpers ----

    private String expectName() {
        ExpressionToken token = peek();
        if (token.getType() != TokenType.IDENTIFIER) {
            throw unexpected();
        }
        advance();
        return token.getValue();
    }

    private ExpressionToken expectPunctuator(String text) {
        ExpressionToken token = peek();
        if (!token.isPunctuator(text)) {
            throw new ExpressionParseException("Expected '" + text + "' but found '" + token.getValue() + "'",
                    token.getPosition());
        }
        return advance();
    }

    private boolean checkPunctuator(String text) {
        return peek().isPunctuator(text);
    }

    private ExpressionToken peek() {
        return tokenAt(pos);
    }

    private ExpressionToken tokenAt(int index) {
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private ExpressionToken advance() {
        ExpressionToken token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ExpressionParseException unexpected() {
        ExpressionToken token = peek();
        String text = token.getType() == TokenType.EOF ? "end of input" : "'" + token.getValue() + "'";
        return new ExpressionParseException("Unexpected " + text, token.getPosition());
    }
}
