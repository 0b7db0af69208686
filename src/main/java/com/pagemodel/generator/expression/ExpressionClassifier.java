package com.pagemodel.generator.expression;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.naming.NamingUtil;
import com.pagemodel.generator.expression.NamingSignal.Kind;
import com.pagemodel.generator.expression.ast.ArrowFunctionExpression;
import com.pagemodel.generator.expression.ast.AssignmentExpression;
import com.pagemodel.generator.expression.ast.BinaryExpression;
import com.pagemodel.generator.expression.ast.BlockStatement;
import com.pagemodel.generator.expression.ast.BooleanLiteral;
import com.pagemodel.generator.expression.ast.CallExpression;
import com.pagemodel.generator.expression.ast.ConditionalExpression;
import com.pagemodel.generator.expression.ast.ExpressionStatement;
import com.pagemodel.generator.expression.ast.Identifier;
import com.pagemodel.generator.expression.ast.JsNode;
import com.pagemodel.generator.expression.ast.MemberExpression;
import com.pagemodel.generator.expression.ast.NullLiteral;
import com.pagemodel.generator.expression.ast.NumericLiteral;
import com.pagemodel.generator.expression.ast.ObjectExpression;
import com.pagemodel.generator.expression.ast.ObjectProperty;
import com.pagemodel.generator.expression.ast.Program;
import com.pagemodel.generator.expression.ast.ReturnStatement;
import com.pagemodel.generator.expression.ast.SequenceExpression;
import com.pagemodel.generator.expression.ast.StringLiteral;
import com.pagemodel.generator.expression.ast.TemplateLiteral;

/**
 * Extracts stable naming tokens from directive source text.
 *
 * Every method is best effort: unparsable input yields null (or an empty name) and is
 * logged at debug level. Names are only ever derived from source structure, never from
 * runtime values or from identifiers this tool generated.
 */
public class ExpressionClassifier {
    private static final Logger log = LoggerFactory.getLogger(ExpressionClassifier.class);

    private static final int MAX_WORD_SOURCE_LENGTH = 24;
    private static final int MAX_SUFFIX_PARTS = 2;

    /**
     * Classifies an activation handler such as {@code @click} source.
     *
     * Priority: a literal emitted event name anywhere in the tree, then the handler shape
     * (modifier wrappers unwrapped, call callee, assignment target, member tail, identifier,
     * logical right operand, conditional branches, last sequence element, arrow bodies).
     *
     * @return the signal, or null when nothing stable was found
     */
    public NamingSignal classify(String source) {
        JsNode root = tryParse(source);
        if (root == null) {
            return null;
        }
        String emitted = findEmittedEventName(root);
        if (emitted != null) {
            return new NamingSignal(Kind.EMITTED_EVENT, emitted, null);
        }
        NamingSignal signal = classifyNode(root);
        if (signal == null || signal.getName() == null || signal.getName().isEmpty()) {
            log.debug("No naming signal in '{}'", source);
            return null;
        }
        return signal;
    }

    /**
     * Handler name of an activation directive, or an empty string.
     */
    public String clickHandlerName(String source) {
        NamingSignal signal = classify(source);
        return signal == null ? "" : signal.getName();
    }

    /**
     * Semantic hint of a {@code :handler} binding: a direct reference, a call name plus a
     * stable argument suffix, or {@code Set<Target><Value>} for assignments.
     */
    public String handlerBindingHint(String source) {
        JsNode expression = tryParseExpression(source);
        if (expression == null) {
            return null;
        }

        String direct = memberChainTail(expression);
        if (direct != null) {
            return NamingUtil.toPascalCase(direct);
        }

        String fromCall = hintFromCall(expression);
        if (fromCall != null) {
            return fromCall;
        }

        if (!(expression instanceof ArrowFunctionExpression arrow)) {
            return null;
        }
        JsNode body = arrow.getBody();

        String bodyCall = hintFromCall(body);
        if (bodyCall != null) {
            return bodyCall;
        }

        if (body instanceof AssignmentExpression assignment) {
            String target = assignmentTargetName(assignment.getLeft());
            if (target != null) {
                String rhs = stableWord(assignment.getRight());
                return "Set" + NamingUtil.toPascalCase(target) + (rhs == null ? "" : rhs);
            }
        }

        if (body instanceof BlockStatement block && !block.getBody().isEmpty()) {
            JsNode first = block.getBody().get(0);
            if (first instanceof ReturnStatement ret) {
                String fromReturn = hintFromCall(ret.getArgument());
                if (fromReturn != null) {
                    return fromReturn;
                }
            }
            if (first instanceof ExpressionStatement statement) {
                String fromStatement = hintFromCall(statement.getExpression());
                if (fromStatement != null) {
                    return fromStatement;
                }
            }
        }

        String bodyName = memberChainTail(body);
        return bodyName == null ? null : NamingUtil.toPascalCase(bodyName);
    }

    /**
     * Name behind a bound value or model attribute: assignment target, callee, member tail
     * or identifier.
     */
    public String valueBindingName(String source) {
        JsNode expression = tryParseExpression(source);
        if (expression == null) {
            return null;
        }
        String name = null;
        if (expression instanceof AssignmentExpression assignment) {
            JsNode left = assignment.getLeft();
            if (left instanceof Identifier id) {
                name = id.getName();
            } else if (left instanceof MemberExpression member) {
                name = memberProperty(member);
            }
        } else if (expression instanceof CallExpression call) {
            name = calleeName(call.getCallee());
        } else if (expression instanceof MemberExpression member) {
            name = memberProperty(member);
        } else if (expression instanceof Identifier id) {
            name = id.getName();
        }
        return name == null || name.isEmpty() ? null : name;
    }

    /**
     * Last identifier-like string literal or identifier of a condition, in source order.
     * {@code tab === 'details'} yields {@code details}.
     */
    public String stableConditionHint(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        JsNode expression = tryParseExpression(source.trim());
        if (expression == null) {
            return null;
        }
        List<String> found = new ArrayList<>();
        collectIdentifierish(expression, found);
        return found.isEmpty() ? null : found.get(found.size() - 1);
    }

    /**
     * Parses expression or statement source, returning null when it is outside the grammar.
     */
    public JsNode tryParse(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        try {
            return ExpressionParser.parseExpressionOrStatements(source.trim());
        } catch (ExpressionParseException e) {
            log.debug("Cannot parse '{}': {}", source, e.getMessage());
            return null;
        }
    }

    /**
     * Parses a single expression, returning null when it is outside the grammar.
     */
    public JsNode tryParseExpression(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        try {
            return new ExpressionParser(source.trim()).parseExpression();
        } catch (ExpressionParseException e) {
            log.debug("Cannot parse expression '{}': {}", source, e.getMessage());
            return null;
        }
    }

    // ---- activation handlers ----

    private NamingSignal classifyNode(JsNode node) {
        if (node == null) {
            return null;
        }
        if (node instanceof Program program) {
            return program.getBody().size() == 1 ? classifyStatement(program.getBody().get(0)) : null;
        }
        if (node instanceof ExpressionStatement statement) {
            return classifyNode(statement.getExpression());
        }
        if (node instanceof ArrowFunctionExpression arrow) {
            JsNode body = arrow.getBody();
            return body instanceof BlockStatement block ? classifyBlock(block) : classifyNode(body);
        }
        if (node instanceof CallExpression call) {
            JsNode callee = call.getCallee();
            if (callee instanceof Identifier id
                    && ("withModifiers".equals(id.getName()) || "_withModifiers".equals(id.getName()))) {
                return call.getArguments().isEmpty() ? null : classifyNode(call.getArguments().get(0));
            }
            String name = calleeName(callee);
            return name.isEmpty() ? null : new NamingSignal(Kind.CALL, name, stableSuffixFromCall(call));
        }
        if (node instanceof AssignmentExpression assignment) {
            String target = assignmentTargetName(assignment.getLeft());
            return target == null ? null
                    : new NamingSignal(Kind.ASSIGNMENT, target, stableWord(assignment.getRight()));
        }
        if (node instanceof MemberExpression member) {
            String tail = memberChainTail(member);
            return tail == null ? null : new NamingSignal(Kind.REFERENCE, tail, null);
        }
        if (node instanceof Identifier id) {
            return new NamingSignal(Kind.REFERENCE, id.getName(), null);
        }
        if (node instanceof BinaryExpression binary && binary.isLogical()) {
            return classifyNode(binary.getRight());
        }
        if (node instanceof ConditionalExpression conditional) {
            NamingSignal consequent = classifyNode(conditional.getConsequent());
            return consequent != null ? consequent : classifyNode(conditional.getAlternate());
        }
        if (node instanceof SequenceExpression sequence) {
            return classifyNode(sequence.last());
        }
        return null;
    }

    private NamingSignal classifyStatement(JsNode statement) {
        if (statement instanceof BlockStatement block) {
            return classifyBlock(block);
        }
        if (statement instanceof ReturnStatement ret) {
            return classifyNode(ret.getArgument());
        }
        return classifyNode(statement);
    }

    /**
     * Block bodies are classified from a leading return or from their only statement.
     */
    private NamingSignal classifyBlock(BlockStatement block) {
        List<JsNode> body = block.getBody();
        if (body.isEmpty()) {
            return null;
        }
        if (body.get(0) instanceof ReturnStatement ret) {
            return classifyNode(ret.getArgument());
        }
        return body.size() == 1 ? classifyStatement(body.get(0)) : null;
    }

    private String findEmittedEventName(JsNode node) {
        if (node == null) {
            return null;
        }
        if (node instanceof CallExpression call && isEmitCallee(call.getCallee()) && !call.getArguments().isEmpty()) {
            String literal = literalString(call.getArguments().get(0));
            if (literal != null) {
                return literal;
            }
        }
        for (JsNode child : node.children()) {
            String hit = findEmittedEventName(child);
            if (hit != null) {
                return hit;
            }
        }
        return null;
    }

    private boolean isEmitCallee(JsNode callee) {
        if (callee instanceof Identifier id) {
            return "emit".equals(id.getName()) || "$emit".equals(id.getName());
        }
        return callee instanceof MemberExpression member && !member.isComputed()
                && member.getProperty() instanceof Identifier property && "$emit".equals(property.getName());
    }

    // ---- handler bindings ----

    private String hintFromCall(JsNode node) {
        if (!(node instanceof CallExpression call)) {
            return null;
        }
        String name = memberChainTail(call.getCallee());
        if (name == null) {
            return null;
        }
        String suffix = stableSuffixFromCall(call);
        return NamingUtil.toPascalCase(name) + (suffix == null ? "" : suffix);
    }

    /**
     * Stable suffix from call arguments: sorted {@code <Key><Value>} pairs of an object
     * argument, else the words of the first one or two literal-like arguments.
     */
    private String stableSuffixFromCall(CallExpression call) {
        List<JsNode> args = call.getArguments();
        JsNode first = args.isEmpty() ? null : args.get(0);

        if (!(first instanceof ObjectExpression object)) {
            StringBuilder parts = new StringBuilder();
            for (JsNode arg : args.subList(0, Math.min(MAX_SUFFIX_PARTS, args.size()))) {
                String word = stableWord(arg);
                if (word == null) {
                    return null;
                }
                parts.append(word);
            }
            return parts.length() == 0 ? null : parts.toString();
        }

        List<String[]> parts = new ArrayList<>();
        for (JsNode node : object.getProperties()) {
            if (!(node instanceof ObjectProperty prop) || prop.isComputed()) {
                continue;
            }
            String key = prop.keyName();
            String value = literalWord(prop.getValue());
            if (key != null && value != null) {
                parts.add(new String[] {key, value});
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        return parts.stream()
                .sorted(Comparator.comparing(p -> p[0]))
                .limit(MAX_SUFFIX_PARTS)
                .map(p -> NamingUtil.toPascalCase(p[0]) + p[1])
                .collect(Collectors.joining(""));
    }

    /**
     * Word for a literal, a dotted constant or a PascalCase/UPPER_CASE identifier.
     * Lower-camel identifiers are variables and yield null.
     */
    private String stableWord(JsNode node) {
        String word = literalWord(node);
        if (word != null) {
            return word;
        }
        if (node instanceof TemplateLiteral template && !template.hasSubstitutions()) {
            return pascalWord(template.cooked());
        }
        if (node instanceof MemberExpression member) {
            String tail = memberChainTail(member);
            return tail == null ? null : pascalWord(tail);
        }
        if (node instanceof Identifier id && id.startsUpperCase()) {
            return pascalWord(id.getName());
        }
        return null;
    }

    private String literalWord(JsNode node) {
        if (node instanceof BooleanLiteral bool) {
            return bool.isValue() ? "True" : "False";
        }
        if (node instanceof NumericLiteral number) {
            return "Value" + number.getRaw();
        }
        if (node instanceof NullLiteral) {
            return "Null";
        }
        if (node instanceof StringLiteral str) {
            return pascalWord(str.getValue());
        }
        return null;
    }

    private String pascalWord(String text) {
        String cleaned = text == null ? "" : text.trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        String word = NamingUtil.toPascalCase(cleaned.substring(0, Math.min(MAX_WORD_SOURCE_LENGTH, cleaned.length())));
        return word.isEmpty() ? null : word;
    }

    // ---- shared helpers ----

    /**
     * {@code x} for identifiers, {@code c} for {@code a.b.c}, {@code b} for {@code a['b']}.
     */
    private String memberChainTail(JsNode node) {
        if (node instanceof Identifier id) {
            return id.getName();
        }
        if (node instanceof MemberExpression member) {
            if (!member.isComputed() && member.getProperty() instanceof Identifier property) {
                return property.getName();
            }
            if (member.isComputed() && member.getProperty() instanceof StringLiteral literal) {
                return literal.getValue();
            }
        }
        return null;
    }

    private String assignmentTargetName(JsNode left) {
        if (left instanceof Identifier id) {
            return id.getName();
        }
        if (left instanceof MemberExpression member) {
            // ref.value = ... names the ref
            if (!member.isComputed() && member.getProperty() instanceof Identifier property
                    && "value".equals(property.getName())) {
                return memberChainTail(member.getObject());
            }
            return memberChainTail(member);
        }
        return null;
    }

    private String calleeName(JsNode callee) {
        if (callee instanceof Identifier id) {
            return id.getName();
        }
        if (callee instanceof MemberExpression member) {
            return memberProperty(member);
        }
        return "";
    }

    private String memberProperty(MemberExpression member) {
        if (!member.isComputed() && member.getProperty() instanceof Identifier property) {
            return property.getName();
        }
        return "";
    }

    private String literalString(JsNode node) {
        if (node instanceof StringLiteral str) {
            return str.getValue();
        }
        if (node instanceof TemplateLiteral template && !template.hasSubstitutions()) {
            return template.cooked();
        }
        return null;
    }

    private void collectIdentifierish(JsNode node, List<String> found) {
        if (node == null) {
            return;
        }
        if (node instanceof StringLiteral str && isIdentifierish(str.getValue().trim())) {
            found.add(str.getValue().trim());
        } else if (node instanceof Identifier id && isIdentifierish(id.getName())) {
            found.add(id.getName());
        }
        for (JsNode child : node.children()) {
            collectIdentifierish(child, found);
        }
    }

    private boolean isIdentifierish(String value) {
        if (value.isEmpty() || !isAsciiLetter(value.charAt(0))) {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (!isAsciiLetter(ch) && !(ch >= '0' && ch <= '9') && ch != '_') {
                return false;
            }
        }
        return true;
    }

    private boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }
}
