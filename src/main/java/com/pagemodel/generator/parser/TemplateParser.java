package com.pagemodel.generator.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.expression.StaticValueExtractor;
import com.pagemodel.generator.model.AttributeProp;
import com.pagemodel.generator.model.DirectiveProp;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.ForNode;
import com.pagemodel.generator.model.IfBranchNode;
import com.pagemodel.generator.model.IfNode;
import com.pagemodel.generator.model.InterpolationNode;
import com.pagemodel.generator.model.RootNode;
import com.pagemodel.generator.model.SourceLocation;
import com.pagemodel.generator.model.TemplateNode;
import com.pagemodel.generator.model.TemplateProp;
import com.pagemodel.generator.model.TextNode;
import com.pagemodel.generator.parser.TemplateToken.RawAttribute;
import com.pagemodel.generator.parser.TemplateToken.TokenType;

/**
 * Parser for component templates.
 * Converts tokens into a node tree where:
 * - {@code v-for} elements are wrapped in a {@link ForNode}
 * - {@code v-if}/{@code v-else-if}/{@code v-else} siblings are grouped into an {@link IfNode}
 *   (outside any loop wrapper on the same element)
 * - comments are dropped
 */
public class TemplateParser {
    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    private static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "source", "track", "wbr");

    private static final Pattern FOR_EXPRESSION = Pattern.compile("([\\s\\S]*?)\\s+(?:in|of)\\s+(\\S[\\s\\S]*)");

    private final SourceText text;
    private final ExpressionClassifier classifier = new ExpressionClassifier();

    private List<TemplateToken> tokens;
    private int pos = 0;

    public TemplateParser(SourceText text) {
        this.text = text;
    }

    /**
     * Parses the {@code <template>} block of a single-file component.
     *
     * @return empty when the component has no template block
     */
    public static Optional<RootNode> parseComponent(String fileName, String content) {
        Optional<SfcTemplateExtractor.TemplateBlock> block = new SfcTemplateExtractor().extract(content);
        if (block.isEmpty()) {
            log.debug("No <template> block in {}", fileName);
            return Optional.empty();
        }
        TemplateParser parser = new TemplateParser(new SourceText(fileName, content));
        return Optional.of(parser.parse(block.get().getStart(), block.get().getEnd()));
    }

    /**
     * Parses a bare template string.
     */
    public static RootNode parseTemplate(String fileName, String template) {
        return new TemplateParser(new SourceText(fileName, template)).parse(0, template.length());
    }

    public RootNode parse(int start, int end) {
        tokens = new TemplateTokenizer(text, start, end).tokenize();
        pos = 0;

        RootNode root = new RootNode();
        root.setLoc(text.locationOf(start));

        Deque<ElementNode> openElements = new ArrayDeque<>();
        Deque<List<TemplateNode>> containers = new ArrayDeque<>();
        containers.push(root.getChildren());

        while (!isAtEnd()) {
            TemplateToken token = advance();
            switch (token.getType()) {
                case START_TAG -> {
                    ElementNode element = buildElement(token);
                    containers.peek().add(element);
                    if (!element.isSelfClosing()) {
                        openElements.push(element);
                        containers.push(element.getChildren());
                    }
                }
                case END_TAG -> closeElement(token, openElements, containers);
                case TEXT -> containers.peek().add(new TextNode(token.getValue(), text.locationOf(token.getOffset())));
                case INTERPOLATION -> containers.peek().add(
                        new InterpolationNode(token.getValue(), text.locationOf(token.getOffset())));
                default -> {
                    // comments are not part of the tree
                }
            }
        }

        if (!openElements.isEmpty()) {
            ElementNode unclosed = openElements.peek();
            throw new TemplateParseException("Element <" + unclosed.getTag() + "> is missing end tag",
                    text.getFileName(), unclosed.getLoc());
        }

        root.setChildren(structure(root.getChildren()));
        return root;
    }

    private void closeElement(TemplateToken token, Deque<ElementNode> openElements,
                              Deque<List<TemplateNode>> containers) {
        String name = token.getValue();
        boolean open = openElements.stream().anyMatch(element -> element.getTag().equalsIgnoreCase(name));
        if (!open) {
            throw new TemplateParseException("Invalid end tag </" + name + ">", text.getFileName(),
                    text.locationOf(token.getOffset()));
        }
        ElementNode element = openElements.pop();
        containers.pop();
        if (!element.getTag().equalsIgnoreCase(name)) {
            throw new TemplateParseException("Element <" + element.getTag() + "> is missing end tag",
                    text.getFileName(), element.getLoc());
        }
    }

    private ElementNode buildElement(TemplateToken token) {
        String tag = token.getValue();
        boolean selfClosing = token.isSelfClosing() || VOID_ELEMENTS.contains(tag.toLowerCase(Locale.ROOT));
        List<TemplateProp> props = new ArrayList<>();
        for (RawAttribute attribute : token.getAttributes()) {
            props.add(toProp(attribute));
        }
        return ElementNode.builder()
                .tag(tag)
                .props(props)
                .selfClosing(selfClosing)
                .loc(text.locationOf(token.getOffset()))
                .build();
    }

    private TemplateProp toProp(RawAttribute attribute) {
        String name = attribute.getName();
        SourceLocation loc = text.locationOf(attribute.getOffset());

        if (name.startsWith("v-")) {
            String rest = name.substring(2);
            int split = indexOfAny(rest, ':', '.');
            if (split < 0) {
                return new DirectiveProp(rest, null, attribute.getValue(), null, loc);
            }
            String directive = rest.substring(0, split);
            if (rest.charAt(split) == '.') {
                return new DirectiveProp(directive, null, attribute.getValue(), modifiers(rest.substring(split + 1)), loc);
            }
            return shorthandDirective(directive, rest.substring(split + 1), attribute.getValue(), loc);
        }
        if (name.length() > 1) {
            switch (name.charAt(0)) {
                case ':':
                    return shorthandDirective("bind", name.substring(1), attribute.getValue(), loc);
                case '.':
                    return shorthandDirective("bind", name.substring(1), attribute.getValue(), loc);
                case '@':
                    return shorthandDirective("on", name.substring(1), attribute.getValue(), loc);
                case '#':
                    return shorthandDirective("slot", name.substring(1), attribute.getValue(), loc);
                default:
                    break;
            }
        }
        return new AttributeProp(name, attribute.getValue(), loc);
    }

    /**
     * Splits {@code arg.mod1.mod2}; a bracketed dynamic argument may itself contain dots.
     */
    private DirectiveProp shorthandDirective(String directive, String argumentAndModifiers, String value,
                                             SourceLocation loc) {
        int argumentEnd;
        if (argumentAndModifiers.startsWith("[")) {
            int close = argumentAndModifiers.indexOf(']');
            argumentEnd = close < 0 ? argumentAndModifiers.length() : close + 1;
        } else {
            int dot = argumentAndModifiers.indexOf('.');
            argumentEnd = dot < 0 ? argumentAndModifiers.length() : dot;
        }
        String argument = argumentAndModifiers.substring(0, argumentEnd);
        List<String> modifiers = argumentEnd < argumentAndModifiers.length()
                ? modifiers(argumentAndModifiers.substring(argumentEnd + 1))
                : new ArrayList<>();
        return new DirectiveProp(directive, argument.isEmpty() ? null : argument, value, modifiers, loc);
    }

    private static List<String> modifiers(String raw) {
        List<String> modifiers = new ArrayList<>();
        for (String modifier : raw.split("\\.")) {
            if (!modifier.isEmpty()) {
                modifiers.add(modifier);
            }
        }
        return modifiers;
    }

    private static int indexOfAny(String value, char first, char second) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == first || c == second) {
                return i;
            }
        }
        return -1;
    }

    // ---- structural directives ----

    private List<TemplateNode> structure(List<TemplateNode> nodes) {
        List<TemplateNode> out = new ArrayList<>();
        IfNode currentIf = null;

        for (TemplateNode node : nodes) {
            if (node instanceof ElementNode element) {
                element.setChildren(structure(element.getChildren()));

                DirectiveProp vIf = element.findDirective("if", null);
                DirectiveProp vElseIf = element.findDirective("else-if", null);
                DirectiveProp vElse = element.findDirective("else", null);
                TemplateNode wrapped = wrapLoop(element);

                if (vIf != null) {
                    currentIf = new IfNode();
                    currentIf.setLoc(element.getLoc());
                    currentIf.getChildren().add(branch(vIf.trimmedExpression(), element, wrapped));
                    out.add(currentIf);
                } else if (vElseIf != null || vElse != null) {
                    if (currentIf == null) {
                        throw new TemplateParseException("v-else/v-else-if has no adjacent v-if or v-else-if",
                                text.getFileName(), element.getLoc());
                    }
                    String condition = vElseIf != null ? vElseIf.trimmedExpression() : null;
                    currentIf.getChildren().add(branch(condition, element, wrapped));
                    if (vElseIf == null) {
                        currentIf = null;
                    }
                } else {
                    currentIf = null;
                    out.add(wrapped);
                }
            } else if (node instanceof TextNode textNode && textNode.getContent().isBlank()) {
                if (currentIf == null) {
                    out.add(node);
                }
            } else {
                currentIf = null;
                out.add(node);
            }
        }
        return out;
    }

    private static IfBranchNode branch(String condition, ElementNode element, TemplateNode content) {
        IfBranchNode branch = new IfBranchNode(condition, element.getLoc());
        branch.getChildren().add(content);
        return branch;
    }

    private TemplateNode wrapLoop(ElementNode element) {
        DirectiveProp vFor = element.findDirective("for", null);
        if (vFor == null) {
            return element;
        }
        Matcher matcher = FOR_EXPRESSION.matcher(vFor.trimmedExpression());
        if (!matcher.matches()) {
            throw new TemplateParseException("Invalid v-for expression: " + vFor.trimmedExpression(),
                    text.getFileName(), vFor.getLoc());
        }
        String source = matcher.group(2).trim();
        List<String> aliases = parseAliases(matcher.group(1).trim());

        ForNode loop = ForNode.builder()
                .source(source)
                .valueAlias(aliases.size() > 0 ? aliases.get(0) : null)
                .keyAlias(aliases.size() > 1 ? aliases.get(1) : null)
                .indexAlias(aliases.size() > 2 ? aliases.get(2) : null)
                .constantSource(StaticValueExtractor.isConstant(classifier.tryParseExpression(source)))
                .loc(element.getLoc())
                .build();
        loop.getChildren().add(element);
        return loop;
    }

    private static List<String> parseAliases(String raw) {
        String aliases = raw;
        if (aliases.startsWith("(") && aliases.endsWith(")")) {
            aliases = aliases.substring(1, aliases.length() - 1);
        }
        if (aliases.isBlank()) {
            return List.of();
        }
        // destructured value aliases stay as one entry
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < aliases.length(); i++) {
            char c = aliases.charAt(i);
            if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(aliases.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(aliases.substring(start).trim());
        return parts;
    }

    // ---- token helpers ----

    private TemplateToken advance() {
        return tokens.get(pos++);
    }

    private boolean isAtEnd() {
        return tokens.get(pos).getType() == TokenType.EOF;
    }
}
