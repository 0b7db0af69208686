package com.pagemodel.generator.codegen.testid;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.TestIdGenerationException;
import com.pagemodel.generator.codegen.naming.NamingUtil;
import com.pagemodel.generator.codegen.role.RoleConfig;
import com.pagemodel.generator.codegen.routing.NavigationTargetResolver;
import com.pagemodel.generator.codegen.routing.RouteLocation;
import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.expression.StaticValueExtractor;
import com.pagemodel.generator.expression.ast.CallExpression;
import com.pagemodel.generator.expression.ast.JsNode;
import com.pagemodel.generator.expression.ast.MemberExpression;
import com.pagemodel.generator.expression.ast.ObjectExpression;
import com.pagemodel.generator.expression.ast.ObjectProperty;
import com.pagemodel.generator.expression.ast.TemplateLiteral;
import com.pagemodel.generator.model.AttributeProp;
import com.pagemodel.generator.model.DirectiveProp;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.TemplateNode;
import com.pagemodel.generator.model.TextNode;

/**
 * Derives automation identifiers from an element's role and directives. Each category method
 * returns null when the element does not belong to it; callers try them in order and take
 * the first match. Identifiers embed at most one substitution.
 */
public class IdentifierSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(IdentifierSynthesizer.class);

    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");
    private static final Pattern PUNCTUATION = Pattern.compile("[\"'`;:.,!?_—\\-\\\\/]");
    private static final Pattern NON_LETTER = Pattern.compile("[^a-zA-Z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_CLICK_SUFFIX = Pattern.compile("[^A-Za-z-]");

    private final ExpressionClassifier classifier;
    private final NavigationTargetResolver navigationTargetResolver;

    public IdentifierSynthesizer(ExpressionClassifier classifier, NavigationTargetResolver navigationTargetResolver) {
        this.classifier = classifier;
        this.navigationTargetResolver = navigationTargetResolver;
    }

    /**
     * Configured wrapper bound to a value attribute or a model:
     * {@code <unit>-<value>-<role>}. Button wrappers with their own click handler are left to
     * the click category.
     */
    public SynthesizedIdentifier wrapper(ElementNode element, ElementSignals signals) {
        RoleConfig config = signals.getRole().getConfig();
        if (config == null) {
            return null;
        }
        String role = config.getRole();
        if (element.findClickDirective() != null && "button".equals(role)) {
            return null;
        }
        String unit = signals.getUnitName();

        if (config.hasValueAttribute()) {
            return fromValueAttribute(element, signals, config.getValueAttribute(), unit, role);
        }

        DirectiveProp model = element.findDirective("model", null);
        String vModel = model != null && model.hasExpression()
                ? NamingUtil.toPascalCase(model.trimmedExpression())
                : "";
        DirectiveProp modelValueBinding = element.findBinding("modelValue");
        if (modelValueBinding == null) {
            modelValueBinding = element.findBinding("model-value");
        }
        String modelValue = modelValueBinding != null && modelValueBinding.hasExpression()
                ? classifier.valueBindingName(modelValueBinding.trimmedExpression())
                : null;
        if (vModel.isEmpty() && isEmpty(modelValue)) {
            return null;
        }

        String groupOption = NamingUtil.toGroupOptionSegment(vModel);
        String hint = !isEmpty(modelValue) ? modelValue : vModel;
        SynthesizedIdentifier.SynthesizedIdentifierBuilder result = SynthesizedIdentifier.builder()
                .identifier(IdentifierValue.literal(unit + "-" + (!isEmpty(modelValue) ? modelValue : groupOption)
                        + "-" + role));
        withHints(result, hint, signals);
        if (config.isRequiresOptionPrefix()) {
            result.optionPrefix(IdentifierValue.literal(unit + "-" + (!groupOption.isEmpty() ? groupOption : modelValue)));
        }
        return result.build();
    }

    private SynthesizedIdentifier fromValueAttribute(ElementNode element, ElementSignals signals, String attribute,
                                                     String unit, String role) {
        AttributeProp staticValue = element.findAttribute(attribute);
        if (staticValue != null) {
            String value = staticValue.getValue() == null ? "" : staticValue.getValue();
            SynthesizedIdentifier.SynthesizedIdentifierBuilder result = SynthesizedIdentifier.builder()
                    .identifier(IdentifierValue.literal(unit + "-" + value + "-" + role));
            withHints(result, value.isEmpty() ? null : value, signals);
            return result.build();
        }

        DirectiveProp bound = element.findBinding(attribute);
        if (bound == null || !bound.hasExpression()) {
            return null;
        }
        String source = bound.trimmedExpression();
        JsNode expression = classifier.tryParseExpression(source);
        if (expression == null) {
            return null;
        }

        IdentifierValue identifier;
        if (expression instanceof MemberExpression) {
            identifier = IdentifierValue.literal(unit + "-" + source.replace(".", "") + "-" + role);
        } else if (expression instanceof CallExpression) {
            identifier = IdentifierValue.template(unit + "-${" + source + "}-" + role);
        } else {
            identifier = IdentifierValue.literal(unit + "-" + source + "-" + role);
        }
        String name = classifier.valueBindingName(source);
        SynthesizedIdentifier.SynthesizedIdentifierBuilder result = SynthesizedIdentifier.builder().identifier(identifier);
        withHints(result, name != null ? name : source, signals);
        return result.build();
    }

    /**
     * Navigation ({@code :to}): keyed template, literal route name (plus inner text), or a
     * template embedding the location expression.
     */
    public SynthesizedIdentifier navigation(ElementNode element, ElementSignals signals) {
        DirectiveProp to = element.findBinding("to");
        if (to == null || !to.hasExpression()) {
            return null;
        }
        String source = to.trimmedExpression();
        String unit = signals.getUnitName();
        String suffix = signals.getRole().getTagSuffix();
        JsNode expression = classifier.tryParseExpression(source);
        String routeName = routeNameOf(expression);

        IdentifierValue identifier;
        if (signals.isKeyed()) {
            identifier = IdentifierValue.template(unit + "-" + signals.getKeyPlaceholder() + suffix);
        } else if (routeName != null) {
            String name = routeName;
            String innerText = innerText(element);
            if (!innerText.isEmpty() && !name.contains(innerText)) {
                name += "-" + innerText;
            }
            identifier = IdentifierValue.literal(unit + "-" + name + suffix);
        } else if (expression instanceof TemplateLiteral) {
            identifier = IdentifierValue.template(unit + "-${" + source + ".replaceAll(' ', '')}" + suffix);
        } else {
            identifier = IdentifierValue.template(unit + "-${" + source + "?.name?.replaceAll(' ', '') ?? ''}" + suffix);
        }

        RouteLocation location = StaticValueExtractor.routeLocation(expression);
        String target = location == null ? null : navigationTargetResolver.resolveNavigationTarget(location);
        if (location != null && target == null) {
            log.debug("No navigation target for {} in {}", source, unit);
        }

        String hint = firstNonEmpty(routeName, target, signals.getConditionalHint());
        return SynthesizedIdentifier.builder()
                .identifier(identifier)
                .hint(hint)
                .target(target)
                .mergeKey(routeName != null ? "to:name:" + routeName : "to:expr:" + source)
                .build();
    }

    /**
     * Generic {@code :handler} binding: {@code <unit>_<hint>[-<key>]<suffix>}.
     */
    public SynthesizedIdentifier handlerBinding(ElementNode element, ElementSignals signals) {
        DirectiveProp handler = element.findBinding("handler");
        if (handler == null || !handler.hasExpression()) {
            return null;
        }
        String source = handler.trimmedExpression();
        String hint = classifier.handlerBindingHint(source);
        if (hint == null) {
            return null;
        }
        String unit = signals.getUnitName();
        String suffix = signals.getRole().getTagSuffix();
        IdentifierValue identifier = signals.isKeyed()
                ? IdentifierValue.template(unit + "_" + hint + "-" + signals.getKeyPlaceholder() + suffix)
                : IdentifierValue.literal(unit + "_" + hint + suffix);
        return SynthesizedIdentifier.builder()
                .identifier(identifier)
                .hint(firstNonEmpty(hint, signals.getConditionalHint()))
                .mergeKey("handler:expr:" + source)
                .build();
    }

    /**
     * Activation handler ({@code @click}): {@code <unit>[-<key>]-<Handler><suffix>}; the
     * handler segment is empty when nothing stable can be classified.
     */
    public SynthesizedIdentifier click(ElementNode element, ElementSignals signals) {
        DirectiveProp click = element.findClickDirective();
        if (click == null) {
            return null;
        }
        String clickSuffix = clickSuffix(click);
        String unit = signals.getUnitName();
        String suffix = signals.getRole().getTagSuffix();
        IdentifierValue identifier = signals.isKeyed()
                ? IdentifierValue.template(unit + "-" + signals.getKeyPlaceholder() + clickSuffix + suffix)
                : IdentifierValue.literal(unit + clickSuffix + suffix);

        String clickHint = trimLeadingSeparators(clickSuffix);
        return SynthesizedIdentifier.builder()
                .identifier(identifier)
                .hint(firstNonEmpty(clickHint, idOrName(element), signals.getConditionalHint()))
                .mergeKey(clickHint.isEmpty() ? null : "click:hint:" + clickHint)
                .build();
    }

    /**
     * Submit control: {@code <unit>-<idOrName | innerText><suffix>}.
     *
     * @throws TestIdGenerationException when the control has neither id/name nor inner text
     */
    public SynthesizedIdentifier submit(ElementNode element, ElementSignals signals) {
        if (!"submit".equals(element.attributeValue("type"))) {
            return null;
        }
        String identity = firstNonEmpty(idOrName(element), innerText(element));
        if (identity == null) {
            throw new TestIdGenerationException(TestIdGenerationException.Kind.SUBMIT_WITHOUT_IDENTITY,
                    signals.getUnitName(), signals.getFileName(), signals.getLocation(),
                    "Submit button appears identifiable but no usable identity could be derived in "
                            + signals.getUnitName() + " (" + signals.getFileName() + ":" + signals.getLocation()
                            + ") - id/name were missing/empty and innerText was also missing/invalid.\n\n"
                            + "Fix: add an id or name attribute, or a text label.");
        }
        return SynthesizedIdentifier.builder()
                .identifier(IdentifierValue.literal(signals.getUnitName() + "-" + identity
                        + signals.getRole().getTagSuffix()))
                .hint(identity)
                .build();
    }

    /**
     * Static {@code id}, else static {@code name}, with dash and underscore separated words
     * joined in PascalCase.
     */
    public static String idOrName(ElementNode element) {
        String identifier = element.attributeValue("id");
        if (identifier == null || identifier.isEmpty()) {
            identifier = element.attributeValue("name");
        }
        if (identifier == null) {
            return "";
        }
        if (identifier.contains("-")) {
            identifier = joinPascal(identifier.split("-"));
        }
        if (identifier.contains("_")) {
            identifier = joinPascal(identifier.split("_"));
        }
        return identifier;
    }

    /**
     * Direct text children, trimmed and joined; parenthesized parts, punctuation and
     * non-letters removed; whitespace runs turned into dashes.
     */
    public static String innerText(ElementNode element) {
        List<String> parts = new ArrayList<>();
        for (TemplateNode child : element.getChildren()) {
            if (child instanceof TextNode text && !text.getContent().trim().isEmpty()) {
                parts.add(text.getContent().trim());
            }
        }
        String text = String.join(" ", parts);
        text = PARENTHESIZED.matcher(text).replaceAll("");
        text = PUNCTUATION.matcher(text).replaceAll("");
        text = NON_LETTER.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll("-");
    }

    private String clickSuffix(DirectiveProp click) {
        String handlerName = click.hasExpression() ? classifier.clickHandlerName(click.trimmedExpression()) : "";
        if (handlerName.toLowerCase().startsWith("on")) {
            handlerName = handlerName.substring(2);
        }
        String segment = handlerName.isEmpty() ? "" : "-" + NamingUtil.toPascalCase(handlerName);
        return NON_CLICK_SUFFIX.matcher(segment).replaceAll("");
    }

    private static String routeNameOf(JsNode expression) {
        if (!(expression instanceof ObjectExpression object)) {
            return null;
        }
        ObjectProperty name = object.findProperty("name");
        String literal = name == null ? null : StaticValueExtractor.staticString(name.getValue());
        return literal == null || literal.isBlank() ? null : NamingUtil.toPascalCase(literal);
    }

    private static void withHints(SynthesizedIdentifier.SynthesizedIdentifierBuilder result, String hint,
                                  ElementSignals signals) {
        String conditional = signals.getConditionalHint();
        result.hint(firstNonEmpty(hint, conditional));
        if (!isEmpty(hint) && !isEmpty(conditional)) {
            result.alternateHint(hint + " " + conditional);
        }
    }

    private static String joinPascal(String[] words) {
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            sb.append(NamingUtil.toPascalCase(word));
        }
        return sb.toString();
    }

    private static String trimLeadingSeparators(String value) {
        int i = 0;
        while (i < value.length()) {
            char ch = value.charAt(i);
            if (ch != '-' && ch != '_' && !Character.isWhitespace(ch)) {
                break;
            }
            i++;
        }
        return value.substring(i);
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (!isEmpty(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
