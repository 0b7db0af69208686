package com.pagemodel.generator.codegen.pom;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.naming.NamingUtil;
import com.pagemodel.generator.codegen.role.Role;
import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.expression.StaticValueExtractor;
import com.pagemodel.generator.model.DirectiveProp;
import com.pagemodel.generator.model.ElementNode;

/**
 * Replaces a primary member by extra methods when its options or loop keys can be
 * enumerated statically.
 *
 * A radio group bound to {@code :options="['One', 'Two']"} gets {@code selectChoiceOne()} and
 * {@code selectChoiceTwo()}; with non-literal options it gets one {@code selectChoice(value)}.
 * A button repeated over {@code ['Save', 'Cancel']} gets {@code clickSaveButton()} and
 * {@code clickCancelButton()} instead of {@code clickByKey(key)}.
 */
public class EnumerableExpansion {
    private static final Logger log = LoggerFactory.getLogger(EnumerableExpansion.class);

    private static final String RADIO_SUFFIX = "-radio";

    private final ExpressionClassifier classifier;

    public EnumerableExpansion(ExpressionClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @return true when the primary was replaced by option methods
     */
    public boolean expandRadioOptions(ElementNode element, PomSpec spec, UnitAggregate aggregate) {
        if (spec.getRole() != Role.RADIO) {
            return false;
        }
        DirectiveProp options = element.findBinding("options");
        if (options == null || !options.hasExpression()) {
            return false;
        }

        String pattern = spec.getPattern();
        String prefix = pattern.endsWith(RADIO_SUFFIX)
                ? pattern.substring(0, pattern.length() - RADIO_SUFFIX.length())
                : pattern;
        String methodName = spec.getBaseName();
        List<String> labels = StaticValueExtractor.staticOptionLabels(
                classifier.tryParseExpression(options.trimmedExpression()));

        suppressPrimary(spec, aggregate);

        if (labels != null && !labels.isEmpty()) {
            String base = methodName.endsWith("Radio")
                    ? methodName.substring(0, methodName.length() - "Radio".length())
                    : methodName;
            String baseUpper = NamingUtil.upperFirst(base.isEmpty() ? "Radio" : base);
            for (String label : labels) {
                String optionPart = NamingUtil.toGroupOptionSegment(label);
                if (optionPart.isEmpty()) {
                    continue;
                }
                String optionSuffix = NamingUtil.toPascalCase(label);
                PomExtraMethod method = PomExtraMethod.builder()
                        .pattern(prefix + "_" + optionPart + "_radio")
                        .parameter(PomParameter.annotationText())
                        .build();
                addNamed(method, "select" + baseUpper + (optionSuffix.isEmpty() ? optionPart : optionSuffix), aggregate);
            }
            return true;
        }

        log.debug("Options of {} are not enumerable, emitting one parameterized method", pattern);
        PomExtraMethod method = PomExtraMethod.builder()
                .pattern(prefix + "_${value}_radio")
                .parameter(PomParameter.value())
                .parameter(PomParameter.annotationText())
                .build();
        addNamed(method, "select" + NamingUtil.upperFirst(methodName.isEmpty() ? "Radio" : methodName), aggregate);
        return true;
    }

    /**
     * @param rawRole the element's raw role, used as the method suffix
     * @return true when the keyed primary was replaced by one method per loop value
     */
    public boolean expandStaticKeys(PomSpec spec, List<String> staticKeyValues, String rawRole,
                                    UnitAggregate aggregate) {
        if (staticKeyValues == null || staticKeyValues.isEmpty()
                || !spec.hasParameter("key")
                || !spec.isKeyed()
                || spec.isNavigation()) {
            return false;
        }
        Role role = spec.getRole();
        if (role == Role.INPUT || role == Role.SELECT || role == Role.VSELECT || role == Role.RADIO) {
            return false;
        }

        suppressPrimary(spec, aggregate);

        String roleName = NamingUtil.toPascalCase(rawRole == null || rawRole.isEmpty() ? "Element" : rawRole);
        String roleSuffix = NamingUtil.upperFirst(roleName);
        for (String value : staticKeyValues) {
            String valueName = NamingUtil.toPascalCase(value);
            if (valueName.isEmpty()) {
                continue;
            }
            PomExtraMethod method = PomExtraMethod.builder()
                    .pattern(spec.getPattern())
                    .keyLiteral(value)
                    .parameter(PomParameter.waitForIt())
                    .build();
            addNamed(method, "click" + valueName + roleSuffix, aggregate);
        }
        return true;
    }

    private static void suppressPrimary(PomSpec spec, UnitAggregate aggregate) {
        spec.setEmitPrimary(false);
        aggregate.registerPrimaryOnce(spec);
        aggregate.release(spec.getActionName());
    }

    private static void addNamed(PomExtraMethod method, String baseName, UnitAggregate aggregate) {
        if (aggregate.hasExtraMethod(method)) {
            return;
        }
        String name = aggregate.reserveUniqueMethodName(baseName);
        PomExtraMethod named = method.toBuilder().name(name).build();
        if (aggregate.addExtraMethod(named)) {
            aggregate.getLedger().register(name, named.signature());
        }
    }
}
