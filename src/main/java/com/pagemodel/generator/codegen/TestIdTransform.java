package com.pagemodel.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.ancestry.AncestorIndex;
import com.pagemodel.generator.codegen.ancestry.ConditionalHintTracker;
import com.pagemodel.generator.codegen.naming.NameRequest;
import com.pagemodel.generator.codegen.naming.ResolvedMemberNames;
import com.pagemodel.generator.codegen.pom.GeneratedIdentifierEntry;
import com.pagemodel.generator.codegen.pom.MethodSignature;
import com.pagemodel.generator.codegen.pom.PomParameter;
import com.pagemodel.generator.codegen.pom.PomSpec;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.role.ResolvedRole;
import com.pagemodel.generator.codegen.role.Role;
import com.pagemodel.generator.codegen.testid.ElementSignals;
import com.pagemodel.generator.codegen.testid.ExistingIdentifier;
import com.pagemodel.generator.codegen.testid.ExistingIdentifierPolicy.Resolution;
import com.pagemodel.generator.codegen.testid.IdentifierSynthesizer;
import com.pagemodel.generator.codegen.testid.IdentifierValue;
import com.pagemodel.generator.codegen.testid.SynthesizedIdentifier;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.IfNode;
import com.pagemodel.generator.model.TemplateNode;
import com.pagemodel.generator.traversal.NodeTransform;
import com.pagemodel.generator.traversal.TransformContext;

import lombok.Getter;

/**
 * Per-node callback for one compilation of one unit. Elements qualifying for an identifier
 * get it upserted and are recorded, with their page-object member, in the unit's aggregate.
 */
public class TestIdTransform implements NodeTransform {
    private static final Logger log = LoggerFactory.getLogger(TestIdTransform.class);

    private final TestIdEngine engine;
    @Getter
    private final String unitName;
    private final String filePath;
    /** Null for an excluded unit. */
    @Getter
    private final UnitAggregate aggregate;

    private final AncestorIndex ancestors;
    private final ConditionalHintTracker conditionalHints;

    TestIdTransform(TestIdEngine engine, UnitAggregate aggregate) {
        this.engine = engine;
        this.unitName = aggregate.getUnitName();
        this.filePath = aggregate.getFilePath();
        this.aggregate = aggregate;
        this.ancestors = new AncestorIndex(engine.getClassifier());
        this.conditionalHints = new ConditionalHintTracker(engine.getClassifier(), ancestors);
    }

    private TestIdTransform(String unitName, String filePath) {
        this.engine = null;
        this.unitName = unitName;
        this.filePath = filePath;
        this.aggregate = null;
        this.ancestors = null;
        this.conditionalHints = null;
    }

    static TestIdTransform excluded(String unitName, String filePath) {
        return new TestIdTransform(unitName, filePath);
    }

    @Override
    public void transform(TemplateNode node, TransformContext context) {
        if (aggregate == null) {
            return;
        }
        ancestors.record(node, context.getParent());

        if (node instanceof IfNode ifNode) {
            conditionalHints.recordBranches(ifNode);
            return;
        }
        if (!(node instanceof ElementNode element)) {
            return;
        }

        if (element.isComponentLike()) {
            aggregate.getUsedComponents().add(element.getTag());
        }

        ElementSignals signals = ElementSignals.builder()
                .unitName(unitName)
                .fileName(fileName(context))
                .location(element.getLoc())
                .role(engine.getRoleResolver().resolve(element))
                .keyPlaceholder(ancestors.nearestRepeatingKey(element, context.getForDepth()))
                .staticKeyValues(ancestors.staticLiteralsOfEnclosingLoop(context.getParent(), context.getForDepth()))
                .conditionalHint(conditionalHints.resolve(element, context.getParent()))
                .insideScopedSlot(ancestors.isInsideScopedRegionWithParams(element))
                .build();

        IdentifierSynthesizer synthesizer = engine.getSynthesizer();

        SynthesizedIdentifier wrapper = synthesizer.wrapper(element, signals);
        if (wrapper != null) {
            if (wrapper.getOptionPrefix() != null) {
                element.upsertAttribute(EngineConfig.OPTION_PREFIX_ATTRIBUTE, wrapper.getOptionPrefix());
            }
            apply(element, signals, wrapper);
            return;
        }

        SynthesizedIdentifier synthesized = synthesizer.navigation(element, signals);
        if (synthesized == null) {
            synthesized = synthesizer.handlerBinding(element, signals);
        }
        if (synthesized == null) {
            synthesized = synthesizer.click(element, signals);
        }
        if (synthesized != null) {
            apply(element, signals, synthesized);
            return;
        }

        SynthesizedIdentifier existing = fromExistingIdentifier(element, signals);
        if (existing == null) {
            existing = synthesizer.submit(element, signals);
        }
        if (existing != null) {
            apply(element, signals, existing);
        }
    }

    /**
     * An author-written identifier on an interactive element becomes the member's selector.
     * When overwriting, only identifiers that are usable selectors are reused.
     */
    private SynthesizedIdentifier fromExistingIdentifier(ElementNode element, ElementSignals signals) {
        ExistingIdentifier existing = ExistingIdentifier.find(element, attributeName(), engine.getClassifier());
        if (existing == null || !signals.getRole().isRecognizedInteractive()) {
            return null;
        }
        if (existing.getKind() == ExistingIdentifier.Kind.DYNAMIC
                && engine.getConfig().getExistingIdBehavior() == ExistingIdBehavior.OVERWRITE) {
            log.debug("Dynamic {} on <{}> in {} is not reused", attributeName(), element.getTag(), unitName);
            return null;
        }
        String idOrName = IdentifierSynthesizer.idOrName(element);
        return SynthesizedIdentifier.builder()
                .identifier(existing.isLiteral()
                        ? IdentifierValue.literal(existing.getValue())
                        : IdentifierValue.template(existing.getValue()))
                .hint(!idOrName.isEmpty() ? idOrName : signals.getConditionalHint())
                .build();
    }

    private void apply(ElementNode element, ElementSignals signals, SynthesizedIdentifier synthesized) {
        ExistingIdentifier existing = ExistingIdentifier.find(element, attributeName(), engine.getClassifier());
        Resolution resolution = engine.getExistingIdPolicy().apply(existing, synthesized.getIdentifier(),
                signals.getKeyPlaceholder(), unitName, signals.getFileName(), signals.getLocation());

        IdentifierValue identifier = resolution.getIdentifier();
        String pattern = identifier.toPattern();
        boolean keyed = identifier.isKeyed();
        ResolvedRole resolvedRole = signals.getRole();
        Role role = resolvedRole.getRole();
        boolean navigation = synthesized.getTarget() != null;
        List<String> keyValues = keyed ? signals.getStaticKeyValues() : null;

        MethodSignature signature = signatureOf(role, keyed, navigation, keyValues);
        ResolvedMemberNames names = engine.getNameResolver().resolve(NameRequest.builder()
                .hint(synthesized.getHint())
                .alternateHints(synthesized.getAlternateHints())
                .role(role)
                .keyed(keyed)
                .target(synthesized.getTarget())
                .mergeKey(synthesized.getMergeKey())
                .pattern(pattern)
                .signature(signature)
                .unitName(unitName)
                .fileName(signals.getFileName())
                .location(signals.getLocation())
                .build(), aggregate);

        if (!resolution.isFromExisting()) {
            element.upsertAttribute(attributeName(), identifier);
        }

        PomSpec spec = PomSpec.builder()
                .role(role)
                .baseName(names.getBaseName())
                .getterName(names.getGetterName())
                .actionName(names.getActionName())
                .identifier(identifier)
                .pattern(pattern)
                .keyValues(keyValues)
                .parameters(parametersOf(role, keyed, navigation, keyValues))
                .mergeKey(synthesized.getMergeKey())
                .target(synthesized.getTarget())
                .build();

        aggregate.addEntry(GeneratedIdentifierEntry.builder()
                .identifier(identifier)
                .target(synthesized.getTarget())
                .pom(spec)
                .tag(element.getTag())
                .location(signals.getLocation())
                .insideScopedSlot(signals.isInsideScopedSlot())
                .fromExisting(resolution.isFromExisting())
                .build());
        aggregate.getChildComponents().add(element.getTag());
        aggregate.getUsedComponents().add(element.getTag());

        log.debug("{} <{}> -> {} ({} / {})", unitName, element.getTag(), identifier, names.getGetterName(),
                names.getActionName());

        if (names.isMerged()) {
            spec.setEmitPrimary(false);
            aggregate.registerPrimaryOnce(spec);
            aggregate.getLedger().register(names.getActionName(), signature);
            return;
        }

        if (engine.getExpansion().expandRadioOptions(element, spec, aggregate)) {
            return;
        }
        if (engine.getExpansion().expandStaticKeys(spec, signals.getStaticKeyValues(), resolvedRole.getRawRole(),
                aggregate)) {
            return;
        }

        aggregate.indexPrimary(spec);
        aggregate.registerPrimaryOnce(spec);
        aggregate.getLedger().register(names.getActionName(), signature);
    }

    /**
     * Parameters of the primary action: the key for keyed members, then the role's inputs.
     */
    static List<PomParameter> parametersOf(Role role, boolean keyed, boolean navigation, List<String> keyValues) {
        List<PomParameter> parameters = new ArrayList<>();
        if (keyed) {
            parameters.add(PomParameter.key(keyValues));
        }
        if (navigation) {
            return parameters;
        }
        switch (role) {
            case INPUT:
                parameters.add(PomParameter.text());
                parameters.add(PomParameter.annotationText());
                break;
            case SELECT:
                parameters.add(PomParameter.value());
                parameters.add(PomParameter.annotationText());
                break;
            case VSELECT:
                parameters.add(PomParameter.value());
                parameters.add(PomParameter.timeOut());
                parameters.add(PomParameter.annotationText());
                break;
            case RADIO:
                parameters.add(PomParameter.annotationText());
                break;
            default:
                break;
        }
        return parameters;
    }

    /**
     * Signature recorded in the generated-method ledger for the primary action.
     */
    static MethodSignature signatureOf(Role role, boolean keyed, boolean navigation, List<String> keyValues) {
        PomParameter key = PomParameter.key(keyValues);
        if (navigation) {
            return keyed ? MethodSignature.of(key) : MethodSignature.of();
        }
        switch (role) {
            case INPUT:
                return MethodSignature.of(PomParameter.text(), PomParameter.annotationText());
            case SELECT:
                return MethodSignature.of(PomParameter.value(), PomParameter.annotationText());
            case VSELECT:
                return MethodSignature.of(PomParameter.value(), PomParameter.timeOut());
            case RADIO:
                return keyed
                        ? MethodSignature.of(key, PomParameter.annotationText())
                        : MethodSignature.of(PomParameter.annotationText());
            default:
                return keyed ? MethodSignature.of(key) : MethodSignature.of();
        }
    }

    private String attributeName() {
        return engine.getConfig().getIdentifierAttributeName();
    }

    private String fileName(TransformContext context) {
        return context.getFileName() != null ? context.getFileName() : filePath;
    }
}
