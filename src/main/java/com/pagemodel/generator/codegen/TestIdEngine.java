package com.pagemodel.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.naming.MemberNameResolver;
import com.pagemodel.generator.codegen.pom.AggregateRegistry;
import com.pagemodel.generator.codegen.pom.EnumerableExpansion;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.role.ComponentRootTagReader;
import com.pagemodel.generator.codegen.role.NativeRoleConfiguration;
import com.pagemodel.generator.codegen.role.RoleResolver;
import com.pagemodel.generator.codegen.role.SfcRootTagReader;
import com.pagemodel.generator.codegen.testid.ExistingIdentifierPolicy;
import com.pagemodel.generator.codegen.testid.IdentifierSynthesizer;
import com.pagemodel.generator.expression.ExpressionClassifier;
import com.pagemodel.generator.model.RootNode;
import com.pagemodel.generator.parser.TemplateParser;
import com.pagemodel.generator.traversal.TemplateWalker;

import lombok.Getter;

/**
 * Entry point of identifier and page-object synthesis. One engine holds the caches of a
 * run (inferred wrapper roles, per-unit aggregates); each compilation of a unit starts with
 * {@link #beginUnit}, whose transform is then driven over the unit's tree.
 */
public class TestIdEngine {
    private static final Logger log = LoggerFactory.getLogger(TestIdEngine.class);

    @Getter
    private final EngineConfig config;
    @Getter
    private final AggregateRegistry registry = new AggregateRegistry();

    private final ExpressionClassifier classifier = new ExpressionClassifier();
    private final RoleResolver roleResolver;
    private final IdentifierSynthesizer synthesizer;
    private final ExistingIdentifierPolicy existingIdPolicy;
    private final MemberNameResolver nameResolver;
    private final EnumerableExpansion expansion;

    public TestIdEngine(EngineConfig config) {
        this(config, config.getComponentsDir() != null
                ? new SfcRootTagReader(config.getComponentsDir())
                : ComponentRootTagReader.NONE);
    }

    public TestIdEngine(EngineConfig config, ComponentRootTagReader rootTagReader) {
        this.config = config;
        this.roleResolver = new RoleResolver(new NativeRoleConfiguration(config.getNativeWrappers(), rootTagReader));
        this.synthesizer = new IdentifierSynthesizer(classifier, config.getNavigationTargetResolver());
        this.existingIdPolicy = new ExistingIdentifierPolicy(config.getExistingIdBehavior(),
                config.getIdentifierAttributeName());
        this.nameResolver = new MemberNameResolver(config.getNameCollisionBehavior(), config.getMaxCollisionSuffix());
        this.expansion = new EnumerableExpansion(classifier);
    }

    /**
     * Starts a (re-)compilation of a unit: its aggregate is replaced by an empty one and a
     * fresh per-node transform is returned. Excluded units get a transform that does nothing.
     */
    public TestIdTransform beginUnit(String unitName, String filePath) {
        if (config.getExcludedUnits().contains(unitName)) {
            log.debug("Skipping excluded unit {}", unitName);
            registry.remove(unitName);
            return TestIdTransform.excluded(unitName, filePath);
        }
        UnitAggregate aggregate = registry.reset(unitName, filePath, isView(filePath));
        return new TestIdTransform(this, aggregate);
    }

    /**
     * Drives a fresh transform over a parsed tree.
     *
     * @return the unit's aggregate, or empty for an excluded unit
     */
    public Optional<UnitAggregate> compile(String unitName, String filePath, RootNode root) {
        TestIdTransform transform = beginUnit(unitName, filePath);
        new TemplateWalker(List.of(transform)).walk(root, filePath);
        return Optional.ofNullable(transform.getAggregate());
    }

    /**
     * Parses a single-file component and compiles its template.
     *
     * @return the unit's aggregate, or empty for an excluded unit or a component without template
     */
    public Optional<UnitAggregate> compileComponent(String unitName, String filePath, String content) {
        Optional<RootNode> root = TemplateParser.parseComponent(filePath, content);
        if (root.isEmpty()) {
            registry.remove(unitName);
            return Optional.empty();
        }
        return compile(unitName, filePath, root.get());
    }

    boolean isView(String filePath) {
        Path viewsDir = config.getViewsDir();
        if (viewsDir == null || filePath == null) {
            return false;
        }
        return realPath(Path.of(filePath)).startsWith(realPath(viewsDir));
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", path, e.getMessage());
            return path.toAbsolutePath().normalize();
        }
    }

    ExpressionClassifier getClassifier() {
        return classifier;
    }

    RoleResolver getRoleResolver() {
        return roleResolver;
    }

    IdentifierSynthesizer getSynthesizer() {
        return synthesizer;
    }

    ExistingIdentifierPolicy getExistingIdPolicy() {
        return existingIdPolicy;
    }

    MemberNameResolver getNameResolver() {
        return nameResolver;
    }

    EnumerableExpansion getExpansion() {
        return expansion;
    }
}
