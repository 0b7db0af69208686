package com.pagemodel.generator.codegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.manifest.ManifestGenerator;
import com.pagemodel.generator.codegen.pom.GeneratedIdentifierEntry;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.util.FileWriteUtil;
import com.pagemodel.generator.parser.TemplateParseException;

/**
 * Compiles every component of a source tree and writes the identifier manifest and the
 * page-object model dump.
 */
public class PageObjectGenerator {
    private static final Logger log = LoggerFactory.getLogger(PageObjectGenerator.class);

    private static final String COMPONENT_EXTENSION = ".vue";

    private final GeneratorConfig config;
    private final TestIdEngine engine;
    private final ManifestGenerator manifestGenerator;

    public PageObjectGenerator(GeneratorConfig config) {
        this(config, new TestIdEngine(config.getEngineConfig()));
    }

    public PageObjectGenerator(GeneratorConfig config, TestIdEngine engine) {
        this.config = config;
        this.engine = engine;
        this.manifestGenerator = new ManifestGenerator();
    }

    public GeneratorResult generate() {
        List<Path> components;
        try {
            log.info("Step 1: Scanning {} for components...", config.getSourceDir());
            components = FileWriteUtil.listFiles(config.getSourceDir(), COMPONENT_EXTENSION);
        } catch (IOException e) {
            log.error("Cannot scan source directory", e);
            return GeneratorResult.failure("Cannot scan " + config.getSourceDir() + ": " + e.getMessage());
        }
        if (components.isEmpty()) {
            return GeneratorResult.failure("No " + COMPONENT_EXTENSION + " files found in " + config.getSourceDir());
        }

        log.info("Step 2: Compiling {} components...", components.size());
        for (Path component : components) {
            String unitName = unitNameOf(component);
            if (engine.getRegistry().get(unitName) != null) {
                log.warn("Unit name {} is used by more than one file; {} replaces the earlier one", unitName, component);
            }
            try {
                String content = Files.readString(component, StandardCharsets.UTF_8);
                engine.compileComponent(unitName, component.toString(), content);
            } catch (TestIdGenerationException | TemplateParseException e) {
                return GeneratorResult.unitFailure(unitName, e.getMessage());
            } catch (IOException e) {
                return GeneratorResult.unitFailure(unitName, "Cannot read " + component + ": " + e.getMessage());
            }
        }

        List<UnitAggregate> aggregates = engine.getRegistry().all();
        Path outputDir = config.getOutputDir();
        if (!config.isForce()) {
            for (String output : List.of(ManifestGenerator.TEST_ID_MANIFEST, ManifestGenerator.PAGE_OBJECT_MODEL)) {
                if (Files.exists(outputDir.resolve(output))) {
                    return GeneratorResult.failure("Output file already exists: " + outputDir.resolve(output)
                            + ". Use --force to overwrite.");
                }
            }
        }
        try {
            log.info("Step 3: Writing outputs to {}...", outputDir);
            FileWriteUtil.safeWriteString(outputDir.resolve(ManifestGenerator.TEST_ID_MANIFEST),
                    manifestGenerator.renderTestIdManifest(aggregates));
            FileWriteUtil.safeWriteString(outputDir.resolve(ManifestGenerator.PAGE_OBJECT_MODEL),
                    manifestGenerator.renderPageObjectModel(aggregates));
        } catch (IOException e) {
            log.error("Writing outputs failed", e);
            return GeneratorResult.failure(e.getMessage());
        }

        log.info("Generation complete!");
        return summarize(components.size(), aggregates, outputDir);
    }

    /**
     * Unit name of a component file: its file name without extension.
     */
    static String unitNameOf(Path component) {
        String fileName = component.getFileName().toString();
        return fileName.endsWith(COMPONENT_EXTENSION)
                ? fileName.substring(0, fileName.length() - COMPONENT_EXTENSION.length())
                : fileName;
    }

    private static GeneratorResult summarize(int scanned, List<UnitAggregate> aggregates, Path outputDir) {
        int views = 0;
        int generated = 0;
        int preserved = 0;
        int primaries = 0;
        int extras = 0;
        for (UnitAggregate aggregate : aggregates) {
            if (aggregate.isView()) {
                views++;
            }
            for (GeneratedIdentifierEntry entry : aggregate.getEntries()) {
                if (entry.isFromExisting()) {
                    preserved++;
                } else {
                    generated++;
                }
            }
            primaries += aggregate.getEmittedPrimaries().size();
            extras += aggregate.getExtraMethods().size();
        }
        return GeneratorResult.builder()
                .success(true)
                .outputPath(outputDir)
                .componentsScanned(scanned)
                .unitsCompiled(aggregates.size())
                .viewsCompiled(views)
                .identifiersGenerated(generated)
                .identifiersPreserved(preserved)
                .primaryMembers(primaries)
                .extraMethods(extras)
                .build();
    }
}
