package com.pagemodel.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.cli.model.GenerateOptions;
import com.pagemodel.generator.cli.model.ValidatedGenerateOptions;
import com.pagemodel.generator.codegen.GeneratorResult;
import com.pagemodel.generator.codegen.manifest.ManifestGenerator;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Page-Object Test Id Generator");
        log.info("=================================================");
        log.info("Source Directory: {}", o.getSourceDir().toAbsolutePath());
        log.info("Views Directory: {}", o.getViewsDir() != null ? o.getViewsDir().toAbsolutePath() : "None");
        log.info("Components Directory: {}", o.getComponentsDir() != null ? o.getComponentsDir().toAbsolutePath() : "None");
        log.info("Test Id Attribute: {}", o.getTestIdAttribute());
        log.info("Existing Id Behavior: {}", o.getExistingIdBehavior());
        log.info("Name Collision Behavior: {}", o.getNameCollisionBehavior());
        log.info("Wrappers: {} ({})", o.getWrappersFile() != null ? o.getWrappersFile().toAbsolutePath() : "None",
                v.getWrappers().size());
        log.info("Routes: {} ({})", o.getRoutesFile() != null ? o.getRoutesFile().toAbsolutePath() : "None",
                v.getRouteTargets().size());
        if (!v.getExcludedUnits().isEmpty()) {
            log.info("Excluded Units: {}", String.join(", ", v.getExcludedUnits()));
        }
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        for (String warning : v.getWarnings()) {
            log.warn(warning);
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Components Scanned: {}", result.getComponentsScanned());
        log.info("Units Compiled: {} ({} views)", result.getUnitsCompiled(), result.getViewsCompiled());
        log.info("Identifiers Generated: {}", result.getIdentifiersGenerated());
        log.info("Identifiers Preserved: {}", result.getIdentifiersPreserved());
        log.info("Primary Members: {}", result.getPrimaryMembers());
        log.info("Extra Methods: {}", result.getExtraMethods());
        log.info("");
        log.info("Files:");
        log.info("  {}", v.getNormalizedOutputDir().resolve(ManifestGenerator.TEST_ID_MANIFEST));
        log.info("  {}", v.getNormalizedOutputDir().resolve(ManifestGenerator.PAGE_OBJECT_MODEL));
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        if (result.getFailingUnit() != null) {
            log.error("Failing unit: {}", result.getFailingUnit());
        }
    }
}
