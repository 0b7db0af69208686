package com.pagemodel.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.cli.exception.OptionsValidationException;
import com.pagemodel.generator.cli.model.GenerateOptions;
import com.pagemodel.generator.cli.model.ValidatedGenerateOptions;
import com.pagemodel.generator.cli.output.GenerateResultsPrinter;
import com.pagemodel.generator.cli.validation.GenerateOptionsValidator;
import com.pagemodel.generator.codegen.EngineConfig;
import com.pagemodel.generator.codegen.GeneratorConfig;
import com.pagemodel.generator.codegen.GeneratorResult;
import com.pagemodel.generator.codegen.PageObjectGenerator;
import com.pagemodel.generator.codegen.routing.RouteNameTargetResolver;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that compiles a component tree into test ids and page-object models.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "pom-testid-generator 1.0.0",
        description = "Assigns stable test ids to Vue components and derives their page-object API."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            GeneratorConfig config = GeneratorConfig.builder()
                    .sourceDir(options.getSourceDir())
                    .outputDir(validated.getNormalizedOutputDir())
                    .force(options.isForce())
                    .engineConfig(engineConfig(validated))
                    .build();

            GeneratorResult result = new PageObjectGenerator(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(validated, result);
            return 0;

        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private EngineConfig engineConfig(ValidatedGenerateOptions validated) {
        return EngineConfig.builder()
                .existingIdBehavior(options.getExistingIdBehavior())
                .nameCollisionBehavior(options.getNameCollisionBehavior())
                .identifierAttributeName(options.getTestIdAttribute().trim())
                .nativeWrappers(validated.getWrappers())
                .excludedUnits(validated.getExcludedUnits())
                .viewsDir(options.getViewsDir())
                .componentsDir(options.getComponentsDir())
                .navigationTargetResolver(new RouteNameTargetResolver(validated.getRouteTargets()))
                .build();
    }
}
