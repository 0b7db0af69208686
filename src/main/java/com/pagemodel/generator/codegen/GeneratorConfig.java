package com.pagemodel.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one generator run over a source tree.
 */
@Data
@Builder
public class GeneratorConfig {
    /** Root scanned for {@code .vue} components. */
    private Path sourceDir;
    private Path outputDir;
    private boolean force;
    private EngineConfig engineConfig;
}
