package com.pagemodel.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.pagemodel.generator.codegen.EngineConfig;
import com.pagemodel.generator.codegen.ExistingIdBehavior;
import com.pagemodel.generator.codegen.NameCollisionBehavior;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--source-dir", "-s" }, required = true, description = "Directory scanned for .vue components")
	private Path sourceDir;

	@Option(names = { "--views-dir" }, description = "Components under this directory are views (pages)")
	private Path viewsDir;

	@Option(names = {
			"--components-dir" }, description = "Directory holding <Tag>.vue definitions used to infer wrapper roles")
	private Path componentsDir;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = {
			"--existing-id-behavior" }, defaultValue = "PRESERVE", description = "What to do with author-written identifiers: PRESERVE, OVERWRITE or ERROR")
	private ExistingIdBehavior existingIdBehavior;

	@Option(names = {
			"--name-collision-behavior" }, defaultValue = "SUFFIX", description = "How member-name collisions are resolved: SUFFIX, WARN or ERROR")
	private NameCollisionBehavior nameCollisionBehavior;

	@Option(names = {
			"--test-id-attribute" }, defaultValue = EngineConfig.DEFAULT_IDENTIFIER_ATTRIBUTE, description = "Name of the identifier attribute (default: data-testid)")
	private String testIdAttribute;

	@Option(names = { "--wrappers-file", "-w" }, description = "Wrapper component file (Tag = role[, valueAttribute=x][, optionPrefix])")
	private Path wrappersFile;

	@Option(names = { "--routes-file", "-r" }, description = "Route name file (Route Name = TargetComponent)")
	private Path routesFile;

	@Option(names = { "--exclude" }, split = ",", description = "Units to skip (comma-separated)")
	private List<String> excludedUnits;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

}
