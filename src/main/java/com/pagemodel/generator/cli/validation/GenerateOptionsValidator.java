package com.pagemodel.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pagemodel.generator.cli.exception.OptionsValidationException;
import com.pagemodel.generator.cli.model.GenerateOptions;
import com.pagemodel.generator.cli.model.ValidatedGenerateOptions;
import com.pagemodel.generator.codegen.manifest.ManifestGenerator;
import com.pagemodel.generator.codegen.role.RoleConfig;
import com.pagemodel.generator.mapping.MappingDocument;
import com.pagemodel.generator.mapping.MappingParser;

public class GenerateOptionsValidator {

	private final MappingParser mappingParser = new MappingParser();

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();

		if (o.getSourceDir() == null) {
			errors.add("Source directory is required (--source-dir / -s).");
		} else if (!existsDirectory(o.getSourceDir())) {
			errors.add("Source directory does not exist or is not a directory: " + o.getSourceDir());
		}
		if (o.getViewsDir() != null && !existsDirectory(o.getViewsDir())) {
			errors.add("Views directory does not exist or is not a directory: " + o.getViewsDir());
		}
		if (o.getComponentsDir() != null && !existsDirectory(o.getComponentsDir())) {
			errors.add("Components directory does not exist or is not a directory: " + o.getComponentsDir());
		}
		if (isBlank(o.getTestIdAttribute())) {
			errors.add("Test id attribute must not be blank (--test-id-attribute).");
		}

		Map<String, RoleConfig> wrappers = Map.of();
		MappingDocument wrappersDoc = parseMapping(o.getWrappersFile(), true, "Wrappers file", errors);
		if (wrappersDoc != null) {
			collect("Wrappers file", wrappersDoc, errors, warnings);
			wrappers = wrappersDoc.toRoleConfigs();
		}

		Map<String, String> routeTargets = Map.of();
		MappingDocument routesDoc = parseMapping(o.getRoutesFile(), false, "Routes file", errors);
		if (routesDoc != null) {
			collect("Routes file", routesDoc, errors, warnings);
			routeTargets = routesDoc.toRouteTargets();
		}

		// Normalize output dir and check the files we are about to write
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		for (String output : List.of(ManifestGenerator.TEST_ID_MANIFEST, ManifestGenerator.PAGE_OBJECT_MODEL)) {
			Path outputPath = normalizedOutputDir.resolve(output);
			if (Files.exists(outputPath) && !o.isForce()) {
				errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
			}
		}

		Set<String> excluded = parseExcludedUnits(o.getExcludedUnits());

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutputDir, wrappers, routeTargets, excluded, warnings);
	}

	private MappingDocument parseMapping(Path file, boolean wrappers, String label, List<String> errors) {
		if (file == null) {
			return null;
		}
		if (!Files.isRegularFile(file)) {
			errors.add(label + " does not exist: " + file);
			return null;
		}
		try {
			return wrappers ? mappingParser.parseWrappers(file) : mappingParser.parseRoutes(file);
		} catch (IOException e) {
			errors.add(label + " cannot be read: " + file + " (" + e.getMessage() + ")");
			return null;
		}
	}

	private static void collect(String label, MappingDocument doc, List<String> errors, List<String> warnings) {
		for (String error : doc.getErrors()) {
			errors.add(label + ": " + error);
		}
		for (String warning : doc.getWarnings()) {
			warnings.add(label + ": " + warning);
		}
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static Set<String> parseExcludedUnits(List<String> raw) {
		Set<String> result = new LinkedHashSet<>();
		if (raw == null) {
			return result;
		}
		for (String unit : raw) {
			if (!isBlank(unit)) {
				result.add(unit.trim());
			}
		}
		return result;
	}
}
