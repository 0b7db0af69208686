package com.pagemodel.generator.mapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.role.Role;

/**
 * Parser for the line based wrappers and routes files.
 *
 * Wrappers format:
 * - Role only: CustomInput = input
 * - Value attribute: ToggleField = toggle, valueAttribute=name
 * - Option prefix: RadioGroup = radio, optionPrefix
 *
 * Routes format:
 * - Route name to unit: Tenant Details = TenantDetailsPage
 *
 * Comments start with #.
 */
public class MappingParser {
    private static final Logger log = LoggerFactory.getLogger(MappingParser.class);

    private static final Pattern WRAPPER_PATTERN = Pattern.compile(
            "^([A-Za-z][A-Za-z0-9_\\-]*)\\s*=\\s*(.+)$"
    );

    private static final Pattern ROUTE_PATTERN = Pattern.compile(
            "^([^=]+?)\\s*=\\s*([A-Za-z_][A-Za-z0-9_]*)$"
    );

    private static final Pattern VALUE_ATTRIBUTE_PATTERN = Pattern.compile(
            "^valueAttribute\\s*=\\s*([A-Za-z_:][A-Za-z0-9_:.\\-]*)$"
    );

    public MappingDocument parseWrappers(Path file) throws IOException {
        return parseWrappers(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public MappingDocument parseRoutes(Path file) throws IOException {
        return parseRoutes(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public MappingDocument parseWrappers(List<String> lines) {
        return parse(lines, MappingEntry.MappingType.WRAPPER);
    }

    public MappingDocument parseRoutes(List<String> lines) {
        return parse(lines, MappingEntry.MappingType.ROUTE);
    }

    private MappingDocument parse(List<String> lines, MappingEntry.MappingType type) {
        MappingDocument doc = new MappingDocument();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            // Skip empty lines and comments
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                MappingEntry entry = type == MappingEntry.MappingType.WRAPPER
                        ? parseWrapperLine(trimmed, lineNum, doc)
                        : parseRouteLine(trimmed, lineNum);
                doc.addEntry(entry);
                log.debug("Parsed {} mapping: {} -> {}", type, entry.getSource(), entry.getTarget());
            } catch (IllegalArgumentException e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse {} line {}: {}", type, lineNum, e.getMessage());
            }
        }

        return doc;
    }

    private MappingEntry parseWrapperLine(String line, int lineNum, MappingDocument doc) {
        Matcher matcher = WRAPPER_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid wrapper format: " + line);
        }

        String tag = matcher.group(1);
        String[] parts = matcher.group(2).split(",");
        String role = parts[0].trim();
        if (role.isEmpty()) {
            throw new IllegalArgumentException("Missing role for " + tag);
        }
        if (!Role.isRecognized(role)) {
            doc.addWarning("Line " + lineNum + ": role '" + role + "' of " + tag + " is named as a button");
        }

        MappingEntry.MappingEntryBuilder builder = MappingEntry.builder()
                .type(MappingEntry.MappingType.WRAPPER)
                .source(tag)
                .target(role)
                .line(lineNum);

        for (int i = 1; i < parts.length; i++) {
            String option = parts[i].trim();
            Matcher valueAttribute = VALUE_ATTRIBUTE_PATTERN.matcher(option);
            if (valueAttribute.matches()) {
                builder.valueAttribute(valueAttribute.group(1));
            } else if ("optionPrefix".equals(option)) {
                builder.optionPrefix(true);
            } else {
                throw new IllegalArgumentException("Unknown wrapper option: " + option);
            }
        }
        return builder.build();
    }

    private MappingEntry parseRouteLine(String line, int lineNum) {
        Matcher matcher = ROUTE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid route format: " + line);
        }
        return MappingEntry.builder()
                .type(MappingEntry.MappingType.ROUTE)
                .source(matcher.group(1).trim())
                .target(matcher.group(2))
                .line(lineNum)
                .build();
    }
}
