package com.pagemodel.generator.codegen.role;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.RootNode;
import com.pagemodel.generator.parser.TemplateParseException;
import com.pagemodel.generator.parser.TemplateParser;

/**
 * Reads {@code <componentsDir>/<Tag>.vue} and returns the first element of its template.
 */
public class SfcRootTagReader implements ComponentRootTagReader {
    private static final Logger log = LoggerFactory.getLogger(SfcRootTagReader.class);

    private final Path componentsDir;

    public SfcRootTagReader(Path componentsDir) {
        this.componentsDir = componentsDir;
    }

    @Override
    public Optional<String> readRootTag(String componentTag) {
        Path file = componentsDir.resolve(componentTag + ".vue");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read component {} for role inference: {}", file, e.getMessage());
            return Optional.empty();
        }

        try {
            Optional<RootNode> root = TemplateParser.parseComponent(file.toString(), content);
            return root.map(RootNode::firstElement)
                    .map(ElementNode::getTag)
                    .map(tag -> tag.toLowerCase(Locale.ROOT));
        } catch (TemplateParseException e) {
            log.warn("Cannot parse component {} for role inference: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
