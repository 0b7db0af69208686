package com.pagemodel.generator.codegen.role;

import java.util.Optional;

/**
 * Loads a component's own definition and reports the tag of its first root element.
 */
@FunctionalInterface
public interface ComponentRootTagReader {

    ComponentRootTagReader NONE = componentTag -> Optional.empty();

    /**
     * @return the lower-cased root tag, or empty when the component cannot be found or read
     */
    Optional<String> readRootTag(String componentTag);
}
