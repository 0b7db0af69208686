package com.pagemodel.generator.codegen;

/**
 * What to do when a page-object member name is already taken in the unit.
 */
public enum NameCollisionBehavior {
    ERROR,
    WARN,
    SUFFIX
}
