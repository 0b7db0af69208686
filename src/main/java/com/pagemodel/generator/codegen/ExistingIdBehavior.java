package com.pagemodel.generator.codegen;

/**
 * What to do with an identifier attribute the author already wrote.
 */
public enum ExistingIdBehavior {
    /** Keep it when it is a usable selector (default). */
    PRESERVE,
    /** Replace it with the synthesized identifier. */
    OVERWRITE,
    /** Fail the unit. */
    ERROR
}
