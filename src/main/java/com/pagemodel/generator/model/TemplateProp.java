package com.pagemodel.generator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attribute or directive written on an element.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class TemplateProp {
    protected String name;
    protected SourceLocation loc = SourceLocation.UNKNOWN;
}
