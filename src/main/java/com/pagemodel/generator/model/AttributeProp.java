package com.pagemodel.generator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Plain attribute such as {@code id="save"}. The value is null for a bare attribute.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AttributeProp extends TemplateProp {
    private String value;

    public AttributeProp(String name, String value, SourceLocation loc) {
        super(name, loc);
        this.value = value;
    }
}
