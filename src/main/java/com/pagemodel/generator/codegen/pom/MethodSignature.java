package com.pagemodel.generator.codegen.pom;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Ordered parameter list of a generated method.
 */
@Value
public class MethodSignature {
    List<PomParameter> parameters;

    public static MethodSignature of(PomParameter... parameters) {
        return new MethodSignature(List.of(parameters));
    }

    @Override
    public String toString() {
        return parameters.stream().map(PomParameter::toString).collect(Collectors.joining(", "));
    }
}
