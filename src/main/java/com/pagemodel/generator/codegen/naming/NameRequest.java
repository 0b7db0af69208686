package com.pagemodel.generator.codegen.naming;

import java.util.List;

import com.pagemodel.generator.codegen.pom.MethodSignature;
import com.pagemodel.generator.codegen.role.Role;
import com.pagemodel.generator.model.SourceLocation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Input of {@link MemberNameResolver#resolve}.
 */
@Value
@Builder
public class NameRequest {
    /** Primary semantic hint; may be null or blank. */
    String hint;
    /** Fallback hints tried under the {@code error} policy only. */
    @Singular
    List<String> alternateHints;
    @NonNull
    Role role;
    boolean keyed;
    /** Navigation target unit; non-null turns the action into {@code goTo...}. */
    String target;
    String mergeKey;
    /** Selector pattern of the element, folded into a merged primary. */
    String pattern;
    /** Signature the action method will carry. */
    MethodSignature signature;
    String unitName;
    String fileName;
    SourceLocation location;

    public boolean isNavigation() {
        return target != null;
    }
}
