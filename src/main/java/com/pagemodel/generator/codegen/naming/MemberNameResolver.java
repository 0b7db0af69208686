package com.pagemodel.generator.codegen.naming;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagemodel.generator.codegen.NameCollisionBehavior;
import com.pagemodel.generator.codegen.TestIdGenerationException;
import com.pagemodel.generator.codegen.pom.PomSpec;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.role.Role;

/**
 * Turns a semantic hint and role into getter/action names that are unique within a unit,
 * reserving them in the unit's aggregate.
 *
 * Conflicts are resolved per {@link NameCollisionBehavior}:
 * - SUFFIX: numeric suffixes ({@code Button}, {@code Button2}, ...), silently
 * - WARN: as SUFFIX, logging every resolved collision
 * - ERROR: alternate hints, then the role-suffixed primary hint, then a fatal error
 *
 * Before any of that, an element whose unsuffixed action already belongs to a primary with
 * the same merge key, role and navigation target is merged into that primary.
 */
public class MemberNameResolver {
    private static final Logger log = LoggerFactory.getLogger(MemberNameResolver.class);

    static final String KEY_MARKER = "ByKey";

    private final NameCollisionBehavior behavior;
    private final int maxSuffix;

    public MemberNameResolver(NameCollisionBehavior behavior, int maxSuffix) {
        this.behavior = behavior;
        this.maxSuffix = maxSuffix;
    }

    public ResolvedMemberNames resolve(NameRequest request, UnitAggregate aggregate) {
        List<String> hints = hintCandidates(request);
        Candidate firstConflict = null;
        String conflictHint = null;

        for (int h = 0; h < hints.size(); h++) {
            String base = baseName(hints.get(h), request.getRole());

            for (int suffix = 1; ; suffix++) {
                Candidate candidate = candidate(suffix == 1 ? base : base + suffix, request, aggregate);

                if (!candidate.conflicts) {
                    if (firstConflict != null && behavior == NameCollisionBehavior.WARN) {
                        log.warn("[pom] member-name collision in {} ({}). role={}, semanticNameHint=\"{}\". "
                                        + "Conflicts: getter={}, method={}. Using suffixed name: {}.",
                                request.getUnitName(), where(request), request.getRole().getId(),
                                hintLabel(conflictHint), firstConflict.getterName, firstConflict.actionName,
                                candidate.baseName);
                    }
                    return reserve(candidate, aggregate);
                }

                if (h == 0 && suffix == 1) {
                    PomSpec merged = tryMerge(candidate.actionName, request, aggregate);
                    if (merged != null) {
                        log.debug("Merged {} into {} by {}", request.getPattern(), merged.getActionName(),
                                request.getMergeKey());
                        return new ResolvedMemberNames(merged.getBaseName(), merged.getGetterName(),
                                merged.getActionName(), merged);
                    }
                }

                if (firstConflict == null) {
                    firstConflict = candidate;
                    conflictHint = hints.get(h);
                }

                if (behavior == NameCollisionBehavior.ERROR) {
                    break;
                }
                if (suffix >= maxSuffix) {
                    throw collision(request, firstConflict, conflictHint,
                            "No free numeric suffix up to " + maxSuffix + ".");
                }
            }
        }

        // error policy: last resort is the primary hint with the role suffix
        String primaryBase = baseName(hints.get(0), request.getRole());
        String roleSuffix = request.getRole().getSuffix();
        if (!NamingUtil.hasRoleSuffix(NamingUtil.upperFirst(primaryBase), roleSuffix)) {
            Candidate candidate = candidate(primaryBase + roleSuffix, request, aggregate);
            if (!candidate.conflicts) {
                return reserve(candidate, aggregate);
            }
        }

        throw collision(request, firstConflict, conflictHint,
                "Fix: make the element identifiable (e.g. add id/name/inner text or use a more specific click "
                        + "handler name), or switch nameCollisionBehavior to \"warn\"/\"suffix\".");
    }

    /**
     * Base member name from a hint: edge separators trimmed, PascalCase, identifier
     * characters only. Without a hint the role name is used.
     */
    public static String baseName(String hint, Role role) {
        String clean = trimEdgeSeparators(hint == null ? "" : hint.trim());
        if (clean.isEmpty()) {
            String roleName = NamingUtil.upperFirst(NamingUtil.toPascalCase(role.getId()));
            return roleName == null || roleName.isEmpty() ? "Element" : roleName;
        }
        return NamingUtil.toSafeMemberName(NamingUtil.toPascalCase(clean));
    }

    /**
     * Action method name for a base name: {@code goTo} for navigation, else the role verb.
     */
    public static String actionName(String baseName, Role role, boolean navigation) {
        if (navigation) {
            return "goTo" + NamingUtil.upperFirst(baseName);
        }
        if (role == Role.RADIO) {
            return "select" + NamingUtil.upperFirst(baseName.isEmpty() ? "Radio" : baseName);
        }
        return role.actionVerb() + NamingUtil.upperFirst(baseName);
    }

    /**
     * Getter name with the role suffix, unless the base already carries it; the key marker
     * is dropped for keyed members.
     */
    public static String getterName(String baseName, Role role, boolean keyed) {
        String full = suffixedGetter(baseName, role);
        return keyed ? removeKeyMarker(full) : full;
    }

    private Candidate candidate(String baseWithSuffix, NameRequest request, UnitAggregate aggregate) {
        String baseName = request.isKeyed() ? baseWithSuffix + KEY_MARKER : baseWithSuffix;
        String action = actionName(baseName, request.getRole(), request.isNavigation());
        String fullGetter = suffixedGetter(baseName, request.getRole());
        String getter = request.isKeyed() ? removeKeyMarker(fullGetter) : fullGetter;

        boolean conflicts = conflicts(getter, action, request, aggregate);
        // a keyed getter may clash with a plain one; then it keeps its key marker
        if (conflicts && !getter.equals(fullGetter) && !conflicts(fullGetter, action, request, aggregate)) {
            getter = fullGetter;
            conflicts = false;
        }
        return new Candidate(baseName, getter, action, conflicts);
    }

    private static boolean conflicts(String getter, String action, NameRequest request, UnitAggregate aggregate) {
        return aggregate.isReserved(getter)
                || aggregate.isReserved(action)
                || aggregate.getLedger().conflicts(action, request.getSignature());
    }

    private static ResolvedMemberNames reserve(Candidate candidate, UnitAggregate aggregate) {
        aggregate.reserve(candidate.getterName);
        aggregate.reserve(candidate.actionName);
        return new ResolvedMemberNames(candidate.baseName, candidate.getterName, candidate.actionName, null);
    }

    private static PomSpec tryMerge(String actionName, NameRequest request, UnitAggregate aggregate) {
        String mergeKey = request.getMergeKey() == null ? "" : request.getMergeKey().trim();
        // keyed members never merge
        if (mergeKey.isEmpty() || request.isKeyed()) {
            return null;
        }
        PomSpec existing = aggregate.primaryForAction(actionName);
        if (existing == null) {
            return null;
        }
        String existingKey = existing.getMergeKey() == null ? "" : existing.getMergeKey().trim();
        if (!existingKey.equals(mergeKey)
                || existing.getRole() != request.getRole()
                || !Objects.equals(existing.getTarget(), request.getTarget())) {
            return null;
        }
        if (request.getPattern() != null) {
            existing.addAlternatePattern(request.getPattern());
        }
        return existing;
    }

    private List<String> hintCandidates(NameRequest request) {
        List<String> raw = new ArrayList<>();
        raw.add(request.getHint());
        if (behavior == NameCollisionBehavior.ERROR) {
            raw.addAll(request.getAlternateHints());
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String hint : raw) {
            String trimmed = hint == null ? "" : hint.trim();
            if (!trimmed.isEmpty()) {
                seen.add(trimmed);
            }
        }
        if (seen.isEmpty()) {
            seen.add("");
        }
        return new ArrayList<>(seen);
    }

    private static TestIdGenerationException collision(NameRequest request, Candidate conflict, String hint,
                                                       String remediation) {
        String getter = conflict == null ? "<unknown>" : conflict.getterName;
        String action = conflict == null ? "<unknown>" : conflict.actionName;
        String message = "POM member-name collision in " + request.getUnitName() + " (" + where(request) + ").\n"
                + "role=" + request.getRole().getId() + ", semanticNameHint=\"" + hintLabel(hint) + "\"\n"
                + "Conflicts: getter=" + getter + ", method=" + action + "\n\n"
                + remediation;
        return new TestIdGenerationException(TestIdGenerationException.Kind.NAME_COLLISION, request.getUnitName(),
                request.getFileName(), request.getLocation(), message);
    }

    private static String where(NameRequest request) {
        String file = request.getFileName() == null ? "unknown" : request.getFileName();
        return file + ":" + (request.getLocation() == null ? "unknown" : request.getLocation());
    }

    private static String hintLabel(String hint) {
        return hint == null || hint.isBlank() ? "<none>" : hint.trim();
    }

    private static String suffixedGetter(String baseName, Role role) {
        String upper = NamingUtil.upperFirst(baseName);
        return NamingUtil.hasRoleSuffix(upper, role.getSuffix()) ? upper : upper + role.getSuffix();
    }

    private static String removeKeyMarker(String value) {
        int index = value.lastIndexOf(KEY_MARKER);
        if (index < 0) {
            return value;
        }
        return value.substring(0, index) + value.substring(index + KEY_MARKER.length());
    }

    private static String trimEdgeSeparators(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSeparator(value.charAt(start))) {
            start++;
        }
        while (end > start && isSeparator(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isSeparator(char ch) {
        return ch == '-' || ch == '_' || ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r';
    }

    private static final class Candidate {
        private final String baseName;
        private final String getterName;
        private final String actionName;
        private final boolean conflicts;

        private Candidate(String baseName, String getterName, String actionName, boolean conflicts) {
            this.baseName = baseName;
            this.getterName = getterName;
            this.actionName = actionName;
            this.conflicts = conflicts;
        }
    }
}
