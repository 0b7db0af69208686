package com.pagemodel.generator.codegen.testid;

import com.pagemodel.generator.codegen.ExistingIdBehavior;
import com.pagemodel.generator.codegen.TestIdGenerationException;
import com.pagemodel.generator.codegen.TestIdGenerationException.Kind;
import com.pagemodel.generator.model.SourceLocation;

import lombok.Value;

/**
 * Decides between an author-provided identifier and the synthesized one.
 *
 * Under {@code PRESERVE} a literal is always kept and a template is kept only with exactly
 * one substitution that contains the required key placeholder; any other bound expression
 * cannot serve as a stable selector and fails the unit.
 */
public class ExistingIdentifierPolicy {

    private final ExistingIdBehavior behavior;
    private final String attributeName;

    public ExistingIdentifierPolicy(ExistingIdBehavior behavior, String attributeName) {
        this.behavior = behavior;
        this.attributeName = attributeName;
    }

    /**
     * Identifier to use for the element.
     */
    @Value
    public static class Resolution {
        IdentifierValue identifier;
        boolean fromExisting;
    }

    /**
     * @param existing         the author's identifier, or null
     * @param generated        the synthesized identifier
     * @param keyPlaceholder   required key placeholder ({@code ${item.id}}), or null
     * @throws TestIdGenerationException under {@code ERROR}, or for an unpreservable value
     */
    public Resolution apply(ExistingIdentifier existing, IdentifierValue generated, String keyPlaceholder,
                            String unitName, String fileName, SourceLocation location) {
        if (existing == null) {
            return new Resolution(generated, false);
        }

        String where = "Component: " + unitName + "\nFile: " + fileName + ":" + location + "\n";

        switch (behavior) {
            case ERROR:
                throw new TestIdGenerationException(Kind.EXISTING_ID_FORBIDDEN, unitName, fileName, location,
                        "Found existing " + attributeName + " while existingIdBehavior=\"error\".\n"
                                + where
                                + "Existing " + attributeName + ": \"" + existing.getValue() + "\"\n\n"
                                + "Fix: remove the explicit " + attributeName
                                + ", or change existingIdBehavior to \"preserve\" or \"overwrite\".");
            case OVERWRITE:
                return new Resolution(generated, false);
            default:
                return preserve(existing, keyPlaceholder, unitName, fileName, location, where);
        }
    }

    private Resolution preserve(ExistingIdentifier existing, String keyPlaceholder, String unitName,
                                String fileName, SourceLocation location, String where) {
        switch (existing.getKind()) {
            case LITERAL:
                return new Resolution(IdentifierValue.literal(existing.getValue()), true);
            case TEMPLATE:
                if (existing.getSubstitutionCount() != 1) {
                    throw new TestIdGenerationException(Kind.EXISTING_ID_NOT_PRESERVABLE, unitName, fileName, location,
                            "Existing " + attributeName + " is a template literal with multiple interpolations "
                                    + "and cannot be preserved safely.\n"
                                    + where
                                    + "Existing " + attributeName + ": \"" + existing.getValue() + "\"\n\n"
                                    + "Fix: reduce the template to a single key-based interpolation, or remove the "
                                    + "explicit " + attributeName + " so it can be auto-generated.");
                }
                if (keyPlaceholder != null && !existing.getValue().contains(keyPlaceholder)) {
                    throw new TestIdGenerationException(Kind.EXISTING_ID_NOT_PRESERVABLE, unitName, fileName, location,
                            "Existing " + attributeName + " appears to be missing the key placeholder needed to "
                                    + "keep it unique.\n"
                                    + where
                                    + "Existing " + attributeName + ": \"" + existing.getValue() + "\"\n"
                                    + "Required placeholder: \"" + keyPlaceholder + "\"\n\n"
                                    + "Fix: either (1) include " + keyPlaceholder + " in your :" + attributeName
                                    + " template literal, or (2) remove the explicit " + attributeName
                                    + " so it can be auto-generated.");
                }
                return new Resolution(IdentifierValue.template(existing.getValue()), true);
            default:
                throw new TestIdGenerationException(Kind.EXISTING_ID_NOT_PRESERVABLE, unitName, fileName, location,
                        "Existing " + attributeName + " is dynamic and cannot be preserved as a stable runtime "
                                + "selector.\n"
                                + where
                                + "Existing " + attributeName + " expression: \"" + existing.getValue() + "\"\n\n"
                                + "Fix: change it to a string literal (e.g. " + attributeName + "=\"foo\") or remove "
                                + "the explicit " + attributeName + " so it can be auto-generated.");
        }
    }
}
