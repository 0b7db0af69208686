package com.pagemodel.generator.codegen.role;

import java.util.Locale;

import com.pagemodel.generator.codegen.naming.NamingUtil;

/**
 * Interaction category of an element. Every role maps to a getter suffix
 * ({@code Button}, {@code Vselect}) and an action verb.
 */
public enum Role {
    BUTTON("button"),
    INPUT("input"),
    SELECT("select"),
    /** Custom (virtual) select. */
    VSELECT("vselect"),
    CHECKBOX("checkbox"),
    TOGGLE("toggle"),
    RADIO("radio");

    private final String id;

    Role(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Suffix appended to getter names, e.g. {@code SaveButton}.
     */
    public String getSuffix() {
        return NamingUtil.upperFirst(id);
    }

    /**
     * Verb of the primary action method; navigation targets always use {@code goTo}.
     */
    public String actionVerb() {
        switch (this) {
            case INPUT:
                return "type";
            case SELECT:
            case VSELECT:
            case RADIO:
                return "select";
            default:
                return "click";
        }
    }

    /**
     * Case-insensitive lookup; returns null for anything outside the fixed set.
     */
    public static Role fromId(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.id.equals(normalized)) {
                return role;
            }
        }
        return null;
    }

    public static Role normalize(String value) {
        Role role = fromId(value);
        return role != null ? role : BUTTON;
    }

    public static boolean isRecognized(String value) {
        return fromId(value) != null;
    }
}
