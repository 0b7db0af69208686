package com.pagemodel.generator.expression;

import lombok.Value;

/**
 * Stable naming token extracted from a directive expression.
 */
@Value
public class NamingSignal {

    public enum Kind {
        /** Literal event name of an {@code emit('x')} / {@code $emit('x')} call. */
        EMITTED_EVENT,
        /** Target of an assignment; {@code x.value = ...} resolves to {@code x}. */
        ASSIGNMENT,
        /** Callee name of a call. */
        CALL,
        /** Bare identifier or member-chain tail. */
        REFERENCE
    }

    Kind kind;
    String name;
    /**
     * PascalCase words derived from literal call arguments or an assignment's right-hand side,
     * or null when none are stable.
     */
    String argumentSuffix;
}
