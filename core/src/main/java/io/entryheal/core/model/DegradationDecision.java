package io.entryheal.core.model;

import java.util.Locale;

/** Decision returned by a {@code DegradationHandler}. */
public enum DegradationDecision {
    /** Use the entry; the problem does not lower its status. */
    ACCEPT,

    /** Use the entry, marked {@link ValidationStatus#DEGRADED}. */
    DEGRADE,

    /** Reject the whole call. */
    FAIL;

    /**
     * Parses a decision name case-insensitively ({@code accept}, {@code degrade}, {@code fail}).
     *
     * @throws IllegalArgumentException if the name is not a decision
     */
    public static DegradationDecision fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown degradation decision '" + name + "', expected accept, degrade or fail", e);
        }
    }
}
