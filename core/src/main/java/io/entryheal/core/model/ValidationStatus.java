package io.entryheal.core.model;

/**
 * Integrity status of a healed entry. The label is the value written to a provider's status
 * field.
 */
public enum ValidationStatus {
    /** Read from the current schema and validated as is. */
    VALID("Valid"),

    /** Produced from legacy data, or accepted despite a validation failure. */
    MIGRATED("Migrated"),

    /** Usable, but failed validation or has dangling references. */
    DEGRADED("Degraded"),

    /** Healing failed; never attached to returned data. */
    FAILED("Failed");

    private final String label;

    ValidationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Whether data carrying this status may be shown to a user. */
    public boolean isUsable() {
        return this != FAILED;
    }
}
