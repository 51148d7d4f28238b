package io.entryheal.core.error;

/**
 * Abstract base for all per-call healing errors. Never thrown directly; the concrete subclasses
 * each map to one {@link Kind}.
 *
 * <p>Soft errors ({@link #isSoft()}) are recovered inside a strategy by falling through to the
 * next source and never reach the caller of {@code HealingOrchestrator.healById}. Hard errors
 * propagate.
 */
public abstract class HealingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error taxonomy. */
    public enum Kind {
        UNKNOWN_ENTRY_TYPE,
        VALIDATION_FAILED,
        TRANSFORMATION_FAILED,
        MISSING_REFERENCE,
        LEGACY_BRIDGE_UNAVAILABLE,
        LEGACY_BRIDGE_ERROR,
        MAX_ATTEMPTS_EXCEEDED,
        DEGRADATION_POLICY_FAIL,
        REFERENCE_RESOLUTION_FAILED,
        CANCELLED
    }

    private final Kind kind;
    private String entryType;
    private String entryId;

    protected HealingException(Kind kind, String message, String entryType, String entryId) {
        super(message);
        this.kind = kind;
        this.entryType = entryType;
        this.entryId = entryId;
    }

    protected HealingException(Kind kind, String message, Throwable cause, String entryType, String entryId) {
        super(message, cause);
        this.kind = kind;
        this.entryType = entryType;
        this.entryId = entryId;
    }

    /** The error kind. */
    public Kind kind() {
        return kind;
    }

    /** The entry type being healed, or {@code null} if not yet identified. */
    public String entryType() {
        return entryType;
    }

    /** The entry id being healed, or {@code null} if not yet identified. */
    public String entryId() {
        return entryId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Whether a strategy may recover from this error by trying another source. */
    public boolean isSoft() {
        return false;
    }

    /**
     * Fills in the call coordinates when the error was raised by a contract implementation that
     * did not know them. Already-set values are kept.
     *
     * @return this exception
     */
    public HealingException withCoordinates(String entryType, String entryId) {
        if (this.entryType == null) {
            this.entryType = entryType;
        }
        if (this.entryId == null) {
            this.entryId = entryId;
        }
        return this;
    }
}
