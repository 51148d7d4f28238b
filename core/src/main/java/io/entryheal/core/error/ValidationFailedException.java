package io.entryheal.core.error;

/**
 * Thrown by a {@code Validator} when a current-schema entry is rejected, and by the orchestrator
 * when the degradation handler decides the rejection is fatal.
 */
public final class ValidationFailedException extends HealingException {

    private static final long serialVersionUID = 1L;

    public ValidationFailedException(String reason) {
        super(Kind.VALIDATION_FAILED, reason, null, null);
    }

    public ValidationFailedException(String reason, String entryType, String entryId) {
        super(Kind.VALIDATION_FAILED, reason, entryType, entryId);
    }

    public ValidationFailedException(String reason, Throwable cause, String entryType, String entryId) {
        super(Kind.VALIDATION_FAILED, reason, cause, entryType, entryId);
    }

    /** The rejection reason. */
    public String reason() {
        return getMessage();
    }
}
