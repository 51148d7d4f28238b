package io.entryheal.core.error;

/**
 * Thrown when the calling thread is interrupted while waiting on the legacy bridge or a
 * reference check. Nothing has been written, so the call can be retried as is.
 */
public final class HealingCancelledException extends HealingException {

    private static final long serialVersionUID = 1L;

    public HealingCancelledException(String message, Throwable cause, String entryType, String entryId) {
        super(Kind.CANCELLED, message, cause, entryType, entryId);
    }
}
