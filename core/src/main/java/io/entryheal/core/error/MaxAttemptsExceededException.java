package io.entryheal.core.error;

/** Thrown when a strategy needs another attempt but the per-call attempt budget is spent. */
public final class MaxAttemptsExceededException extends HealingException {

    private static final long serialVersionUID = 1L;

    private final int maxAttempts;

    public MaxAttemptsExceededException(int maxAttempts, String entryType, String entryId) {
        super(
                Kind.MAX_ATTEMPTS_EXCEEDED,
                "Healing exceeded max attempts (" + maxAttempts + ")",
                entryType,
                entryId);
        this.maxAttempts = maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
