package io.entryheal.core.error;

/** Thrown when a handler asked to degrade but degradation is disabled by configuration. */
public final class DegradationPolicyFailException extends HealingException {

    private static final long serialVersionUID = 1L;

    public DegradationPolicyFailException(String message, String entryType, String entryId) {
        super(Kind.DEGRADATION_POLICY_FAIL, message, entryType, entryId);
    }

    public DegradationPolicyFailException(String message, Throwable cause, String entryType, String entryId) {
        super(Kind.DEGRADATION_POLICY_FAIL, message, cause, entryType, entryId);
    }
}
