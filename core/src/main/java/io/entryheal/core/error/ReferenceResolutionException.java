package io.entryheal.core.error;

/** Thrown by a {@code ReferenceResolver} when existence of a referenced entry cannot be determined. */
public final class ReferenceResolutionException extends HealingException {

    private static final long serialVersionUID = 1L;

    public ReferenceResolutionException(String message) {
        super(Kind.REFERENCE_RESOLUTION_FAILED, message, null, null);
    }

    public ReferenceResolutionException(String message, Throwable cause) {
        super(Kind.REFERENCE_RESOLUTION_FAILED, message, cause, null, null);
    }

    public ReferenceResolutionException(String message, String entryType, String entryId) {
        super(Kind.REFERENCE_RESOLUTION_FAILED, message, entryType, entryId);
    }

    public ReferenceResolutionException(String message, Throwable cause, String entryType, String entryId) {
        super(Kind.REFERENCE_RESOLUTION_FAILED, message, cause, entryType, entryId);
    }
}
