package io.entryheal.core.error;

/** Thrown by a {@code Transformer} when legacy data cannot be mapped onto the current schema. */
public final class TransformationFailedException extends HealingException {

    private static final long serialVersionUID = 1L;

    public TransformationFailedException(String message) {
        super(Kind.TRANSFORMATION_FAILED, message, null, null);
    }

    public TransformationFailedException(String message, Throwable cause) {
        super(Kind.TRANSFORMATION_FAILED, message, cause, null, null);
    }

    public TransformationFailedException(String message, String entryType, String entryId) {
        super(Kind.TRANSFORMATION_FAILED, message, entryType, entryId);
    }

    public TransformationFailedException(String message, Throwable cause, String entryType, String entryId) {
        super(Kind.TRANSFORMATION_FAILED, message, cause, entryType, entryId);
    }
}
