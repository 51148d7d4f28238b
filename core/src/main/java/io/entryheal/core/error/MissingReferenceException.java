package io.entryheal.core.error;

/** Thrown when a referenced entry is missing and the degradation handler decided to fail. */
public final class MissingReferenceException extends HealingException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String refType;
    private final String refId;

    public MissingReferenceException(String field, String refType, String refId, String entryType, String entryId) {
        super(
                Kind.MISSING_REFERENCE,
                "Missing reference " + refType + "/" + refId + " in field '" + field + "'",
                entryType,
                entryId);
        this.field = field;
        this.refType = refType;
        this.refId = refId;
    }

    /** The field of the healed entry that holds the reference. */
    public String field() {
        return field;
    }

    /** The entry type of the missing target. */
    public String refType() {
        return refType;
    }

    /** The id of the missing target. */
    public String refId() {
        return refId;
    }
}
