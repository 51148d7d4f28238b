package io.entryheal.core.error;

/** Thrown when no provider is registered for the requested entry type. */
public final class UnknownEntryTypeException extends HealingException {

    private static final long serialVersionUID = 1L;

    public UnknownEntryTypeException(String entryType, String entryId) {
        super(Kind.UNKNOWN_ENTRY_TYPE, "No provider registered for entry type '" + entryType + "'", entryType, entryId);
    }
}
