package io.entryheal.core.error;

/** Thrown when a second provider is registered for an entry type that already has one. */
public final class DuplicateEntryTypeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String entryType;

    public DuplicateEntryTypeException(String entryType) {
        super("A provider is already registered for entry type '" + entryType + "'");
        this.entryType = entryType;
    }

    public String entryType() {
        return entryType;
    }
}
