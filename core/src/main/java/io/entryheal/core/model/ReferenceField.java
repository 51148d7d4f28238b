package io.entryheal.core.model;

import java.util.Objects;

/**
 * A field of an entry that points at other entries.
 *
 * @param field the JSON field name in the current schema
 * @param targetEntryType the entry type the ids refer to
 * @param many whether the field holds an array of ids rather than a single id
 */
public record ReferenceField(String field, String targetEntryType, boolean many) {

    public ReferenceField {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(targetEntryType, "targetEntryType must not be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        if (targetEntryType.isBlank()) {
            throw new IllegalArgumentException("targetEntryType must not be blank");
        }
    }

    /** A field holding a single id. */
    public static ReferenceField one(String field, String targetEntryType) {
        return new ReferenceField(field, targetEntryType, false);
    }

    /** A field holding an array of ids. */
    public static ReferenceField many(String field, String targetEntryType) {
        return new ReferenceField(field, targetEntryType, true);
    }
}
