package io.entryheal.core.model;

/**
 * A reference found missing (or unconfirmable) and degraded rather than failed.
 *
 * @param field the field holding the reference
 * @param refType the target entry type
 * @param refId the target id
 */
public record MissingReference(String field, String refType, String refId) {}
