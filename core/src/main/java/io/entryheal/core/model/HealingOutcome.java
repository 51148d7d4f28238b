package io.entryheal.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Result of a successful or degraded healing call. Failed calls never produce an outcome; they
 * throw, so partial or unsanitized bytes cannot leak to the caller.
 *
 * <p>The entry belongs to the caller, who decides whether to persist it in the current-schema
 * store. The engine never writes it back.
 */
public final class HealingOutcome {

    private final JsonNode entry;
    private final byte[] entryBytes;
    private final ValidationStatus status;
    private final List<MissingReference> missingReferences;
    private final String degradationReason;
    private final AttemptMetadata metadata;

    private HealingOutcome(
            JsonNode entry,
            byte[] entryBytes,
            ValidationStatus status,
            List<MissingReference> missingReferences,
            String degradationReason,
            AttemptMetadata metadata) {
        this.entry = entry;
        this.entryBytes = entryBytes;
        this.status = status;
        this.missingReferences = missingReferences;
        this.degradationReason = degradationReason;
        this.metadata = metadata;
    }

    /**
     * Creates an outcome.
     *
     * @param entry the structured entry; a {@code MissingNode} when passthrough bytes are not JSON
     * @param entryBytes the serialized entry
     * @param status VALID, MIGRATED or DEGRADED
     * @param missingReferences references degraded during this call
     * @param degradationReason why the entry is degraded, or {@code null}
     * @param metadata attempt metadata
     * @throws IllegalArgumentException if {@code status} is FAILED
     */
    public static HealingOutcome of(
            JsonNode entry,
            byte[] entryBytes,
            ValidationStatus status,
            List<MissingReference> missingReferences,
            String degradationReason,
            AttemptMetadata metadata) {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(entryBytes, "entryBytes must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (status == ValidationStatus.FAILED) {
            throw new IllegalArgumentException("a FAILED call has no outcome");
        }
        return new HealingOutcome(
                entry,
                entryBytes.clone(),
                status,
                missingReferences == null ? List.of() : List.copyOf(missingReferences),
                degradationReason,
                metadata);
    }

    /** The healed entry. Callers must not mutate it. */
    public JsonNode entry() {
        return entry;
    }

    /** A copy of the serialized entry. */
    public byte[] entryBytes() {
        return entryBytes.clone();
    }

    public ValidationStatus status() {
        return status;
    }

    /** References that were missing and degraded; empty unless some were. */
    public List<MissingReference> missingReferences() {
        return missingReferences;
    }

    /** The validation failure or missing-reference summary behind a DEGRADED status. */
    public String degradationReason() {
        return degradationReason;
    }

    public AttemptMetadata metadata() {
        return metadata;
    }

    public boolean isValid() {
        return status == ValidationStatus.VALID;
    }

    public boolean isMigrated() {
        return status == ValidationStatus.MIGRATED;
    }

    /** Degraded entries are usable but should be shown with an integrity caveat. */
    public boolean isDegraded() {
        return status == ValidationStatus.DEGRADED;
    }

    @Override
    public String toString() {
        return "HealingOutcome[" + status + ", source=" + metadata.source() + ", attempts=" + metadata.attempts()
                + (missingReferences.isEmpty() ? "" : ", missingReferences=" + missingReferences.size())
                + ", bytes=" + entryBytes.length + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HealingOutcome other)) return false;
        return status == other.status
                && Arrays.equals(entryBytes, other.entryBytes)
                && missingReferences.equals(other.missingReferences)
                && Objects.equals(degradationReason, other.degradationReason)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, Arrays.hashCode(entryBytes), missingReferences, degradationReason, metadata);
    }
}
