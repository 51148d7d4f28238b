package io.entryheal.core.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.model.EntrySource;
import java.util.Objects;

/**
 * What a strategy hands back to the orchestrator: one entry from one source, and the validation
 * failure if it was rejected. Deciding what a rejection means is the orchestrator's job.
 *
 * @param entry the entry tree; a {@code MissingNode} when the bytes are not JSON
 * @param bytes the entry bytes as read (local) or as serialized after transformation (legacy)
 * @param source where the entry came from
 * @param validationFailure the validator's rejection, or {@code null} if the entry is valid or
 *     was not inspected
 */
public record HealingCandidate(JsonNode entry, byte[] bytes, EntrySource source, ValidationFailedException validationFailure) {

    public HealingCandidate {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    public boolean isValid() {
        return validationFailure == null;
    }

    /** Whether there is a structured entry, i.e. the bytes parsed as JSON. */
    public boolean isStructured() {
        return !entry.isMissingNode();
    }

    public boolean isLegacySourced() {
        return source == EntrySource.LEGACY_BRIDGE;
    }

    @Override
    public String toString() {
        return "HealingCandidate[" + source + (isValid() ? ", valid" : ", invalid: " + validationFailure.reason())
                + "]";
    }
}
