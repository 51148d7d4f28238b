package io.entryheal.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validates an entry already in the current schema. Implementations MUST be side-effect free,
 * deterministic and thread-safe: identical input always yields the identical decision.
 */
@FunctionalInterface
public interface Validator {

    /**
     * Validates a current-schema entry.
     *
     * @param entry the entry as a JSON tree; never {@code null}
     * @throws io.entryheal.core.error.ValidationFailedException if the entry is rejected
     */
    void validate(JsonNode entry);
}
