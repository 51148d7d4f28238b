package io.entryheal.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps a legacy-schema entry onto the current schema. Pure: no I/O, no validation (that is the
 * {@link Validator}'s job), same input gives same output.
 *
 * <p>The engine stamps the provider's schema-version field onto the returned tree, so output is
 * tagged current even when the transformer drops data.
 */
@FunctionalInterface
public interface Transformer {

    /**
     * @param legacy the legacy entry as returned by the bridge
     * @return the entry in the current schema; the engine may stamp fields onto a copy of it
     * @throws io.entryheal.core.error.TransformationFailedException if the legacy data cannot be
     *     mapped
     */
    JsonNode transform(JsonNode legacy);

    /** Short human-readable description, used in logs. */
    default String description() {
        return getClass().getSimpleName();
    }
}
