package io.entryheal.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * How an outcome was obtained.
 *
 * @param source where the returned entry came from
 * @param legacyBridgeUsed whether the returned entry was sourced from the legacy bridge
 * @param attempts attempts consumed (bridge calls plus local validations)
 * @param elapsed wall-clock time of the whole call
 */
public record AttemptMetadata(EntrySource source, boolean legacyBridgeUsed, int attempts, Duration elapsed) {

    public AttemptMetadata {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative, got: " + attempts);
        }
    }
}
