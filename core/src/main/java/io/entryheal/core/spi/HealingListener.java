package io.entryheal.core.spi;

import io.entryheal.core.error.HealingException;
import io.entryheal.core.model.ValidationStatus;

/**
 * Observability hook for healing calls.
 *
 * <p>Implementations bridge to metrics or tracing systems and MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the orchestrator and logged; they
 * never affect the outcome of a call. Events are only delivered when signals are enabled in the
 * configuration.
 */
public interface HealingListener {

    /** Called when a healing call has found its provider and is about to run the strategy. */
    default void onHealingStarted(HealingStartedEvent event) {}

    /** Called when a call produced a usable entry (valid, migrated or degraded). */
    default void onHealingCompleted(HealingCompletedEvent event) {}

    /** Called when a call ended with a hard error. */
    default void onHealingFailed(HealingFailedEvent event) {}

    /** Called in addition to {@link #onHealingCompleted} when the returned entry is degraded. */
    default void onDegradedEntry(DegradedEntryEvent event) {}

    // --- Event records ---

    /** Event emitted when healing starts. */
    record HealingStartedEvent(String entryType, String entryId, String strategy) {}

    /** Event emitted when healing produced a usable entry. */
    record HealingCompletedEvent(
            String entryType,
            String entryId,
            ValidationStatus status,
            int attempts,
            boolean legacyBridgeUsed,
            long durationMs) {}

    /** Event emitted when healing failed. */
    record HealingFailedEvent(
            String entryType, String entryId, HealingException.Kind kind, int attempts, long durationMs, String detail) {}

    /** Event emitted when a degraded entry is handed back to the caller. */
    record DegradedEntryEvent(String entryType, String entryId, String reason) {}
}
