package io.entryheal.core.strategy;

import java.util.Optional;

/**
 * Decides in which order the legacy bridge and local repair are tried for one call. Stateless;
 * all per-call state lives in the {@link HealingContext}.
 *
 * <p>Every strategy ends in one of three states: a candidate (valid, or invalid for the
 * orchestrator's degradation policy to judge), no data at all, or a hard
 * {@link io.entryheal.core.error.HealingException}.
 */
public interface HealingStrategy {

    /** Strategy name as used in configuration, e.g. {@code bridge-first}. */
    String name();

    /**
     * Runs the strategy.
     *
     * @param context per-call context
     * @return the chosen candidate, or empty if no data exists in any source the strategy tries
     * @throws io.entryheal.core.error.MaxAttemptsExceededException if the attempt budget runs out
     * @throws io.entryheal.core.error.TransformationFailedException if legacy data could not be
     *     transformed and there is nothing to fall back to
     * @throws io.entryheal.core.error.LegacyBridgeException on a hard bridge error
     */
    Optional<HealingCandidate> heal(HealingContext context);
}
