package io.entryheal.core.strategy;

import java.util.Optional;

/** Returns the local bytes unchanged, without validation. Status is always {@code Valid}. */
public final class NoHealingStrategy implements HealingStrategy {

    public static final String NAME = "no-healing";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<HealingCandidate> heal(HealingContext context) {
        return HealingSteps.passthrough(context);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
