package io.entryheal.core.strategy;

import java.util.Optional;

/** Validates the local bytes and nothing else; the legacy bridge is never called. */
public final class LocalRepairOnlyStrategy implements HealingStrategy {

    public static final String NAME = "local-repair-only";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<HealingCandidate> heal(HealingContext context) {
        return HealingSteps.repairLocal(context);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
