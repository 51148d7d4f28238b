package io.entryheal.core.strategy;

import io.entryheal.core.error.TransformationFailedException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local repair first; the legacy bridge only when local bytes are absent or invalid.
 *
 * <p>If local bytes are invalid and the bridge yields nothing, or legacy data cannot be
 * transformed, the invalid local entry is returned for the degradation policy to judge. If both
 * are invalid the legacy entry is returned.
 */
public final class SelfRepairFirstStrategy implements HealingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(SelfRepairFirstStrategy.class);

    public static final String NAME = "self-repair-first";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<HealingCandidate> heal(HealingContext context) {
        Optional<HealingCandidate> local = HealingSteps.repairLocal(context);
        if (local.isPresent() && local.get().isValid()) {
            return local;
        }
        Optional<HealingCandidate> legacy;
        try {
            legacy = HealingSteps.fromLegacyBridge(context);
        } catch (TransformationFailedException e) {
            if (local.isEmpty()) {
                throw e;
            }
            LOG.debug("Legacy transform failed, keeping invalid local entry: entry_type={}, entry_id={}, detail={}",
                    context.entryType(), context.entryId(), e.detail());
            return local;
        }
        return legacy.isPresent() ? legacy : local;
    }

    @Override
    public String toString() {
        return NAME;
    }
}
