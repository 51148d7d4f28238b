package io.entryheal.core.strategy;

import io.entryheal.core.error.TransformationFailedException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Legacy bridge, then transform and validate; local repair only when the bridge has nothing, is
 * unreachable, or its data cannot be transformed.
 *
 * <p>When both sources hold data the legacy entry wins: it is authoritative for records not yet
 * re-created under the current schema. Legacy data that transforms but fails validation is
 * handed to degradation as is, without falling back.
 */
public final class BridgeFirstStrategy implements HealingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(BridgeFirstStrategy.class);

    public static final String NAME = "bridge-first";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<HealingCandidate> heal(HealingContext context) {
        try {
            Optional<HealingCandidate> legacy = HealingSteps.fromLegacyBridge(context);
            if (legacy.isPresent()) {
                return legacy;
            }
        } catch (TransformationFailedException e) {
            if (context.currentBytes().isEmpty()) {
                throw e;
            }
            LOG.debug("Legacy transform failed, falling back to local repair: entry_type={}, entry_id={}, detail={}",
                    context.entryType(), context.entryId(), e.detail());
        }
        return HealingSteps.repairLocal(context);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
