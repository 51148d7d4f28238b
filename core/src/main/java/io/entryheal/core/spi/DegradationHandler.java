package io.entryheal.core.spi;

import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.model.DegradationDecision;

/**
 * Pure decision policy consulted when healing hits a validation failure or a missing reference.
 * Each entry type is configured with its own handler; see {@code DegradationPolicies} for the
 * stock ones.
 */
public interface DegradationHandler {

    /**
     * @param entryType the entry type being healed
     * @param error the validator's rejection
     * @param legacySourced whether the rejected entry came from the legacy bridge
     * @return what to do with the rejected entry
     */
    DegradationDecision onValidationFailure(String entryType, ValidationFailedException error, boolean legacySourced);

    /**
     * @param entryType the entry type being healed
     * @param refType the entry type of the missing target
     * @param refId the id of the missing target
     * @return what to do with the entry that holds the dangling reference
     */
    DegradationDecision onMissingReference(String entryType, String refType, String refId);
}
