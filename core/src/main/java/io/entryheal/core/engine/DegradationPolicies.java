package io.entryheal.core.engine;

import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.model.DegradationDecision;
import io.entryheal.core.spi.DegradationHandler;
import java.util.Objects;

/**
 * Stock {@link DegradationHandler}s. The engine never infers a policy; every provider is
 * configured with one explicitly.
 */
public final class DegradationPolicies {

    private DegradationPolicies() {}

    /**
     * Fixed decisions, independent of the entry type and error.
     *
     * @param onValidationFailure decision for validation failures
     * @param onMissingReference decision for missing references
     */
    public static DegradationHandler of(DegradationDecision onValidationFailure, DegradationDecision onMissingReference) {
        return new Fixed(onValidationFailure, onMissingReference);
    }

    /** Degrade on every problem; the usual policy for non-critical entry types. */
    public static DegradationHandler alwaysDegrade() {
        return of(DegradationDecision.DEGRADE, DegradationDecision.DEGRADE);
    }

    /** Fail on every problem; for critical entry types. */
    public static DegradationHandler alwaysFail() {
        return of(DegradationDecision.FAIL, DegradationDecision.FAIL);
    }

    /** Accept every problem without lowering the status. */
    public static DegradationHandler alwaysAccept() {
        return of(DegradationDecision.ACCEPT, DegradationDecision.ACCEPT);
    }

    /**
     * Fails validation failures of migrated legacy data, degrades those of local data, and
     * degrades missing references.
     */
    public static DegradationHandler failLegacyValidation() {
        return new DegradationHandler() {
            @Override
            public DegradationDecision onValidationFailure(
                    String entryType, ValidationFailedException error, boolean legacySourced) {
                return legacySourced ? DegradationDecision.FAIL : DegradationDecision.DEGRADE;
            }

            @Override
            public DegradationDecision onMissingReference(String entryType, String refType, String refId) {
                return DegradationDecision.DEGRADE;
            }

            @Override
            public String toString() {
                return "DegradationPolicy[failLegacyValidation]";
            }
        };
    }

    private record Fixed(DegradationDecision onValidationFailure, DegradationDecision onMissingReference)
            implements DegradationHandler {

        Fixed {
            Objects.requireNonNull(onValidationFailure, "onValidationFailure must not be null");
            Objects.requireNonNull(onMissingReference, "onMissingReference must not be null");
        }

        @Override
        public DegradationDecision onValidationFailure(
                String entryType, ValidationFailedException error, boolean legacySourced) {
            return onValidationFailure;
        }

        @Override
        public DegradationDecision onMissingReference(String entryType, String refType, String refId) {
            return onMissingReference;
        }
    }
}
