package io.entryheal.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.entryheal.core.error.HealingException.Kind;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy: one abstract unchecked root for per-call failures, a kind per
 * failure mode, and separate runtime exceptions for setup errors.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void healingExceptionIsAbstractAndUnchecked() {
        assertThat(HealingException.class).isAbstract();
        assertThat(HealingException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void setupErrorsAreNotHealingExceptions() {
        assertThat(RuntimeException.class)
                .isAssignableFrom(DuplicateEntryTypeException.class)
                .isAssignableFrom(ProviderSpecException.class)
                .isAssignableFrom(ConfigLoadException.class);
        assertThat(HealingException.class.isAssignableFrom(DuplicateEntryTypeException.class)).isFalse();
        assertThat(HealingException.class.isAssignableFrom(ProviderSpecException.class)).isFalse();
        assertThat(HealingException.class.isAssignableFrom(ConfigLoadException.class)).isFalse();
    }

    // --- Kinds and fields ---

    @Test
    void unknownEntryType() {
        var ex = new UnknownEntryTypeException("podcast", "p1");

        assertThat(ex.kind()).isEqualTo(Kind.UNKNOWN_ENTRY_TYPE);
        assertThat(ex.entryType()).isEqualTo("podcast");
        assertThat(ex.entryId()).isEqualTo("p1");
        assertThat(ex.getMessage()).contains("podcast");
    }

    @Test
    void validationFailed() {
        var ex = new ValidationFailedException("title missing");

        assertThat(ex.kind()).isEqualTo(Kind.VALIDATION_FAILED);
        assertThat(ex.reason()).isEqualTo("title missing");
        assertThat(ex.detail()).isEqualTo("title missing");
        assertThat(ex.entryType()).isNull();
    }

    @Test
    void missingReference() {
        var ex = new MissingReferenceException("path_id", "learning_path", "p404", "path_step", "s1");

        assertThat(ex.kind()).isEqualTo(Kind.MISSING_REFERENCE);
        assertThat(ex.field()).isEqualTo("path_id");
        assertThat(ex.refType()).isEqualTo("learning_path");
        assertThat(ex.refId()).isEqualTo("p404");
        assertThat(ex.getMessage()).contains("learning_path").contains("p404");
    }

    @Test
    void maxAttempts() {
        var ex = new MaxAttemptsExceededException(3, "content", "c1");

        assertThat(ex.kind()).isEqualTo(Kind.MAX_ATTEMPTS_EXCEEDED);
        assertThat(ex.maxAttempts()).isEqualTo(3);
    }

    @Test
    void kindsPerType() {
        assertThat(new TransformationFailedException("x").kind()).isEqualTo(Kind.TRANSFORMATION_FAILED);
        assertThat(new LegacyBridgeException("x").kind()).isEqualTo(Kind.LEGACY_BRIDGE_ERROR);
        assertThat(new LegacyBridgeUnavailableException("x", null, null).kind())
                .isEqualTo(Kind.LEGACY_BRIDGE_UNAVAILABLE);
        assertThat(new DegradationPolicyFailException("x", null, null).kind()).isEqualTo(Kind.DEGRADATION_POLICY_FAIL);
        assertThat(new ReferenceResolutionException("x").kind()).isEqualTo(Kind.REFERENCE_RESOLUTION_FAILED);
        assertThat(new HealingCancelledException("x", new InterruptedException(), null, null).kind())
                .isEqualTo(Kind.CANCELLED);
    }

    @Test
    void onlyUnavailableBridgeIsSoft() {
        assertThat(new LegacyBridgeUnavailableException("x", null, null).isSoft()).isTrue();
        assertThat(new LegacyBridgeException("x").isSoft()).isFalse();
        assertThat(new ValidationFailedException("x").isSoft()).isFalse();
    }

    // --- Coordinates ---

    @Test
    void withCoordinatesFillsOnlyMissingValues() {
        var bare = new TransformationFailedException("bad mapping");
        var placed = new TransformationFailedException("bad mapping", "content", "c1");

        assertThat(bare.withCoordinates("content", "c9")).isSameAs(bare);
        assertThat(bare.entryType()).isEqualTo("content");
        assertThat(bare.entryId()).isEqualTo("c9");

        placed.withCoordinates("learning_path", "p1");
        assertThat(placed.entryType()).isEqualTo("content");
        assertThat(placed.entryId()).isEqualTo("c1");
    }

    @Test
    void causeIsPreserved() {
        var cause = new IllegalStateException("index offline");
        var ex = new LegacyBridgeException("fetch failed", cause, "content", "c1");

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void providerSpecExceptionCarriesSource() {
        var ex = new ProviderSpecException("bad", "providers/content.yaml");

        assertThat(ex.source()).isEqualTo("providers/content.yaml");
    }
}
