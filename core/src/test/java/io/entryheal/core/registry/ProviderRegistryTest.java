package io.entryheal.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.entryheal.core.error.DuplicateEntryTypeException;
import io.entryheal.core.testkit.InMemoryReferenceStore;
import io.entryheal.core.testkit.LearningProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProviderRegistryTest")
class ProviderRegistryTest {

    private ProviderRegistry registry;
    private InMemoryReferenceStore store;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        store = new InMemoryReferenceStore();
    }

    @Test
    @DisplayName("Registered providers are found by entry type, in registration order")
    void registerAndLookup() {
        registry.register(LearningProviders.content(store).build())
                .register(LearningProviders.learningPath().build())
                .register(LearningProviders.pathStep(store).build())
                .register(LearningProviders.contentMastery(store).build());

        assertThat(registry.size()).isEqualTo(4);
        assertThat(registry.get("path_step")).hasValueSatisfying(p -> assertThat(p.entryType()).isEqualTo("path_step"));
        assertThat(registry.contains("content_mastery")).isTrue();
        assertThat(registry.entryTypes())
                .containsExactly("content", "learning_path", "path_step", "content_mastery");
    }

    @Test
    void unknownTypeIsEmpty() {
        assertThat(registry.get("nonexistent-type")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
        assertThat(registry.contains("nonexistent-type")).isFalse();
    }

    @Test
    @DisplayName("A second provider for the same entry type is rejected")
    void duplicateRejected() {
        registry.register(LearningProviders.learningPath().build());

        assertThatThrownBy(() -> registry.register(LearningProviders.learningPath().build()))
                .isInstanceOf(DuplicateEntryTypeException.class)
                .hasMessageContaining("learning_path");
    }

    @Test
    @DisplayName("Freezing is idempotent and ends registration")
    void freeze() {
        registry.register(LearningProviders.learningPath().build());

        assertThat(registry.freeze()).isSameAs(registry);
        registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThat(registry.get("learning_path")).isPresent();
        assertThatThrownBy(() -> registry.register(LearningProviders.content(store).build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
    }

    @Test
    void entryTypesIsUnmodifiable() {
        registry.register(LearningProviders.learningPath().build());

        assertThatThrownBy(() -> registry.entryTypes().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullProviderRejected() {
        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
    }
}
