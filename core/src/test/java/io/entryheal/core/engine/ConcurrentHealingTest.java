package io.entryheal.core.engine;

import static io.entryheal.core.testkit.Entries.bytes;
import static org.assertj.core.api.Assertions.assertThat;

import io.entryheal.core.model.HealingOutcome;
import io.entryheal.core.model.ValidationStatus;
import io.entryheal.core.registry.ProviderRegistry;
import io.entryheal.core.testkit.Entries;
import io.entryheal.core.testkit.InMemoryLegacyBridge;
import io.entryheal.core.testkit.InMemoryReferenceStore;
import io.entryheal.core.testkit.LearningProviders;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** One orchestrator shared by many threads, as on a hot read path. */
@DisplayName("ConcurrentHealingTest")
class ConcurrentHealingTest {

    @Test
    @DisplayName("Concurrent calls for different ids heal independently")
    void concurrentCallsAreIndependent() throws Exception {
        InMemoryLegacyBridge bridge = new InMemoryLegacyBridge();
        InMemoryReferenceStore store = new InMemoryReferenceStore();
        for (int i = 0; i < 50; i++) {
            bridge.put("content", "old-" + i, Entries.contentV1("old-" + i));
            store.add("content", "cur-" + i);
        }
        HealingMetrics metrics = new HealingMetrics();
        ProviderRegistry registry = new ProviderRegistry().register(LearningProviders.content(store).build());
        ExecutorService callers = Executors.newFixedThreadPool(8);

        try (HealingOrchestrator orchestrator = new HealingOrchestrator(
                registry, HealingConfig.builder().legacyBridge(bridge).build(), metrics)) {
            List<Callable<HealingOutcome>> calls = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                String oldId = "old-" + i;
                String curId = "cur-" + i;
                calls.add(() -> orchestrator.healById("content", oldId, null).orElseThrow());
                calls.add(() -> orchestrator
                        .healById("content", "x" + curId, bytes(Entries.contentV2("x" + curId, curId)))
                        .orElseThrow());
            }

            List<HealingOutcome> outcomes = new ArrayList<>();
            for (Future<HealingOutcome> f : callers.invokeAll(calls)) {
                outcomes.add(f.get());
            }

            assertThat(outcomes).hasSize(100);
            assertThat(outcomes).filteredOn(o -> o.status() == ValidationStatus.MIGRATED).hasSize(50);
            assertThat(outcomes).filteredOn(o -> o.status() == ValidationStatus.VALID).hasSize(50);
            assertThat(outcomes)
                    .filteredOn(HealingOutcome::isMigrated)
                    .allSatisfy(o -> assertThat(o.entry().get("id").asText()).startsWith("old-"));
        } finally {
            callers.shutdownNow();
        }

        assertThat(metrics.getTotalCount()).isEqualTo(100);
    }
}
