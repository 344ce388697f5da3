package fr.lapetina.modeltraffic.infrastructure.store;

import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.modeltraffic.rollout.RolloutConfig;
import fr.lapetina.modeltraffic.rollout.RolloutPlan;
import fr.lapetina.modeltraffic.rollout.RolloutState;
import fr.lapetina.modeltraffic.support.MutableClock;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static fr.lapetina.modeltraffic.support.TestEndpoints.MODEL;
import static org.assertj.core.api.Assertions.assertThat;

class JsonFileSnapshotStoreTest {

    @TempDir
    Path directory;

    private JsonFileSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileSnapshotStore(directory);
    }

    @Test
    @DisplayName("should persist registry snapshots across store instances")
    void shouldPersistRegistrySnapshots() {
        MutableClock clock = new MutableClock();
        EndpointRegistry registry = new EndpointRegistry(store, clock);
        registry.bootstrap(MODEL, List.of(
                TestEndpoints.active("a", "v1", 0.002, 70),
                TestEndpoints.active("b", "v1", 0.001, 30)));
        registry.updateHealth("b", EndpointHealth.DEGRADED);

        EndpointRegistry restarted = new EndpointRegistry(new JsonFileSnapshotStore(directory), clock);

        assertThat(restarted.restore(MODEL)).isTrue();
        RegistrySnapshot snapshot = restarted.getSnapshot(MODEL);
        assertThat(snapshot.version()).isEqualTo(2);
        assertThat(snapshot.weights()).containsEntry("a", 70).containsEntry("b", 30);
        assertThat(restarted.findEndpoint("b")).map(e -> e.health()).contains(EndpointHealth.DEGRADED);
        assertThat(restarted.findEndpoint("a")).map(e -> e.address().toString()).contains("http://a:11434");
    }

    @Test
    @DisplayName("should persist rollout plans with durations and weights")
    void shouldPersistRolloutPlans() {
        RolloutPlan plan = RolloutPlan.builder()
                .id("plan-1")
                .config(RolloutConfig.builder()
                        .model(MODEL)
                        .canaryVersion("v2")
                        .baselineVersion("v1")
                        .evaluationInterval(Duration.ofMinutes(5))
                        .build())
                .state(RolloutState.RAMPING)
                .stepIndex(1)
                .canaryTraffic(20)
                .canaryEndpointId("llama3-v2-abc")
                .baselineWeights(Map.of("a", 100))
                .createdAt(new MutableClock().instant())
                .build();

        store.put("rollout/plan/plan-1", plan);
        RolloutPlan loaded = store.get("rollout/plan/plan-1", RolloutPlan.class).orElseThrow();

        assertThat(loaded.state()).isEqualTo(RolloutState.RAMPING);
        assertThat(loaded.canaryTraffic()).isEqualTo(20);
        assertThat(loaded.config().evaluationInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(loaded.config().trafficSteps()).containsExactly(5, 20, 50, 100);
        assertThat(loaded.baselineWeights()).containsEntry("a", 100);
    }

    @Test
    @DisplayName("should map keys with separators to single files")
    void shouldEncodeKeys() {
        store.put("rollout/active/llama3", "plan-1");

        assertThat(store.keys()).containsExactly("rollout/active/llama3");
        assertThat(store.get("rollout/active/llama3", String.class)).contains("plan-1");
        try (var files = Files.list(directory)) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".tmp"));
        } catch (java.io.IOException e) {
            throw new java.io.UncheckedIOException(e);
        }
    }

    @Test
    @DisplayName("should return empty for missing keys and delete idempotently")
    void shouldHandleMissingKeys() {
        assertThat(store.get("missing", String.class)).isEmpty();

        store.put("k", "v");
        store.delete("k");
        store.delete("k");

        assertThat(store.get("k", String.class)).isEmpty();
        assertThat(store.keys()).isEmpty();
    }
}
