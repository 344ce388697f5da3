package fr.lapetina.modeltraffic.infrastructure.registry;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.infrastructure.store.InMemorySnapshotStore;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import fr.lapetina.modeltraffic.support.MutableClock;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static fr.lapetina.modeltraffic.support.TestEndpoints.MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointRegistryTest {

    private InMemorySnapshotStore store;
    private MutableClock clock;
    private EndpointRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
        clock = new MutableClock();
        registry = new EndpointRegistry(store, clock);
    }

    private static ModelEndpoint draft(String id, String version) {
        return ModelEndpoint.builder()
                .id(id)
                .model(MODEL)
                .version(version)
                .address("http://" + id)
                .build();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should give the first endpoint all traffic and later ones none")
        void shouldAssignInitialWeights() {
            registry.register(draft("a", "v1"));
            RegistrySnapshot snapshot = registry.register(draft("b", "v2"));

            assertThat(snapshot.weights()).containsExactly(Map.entry("a", 100), Map.entry("b", 0));
            assertThat(snapshot.version()).isEqualTo(2);
            assertThat(registry.models()).containsExactly(MODEL);
        }

        @Test
        @DisplayName("should reject duplicate endpoint ids")
        void shouldRejectDuplicates() {
            registry.register(draft("a", "v1"));

            assertThatThrownBy(() -> registry.register(draft("a", "v2")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should refuse to deregister an endpoint holding weight")
        void shouldRefuseDeregisterWithWeight() {
            registry.register(draft("a", "v1"));
            registry.register(draft("b", "v2"));

            assertThatThrownBy(() -> registry.deregister("a"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("still holds weight");

            registry.deregister("b");
            assertThat(registry.findEndpoint("b")).isEmpty();
        }

        @Test
        @DisplayName("should bootstrap configured weights in one commit")
        void shouldBootstrap() {
            RegistrySnapshot snapshot = registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("a", "v1", 0.01, 60),
                    TestEndpoints.active("b", "v1", 0.02, 40)));

            assertThat(snapshot.version()).isEqualTo(1);
            assertThat(snapshot.weights()).containsEntry("a", 60).containsEntry("b", 40);
        }

        @Test
        @DisplayName("should reject bootstrap weights not summing to 100")
        void shouldRejectInvalidBootstrap() {
            assertThatThrownBy(() -> registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("a", "v1", 0.01, 60),
                    TestEndpoints.active("b", "v1", 0.02, 30))))
                    .isInstanceOf(ValidationException.class);
            assertThat(registry.findEndpoint("a")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Weight commits")
    class WeightCommitTests {

        @BeforeEach
        void setUp() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("a", "v1", 0.01, 100),
                    TestEndpoints.active("b", "v2", 0.01, 0)));
        }

        @Test
        @DisplayName("should commit a weight table and bump the version")
        void shouldCommitWeights() {
            RegistrySnapshot snapshot = registry.commitWeights(MODEL, Map.of("a", 80, "b", 20),
                    Map.of("b", EndpointState.CANARY));

            assertThat(snapshot.version()).isEqualTo(2);
            assertThat(snapshot.weights()).containsEntry("a", 80).containsEntry("b", 20);
            assertThat(snapshot.canary()).map(ModelEndpoint::id).contains("b");
        }

        @Test
        @DisplayName("should reject weights not summing to 100 and keep the previous snapshot")
        void shouldRejectBadSum() {
            assertThatThrownBy(() -> registry.commitWeights(MODEL, Map.of("a", 80, "b", 30)))
                    .isInstanceOf(ValidationException.class);

            RegistrySnapshot current = registry.getSnapshot(MODEL);
            assertThat(current.version()).isEqualTo(1);
            assertThat(current.weights()).containsEntry("a", 100).containsEntry("b", 0);
        }

        @Test
        @DisplayName("should reject out of range weights and unknown endpoints")
        void shouldRejectInvalidEntries() {
            assertThatThrownBy(() -> registry.commitWeights(MODEL, Map.of("a", 110, "b", -10)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.commitWeights(MODEL, Map.of("a", 50, "zzz", 50)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should reject a second canary")
        void shouldRejectSecondCanary() {
            registry.register(draft("c", "v3"));

            assertThatThrownBy(() -> registry.commitWeights(MODEL, Map.of("a", 100),
                    Map.of("b", EndpointState.CANARY, "c", EndpointState.CANARY)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should notify listeners of committed snapshots")
        void shouldNotifyListeners() {
            List<RegistryEvent> events = new ArrayList<>();
            registry.addListener(events::add);

            registry.commitWeights(MODEL, Map.of("a", 50, "b", 50));
            registry.updateHealth("a", EndpointHealth.DEGRADED);
            registry.updateHealth("a", EndpointHealth.DEGRADED);

            assertThat(events).extracting(RegistryEvent::type)
                    .containsExactly(RegistryEvent.Type.WEIGHTS_COMMITTED, RegistryEvent.Type.HEALTH_CHANGED);
        }

        @Test
        @DisplayName("should never expose a snapshot whose weights do not sum to 100")
        void shouldKeepSumUnderConcurrency() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(4);
            CountDownLatch done = new CountDownLatch(4);
            AtomicBoolean violated = new AtomicBoolean();

            for (int t = 0; t < 3; t++) {
                int offset = t;
                executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        int w = (i + offset) % 101;
                        registry.commitWeights(MODEL, Map.of("a", w, "b", 100 - w));
                    }
                    done.countDown();
                });
            }
            executor.submit(() -> {
                for (int i = 0; i < 5000; i++) {
                    if (registry.getSnapshot(MODEL).totalWeight() != 100) {
                        violated.set(true);
                    }
                }
                done.countDown();
            });

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            assertThat(violated).isFalse();
            assertThat(registry.getSnapshot(MODEL).version()).isEqualTo(1 + 3 * 500);
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        @DisplayName("should persist snapshots in version order when commits race")
        void shouldPersistInVersionOrder() throws Exception {
            GatedStore gated = new GatedStore(2);
            EndpointRegistry gatedRegistry = new EndpointRegistry(gated, clock);
            gatedRegistry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("a", "v1", 0.01, 100),
                    TestEndpoints.active("b", "v1", 0.01, 0)));
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> first = executor.submit(() -> gatedRegistry.commitWeights(MODEL, Map.of("a", 70, "b", 30)));
                assertThat(gated.blocked.await(5, TimeUnit.SECONDS)).isTrue();
                Future<?> second = executor.submit(() -> gatedRegistry.commitWeights(MODEL, Map.of("a", 10, "b", 90)));
                Thread.sleep(50);
                gated.release.countDown();
                first.get(5, TimeUnit.SECONDS);
                second.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            RegistrySnapshot persisted = gated.get(EndpointRegistry.STORE_PREFIX + MODEL, RegistrySnapshot.class).orElseThrow();
            assertThat(gatedRegistry.getSnapshot(MODEL).version()).isEqualTo(3);
            assertThat(persisted.version()).isEqualTo(3);
            assertThat(persisted.weights()).containsEntry("a", 10).containsEntry("b", 90);
            assertThat(gated.versions).containsExactly(1L, 2L, 3L);
        }

        @Test
        @DisplayName("should not persist when a mutation changes nothing")
        void shouldSkipUnchangedSnapshots() {
            GatedStore recording = new GatedStore(-1);
            EndpointRegistry recordingRegistry = new EndpointRegistry(recording, clock);
            recordingRegistry.bootstrap(MODEL, List.of(TestEndpoints.active("a", "v1", 0.01, 100)));

            recordingRegistry.updateHealth("a", recordingRegistry.findEndpoint("a").orElseThrow().health());

            assertThat(recording.versions).containsExactly(1L);
        }
    }

    /**
     * Records the version of every persisted registry snapshot and holds the put of one version
     * until released.
     */
    private static final class GatedStore implements SnapshotStore {

        private final InMemorySnapshotStore delegate = new InMemorySnapshotStore();
        private final List<Long> versions = new CopyOnWriteArrayList<>();
        private final CountDownLatch blocked = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final long gatedVersion;

        GatedStore(long gatedVersion) {
            this.gatedVersion = gatedVersion;
        }

        @Override
        public <T> Optional<T> get(String key, Class<T> type) {
            return delegate.get(key, type);
        }

        @Override
        public void put(String key, Object snapshot) {
            if (snapshot instanceof RegistrySnapshot registrySnapshot) {
                if (registrySnapshot.version() == gatedVersion) {
                    blocked.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                }
                versions.add(registrySnapshot.version());
            }
            delegate.put(key, snapshot);
        }

        @Override
        public void delete(String key) {
            delegate.delete(key);
        }
    }

    @Test
    @DisplayName("should restore the persisted snapshot in a new registry")
    void shouldRestorePersistedSnapshot() {
        registry.bootstrap(MODEL, List.of(
                TestEndpoints.active("a", "v1", 0.01, 70),
                TestEndpoints.active("b", "v1", 0.01, 30)));
        registry.transitionState("b", EndpointState.ACTIVE);

        EndpointRegistry restarted = new EndpointRegistry(store, clock);

        assertThat(restarted.restore(MODEL)).isTrue();
        assertThat(restarted.getSnapshot(MODEL).version()).isEqualTo(2);
        assertThat(restarted.getSnapshot(MODEL).weights()).containsEntry("a", 70).containsEntry("b", 30);
        assertThat(restarted.findEndpoint("b")).isPresent();
        assertThat(restarted.restore("unknown")).isFalse();
    }

    @Test
    @DisplayName("should return an empty snapshot for unknown models")
    void shouldReturnEmptySnapshotForUnknownModel() {
        RegistrySnapshot snapshot = registry.getSnapshot("nope");

        assertThat(snapshot.version()).isZero();
        assertThat(snapshot.endpoints()).isEmpty();
    }
}
