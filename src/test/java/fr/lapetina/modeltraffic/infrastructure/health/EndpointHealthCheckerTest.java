package fr.lapetina.modeltraffic.infrastructure.health;

import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.store.InMemorySnapshotStore;
import fr.lapetina.modeltraffic.spi.HealthProbe;
import fr.lapetina.modeltraffic.support.MutableClock;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static fr.lapetina.modeltraffic.support.TestEndpoints.MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointHealthCheckerTest {

    private final Map<String, Boolean> healthy = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private EndpointRegistry registry;
    private EndpointHealthChecker checker;

    @BeforeEach
    void setUp() {
        registry = new EndpointRegistry(new InMemorySnapshotStore(), new MutableClock());
        registry.bootstrap(MODEL, List.of(
                TestEndpoints.active("a", "v1", 0.001, 50),
                TestEndpoints.active("b", "v1", 0.001, 50)));
        HealthProbe probe = endpoint -> {
            if (unreachable.contains(endpoint.id())) {
                throw new IllegalStateException("connection refused");
            }
            return CompletableFuture.completedFuture(healthy.getOrDefault(endpoint.id(), true));
        };
        checker = new EndpointHealthChecker(registry, probe, Duration.ofMinutes(1), Duration.ofSeconds(1), 3, 6);
    }

    @AfterEach
    void tearDown() {
        checker.close();
    }

    private EndpointHealth healthOf(String id) {
        return registry.findEndpoint(id).map(ModelEndpoint::health).orElseThrow();
    }

    private void runCycles(int cycles) {
        for (int i = 0; i < cycles; i++) {
            checker.checkAllEndpoints().join();
        }
    }

    @Test
    @DisplayName("should keep endpoints UP below the degraded threshold")
    void shouldTolerateSporadicFailures() {
        healthy.put("a", false);

        runCycles(2);

        assertThat(healthOf("a")).isEqualTo(EndpointHealth.UP);
        assertThat(checker.getConsecutiveFailures("a")).isEqualTo(2);
    }

    @Test
    @DisplayName("should mark DEGRADED then DOWN as failures accumulate")
    void shouldDegradeThenGoDown() {
        healthy.put("a", false);

        runCycles(3);
        assertThat(healthOf("a")).isEqualTo(EndpointHealth.DEGRADED);

        runCycles(3);
        assertThat(healthOf("a")).isEqualTo(EndpointHealth.DOWN);
        assertThat(healthOf("b")).isEqualTo(EndpointHealth.UP);
    }

    @Test
    @DisplayName("should bring an endpoint back UP after one successful probe")
    void shouldRecoverAfterSuccess() {
        healthy.put("a", false);
        runCycles(6);

        healthy.put("a", true);
        runCycles(1);

        assertThat(healthOf("a")).isEqualTo(EndpointHealth.UP);
        assertThat(checker.getConsecutiveFailures("a")).isZero();
    }

    @Test
    @DisplayName("should count a probe that throws as a failure")
    void shouldCountExceptionsAsFailures() {
        unreachable.add("b");

        runCycles(3);

        assertThat(healthOf("b")).isEqualTo(EndpointHealth.DEGRADED);
    }

    @Test
    @DisplayName("should count a probe that never completes as a failure")
    void shouldTimeOutSlowProbes() {
        EndpointHealthChecker slow = new EndpointHealthChecker(registry,
                endpoint -> new CompletableFuture<>(), Duration.ofMinutes(1), Duration.ofMillis(20), 1, 2);
        try {
            slow.checkAllEndpoints().join();

            assertThat(healthOf("a")).isEqualTo(EndpointHealth.DEGRADED);
        } finally {
            slow.close();
        }
    }

    @Test
    @DisplayName("should reject inconsistent thresholds")
    void shouldRejectBadThresholds() {
        HealthProbe probe = endpoint -> CompletableFuture.completedFuture(true);

        assertThatThrownBy(() -> new EndpointHealthChecker(registry, probe,
                Duration.ofSeconds(1), Duration.ofSeconds(1), 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EndpointHealthChecker(registry, probe,
                Duration.ofSeconds(1), Duration.ofSeconds(1), 4, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
