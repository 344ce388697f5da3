package fr.lapetina.modeltraffic.routing;

import fr.lapetina.modeltraffic.domain.exception.NoHealthyEndpointException;
import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;
import fr.lapetina.modeltraffic.domain.strategy.RoutingParameters;
import fr.lapetina.modeltraffic.domain.strategy.RoutingStrategy;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.store.InMemorySnapshotStore;
import fr.lapetina.modeltraffic.support.MutableClock;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static fr.lapetina.modeltraffic.support.TestEndpoints.MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class RouterTest {

    private MutableClock clock;
    private EndpointRegistry registry;
    private MetricsCollector collector;
    private Router router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new EndpointRegistry(new InMemorySnapshotStore(), clock);
        collector = new MetricsCollector(clock, 1000, Duration.ofHours(1));
        router = new Router(registry, collector, RoutingStrategy.BALANCED, RoutingParameters.DEFAULT,
                Duration.ofMinutes(1));
    }

    private static String requestIdInBucket(int fromInclusive, int toExclusive) {
        return IntStream.range(0, 100_000)
                .mapToObj(i -> "req-" + i)
                .filter(id -> {
                    int bucket = Router.bucket(id);
                    return bucket >= fromInclusive && bucket < toExclusive;
                })
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Strategy selection")
    class StrategySelectionTests {

        @Test
        @DisplayName("should always select the cheaper endpoint with cost-optimized strategy")
        void shouldAlwaysSelectCheaperEndpoint() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("cheap", "v1", 0.01, 50),
                    TestEndpoints.active("pricey", "v1", 0.02, 50)));
            router.setStrategy(RoutingStrategy.COST_OPTIMIZED);

            for (int i = 0; i < 1000; i++) {
                assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("cheap");
            }
            assertThat(router.trafficStatistics(MODEL)).containsEntry("cheap", 1000L).containsEntry("pricey", 0L);
        }

        @Test
        @DisplayName("should skip a down endpoint within the selected version")
        void shouldSkipDownEndpoint() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("cheap", "v1", 0.01, 50),
                    TestEndpoints.active("pricey", "v1", 0.02, 50)));
            router.setStrategy(RoutingStrategy.COST_OPTIMIZED);
            registry.updateHealth("cheap", EndpointHealth.DOWN);

            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("pricey");
        }

        @Test
        @DisplayName("should keep degraded endpoints eligible")
        void shouldKeepDegradedEndpointsEligible() {
            registry.bootstrap(MODEL, List.of(TestEndpoints.active("only", "v1", 0.01, 100)));
            registry.updateHealth("only", EndpointHealth.DEGRADED);

            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("only");
        }

        @Test
        @DisplayName("should prefer the faster endpoint with performance strategy")
        void shouldPreferFasterEndpoint() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("slow", "v1", 0.01, 50),
                    TestEndpoints.active("fast", "v1", 0.01, 50)));
            TestEndpoints.record(collector, "slow", 20, 0, 800);
            TestEndpoints.record(collector, "fast", 20, 0, 100);
            router.setStrategy(RoutingStrategy.PERFORMANCE_OPTIMIZED);

            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("fast");
        }

        @Test
        @DisplayName("should switch strategy at runtime")
        void shouldSwitchStrategy() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("cheap-slow", "v1", 0.001, 50),
                    TestEndpoints.active("pricey-fast", "v1", 0.01, 50)));
            TestEndpoints.record(collector, "cheap-slow", 20, 0, 2000);
            TestEndpoints.record(collector, "pricey-fast", 20, 0, 50);

            router.setStrategy(RoutingStrategy.COST_OPTIMIZED);
            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("cheap-slow");

            router.setStrategy(RoutingStrategy.PERFORMANCE_OPTIMIZED);
            assertThat(router.getStrategy()).isEqualTo(RoutingStrategy.PERFORMANCE_OPTIMIZED);
            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("pricey-fast");
        }
    }

    @Nested
    @DisplayName("Latency lookup")
    class LatencyLookupTests {

        @Test
        @DisplayName("should move traffic away from an endpoint that slows down")
        void shouldReactToSlowdown() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("a", "v1", 0.01, 50),
                    TestEndpoints.active("b", "v1", 0.01, 50)));
            router.setStrategy(RoutingStrategy.PERFORMANCE_OPTIMIZED);
            TestEndpoints.record(collector, "a", 20, 0, 100);
            TestEndpoints.record(collector, "b", 20, 0, 300);
            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("a");

            TestEndpoints.record(collector, "a", 20, 0, 900);

            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("b");
        }

        @Test
        @DisplayName("should treat endpoints whose samples left the window as average")
        void shouldIgnoreStaleLatency() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("stale", "v1", 0.01, 50),
                    TestEndpoints.active("fresh", "v1", 0.01, 50)));
            router.setStrategy(RoutingStrategy.PERFORMANCE_OPTIMIZED);
            TestEndpoints.record(collector, "stale", 20, 0, 10);
            clock.advance(Duration.ofMinutes(2));
            TestEndpoints.record(collector, "fresh", 20, 0, 500);

            // Stale endpoint falls back to the mean of known latencies, which ties and breaks by id.
            assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("fresh");
        }

        @Test
        @DisplayName("should route quickly with full sample buffers")
        void shouldRouteQuicklyWithFullBuffers() {
            MetricsCollector large = new MetricsCollector(clock, 10_000, Duration.ofHours(1));
            Router busy = new Router(registry, large, RoutingStrategy.BALANCED, RoutingParameters.DEFAULT,
                    Duration.ofMinutes(1));
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("a", "v1", 0.01, 50),
                    TestEndpoints.active("b", "v1", 0.02, 50)));
            TestEndpoints.record(large, "a", 10_000, 0, 120);
            TestEndpoints.record(large, "b", 10_000, 0, 80);

            assertTimeout(Duration.ofSeconds(2), () -> {
                for (int i = 0; i < 20_000; i++) {
                    busy.route(RequestContext.of(MODEL));
                }
            });
            assertThat(busy.trafficStatistics(MODEL).values().stream().mapToLong(Long::longValue).sum())
                    .isEqualTo(20_000L);
        }
    }

    @Nested
    @DisplayName("Traffic split")
    class TrafficSplitTests {

        @BeforeEach
        void setUp() {
            registry.bootstrap(MODEL, List.of(
                    TestEndpoints.active("v1-a", "v1", 0.01, 90),
                    TestEndpoints.active("v2-a", "v2", 0.01, 10)));
        }

        @Test
        @DisplayName("should route the same request id to the same endpoint")
        void shouldBeDeterministic() {
            for (int i = 0; i < 200; i++) {
                String requestId = "req-" + i;
                String first = router.route(RequestContext.of(MODEL, requestId)).id();
                String second = router.route(RequestContext.of(MODEL, requestId)).id();
                assertThat(second).isEqualTo(first);
            }
        }

        @Test
        @DisplayName("should map buckets to versions by cumulative weight")
        void shouldMapBucketsToVersions() {
            assertThat(router.route(RequestContext.of(MODEL, requestIdInBucket(0, 90))).version()).isEqualTo("v1");
            assertThat(router.route(RequestContext.of(MODEL, requestIdInBucket(90, 100))).version()).isEqualTo("v2");
        }

        @Test
        @DisplayName("should send roughly the configured share to each version")
        void shouldApproximateConfiguredShare() {
            Map<String, Integer> counts = new HashMap<>();
            for (int i = 0; i < 10_000; i++) {
                ModelEndpoint endpoint = router.route(RequestContext.of(MODEL));
                counts.merge(endpoint.version(), 1, Integer::sum);
            }

            assertThat(counts.get("v2")).isBetween(700, 1300);
        }

        @Test
        @DisplayName("should not fall back to another version when the selected one is down")
        void shouldNotFallBackAcrossVersions() {
            registry.updateHealth("v2-a", EndpointHealth.DOWN);

            assertThatThrownBy(() -> router.route(RequestContext.of(MODEL, requestIdInBucket(90, 100))))
                    .isInstanceOf(NoHealthyEndpointException.class)
                    .extracting(e -> ((NoHealthyEndpointException) e).getReason())
                    .isEqualTo(NoHealthyEndpointException.Reason.VERSION_UNHEALTHY);
            assertThat(router.route(RequestContext.of(MODEL, requestIdInBucket(0, 90))).id()).isEqualTo("v1-a");
        }

        @Test
        @DisplayName("should never route to an endpoint without weight")
        void shouldNeverRouteToZeroWeight() {
            registry.commitWeights(MODEL, Map.of("v1-a", 100));

            for (int i = 0; i < 500; i++) {
                assertThat(router.route(RequestContext.of(MODEL)).id()).isEqualTo("v1-a");
            }
        }
    }

    @Test
    @DisplayName("should fail for unknown model")
    void shouldFailForUnknownModel() {
        assertThatThrownBy(() -> router.route(RequestContext.of("mistral")))
                .isInstanceOf(NoHealthyEndpointException.class)
                .extracting(e -> ((NoHealthyEndpointException) e).getReason())
                .isEqualTo(NoHealthyEndpointException.Reason.UNKNOWN_MODEL);
    }

    @Test
    @DisplayName("should keep buckets within range")
    void shouldKeepBucketsInRange() {
        for (int i = 0; i < 10_000; i++) {
            assertThat(Router.bucket("key-" + i)).isBetween(0, 99);
        }
    }
}
