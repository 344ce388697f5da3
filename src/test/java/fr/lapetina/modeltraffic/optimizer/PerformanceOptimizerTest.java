package fr.lapetina.modeltraffic.optimizer;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.Recommendation;
import fr.lapetina.modeltraffic.domain.model.RecommendationType;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.store.InMemorySnapshotStore;
import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.support.MutableClock;
import fr.lapetina.modeltraffic.support.RecordingNotificationSink;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static fr.lapetina.modeltraffic.support.TestEndpoints.MODEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PerformanceOptimizerTest {

    private MutableClock clock;
    private InMemorySnapshotStore store;
    private EndpointRegistry registry;
    private MetricsCollector collector;
    private RecordingNotificationSink sink;
    private MetricsRegistry metrics;
    private PerformanceOptimizer optimizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemorySnapshotStore();
        registry = new EndpointRegistry(store, clock);
        registry.bootstrap(MODEL, List.of(
                TestEndpoints.active("pricey", "v1", 0.010, 50),
                TestEndpoints.active("cheap", "v1", 0.004, 50)));
        collector = new MetricsCollector(clock, 10_000, Duration.ofHours(3));
        sink = new RecordingNotificationSink();
        metrics = new MetricsRegistry("test");
        optimizer = new PerformanceOptimizer(registry, collector, sink, store, metrics, clock,
                OptimizerSettings.DEFAULT);
    }

    @AfterEach
    void tearDown() {
        optimizer.close();
        metrics.close();
    }

    @Nested
    @DisplayName("Baseline")
    class BaselineTests {

        @Test
        @DisplayName("should capture endpoints with enough history")
        void shouldEstablishBaseline() {
            TestEndpoints.record(collector, "pricey", 40, 0, 100);
            TestEndpoints.record(collector, "cheap", 10, 0, 100);

            PerformanceBaseline baseline = optimizer.establishBaseline(MODEL);

            assertThat(baseline.endpoints()).containsOnlyKeys("pricey");
            assertThat(optimizer.getBaseline(MODEL)).contains(baseline);
        }

        @Test
        @DisplayName("should refuse a baseline without enough history")
        void shouldRefuseInsufficientHistory() {
            TestEndpoints.record(collector, "pricey", 5, 0, 100);

            assertThatThrownBy(() -> optimizer.establishBaseline(MODEL))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Insufficient history");
            assertThatThrownBy(() -> optimizer.establishBaseline("unknown"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should reload a persisted baseline")
        void shouldReloadPersistedBaseline() {
            TestEndpoints.record(collector, "pricey", 40, 0, 100);
            optimizer.establishBaseline(MODEL);

            PerformanceOptimizer restarted = new PerformanceOptimizer(registry, collector, sink, store, metrics,
                    clock, OptimizerSettings.DEFAULT);

            assertThat(restarted.getBaseline(MODEL)).isPresent();
        }
    }

    @Nested
    @DisplayName("Degradation analysis")
    class AnalysisTests {

        @BeforeEach
        void setUp() {
            TestEndpoints.record(collector, "pricey", 60, 0, 100);
            TestEndpoints.record(collector, "cheap", 60, 0, 100);
            optimizer.establishBaseline(MODEL);
            clock.advance(Duration.ofMinutes(30));
        }

        @Test
        @DisplayName("should require a baseline")
        void shouldRequireBaseline() {
            assertThatThrownBy(() -> optimizer.analyzeDegradation("mistral"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should recommend caching for a latency regression with spare capacity")
        void shouldRecommendCaching() {
            TestEndpoints.record(collector, "pricey", 40, 0, 200);
            TestEndpoints.record(collector, "cheap", 40, 0, 100);

            List<Recommendation> recommendations = optimizer.analyzeDegradation(MODEL);

            assertThat(recommendations).extracting(Recommendation::type)
                    .contains(RecommendationType.ENABLE_CACHING);
        }

        @Test
        @DisplayName("should recommend scaling up a regressed endpoint under high load")
        void shouldRecommendScaleUp() {
            TestEndpoints.record(collector, "pricey", 40, 0, 200);
            TestEndpoints.record(collector, "cheap", 40, 0, 100);
            for (int i = 0; i < 9; i++) {
                collector.acquire("pricey");
            }

            assertThat(optimizer.analyzeDegradation(MODEL))
                    .filteredOn(r -> r.endpointId().equals("pricey"))
                    .extracting(Recommendation::type)
                    .contains(RecommendationType.SCALE_UP)
                    .doesNotContain(RecommendationType.ENABLE_CACHING);
        }

        @Test
        @DisplayName("should flag an error rate increase")
        void shouldFlagErrors() {
            TestEndpoints.record(collector, "pricey", 40, 8, 100);
            TestEndpoints.record(collector, "cheap", 40, 0, 100);

            assertThat(optimizer.analyzeDegradation(MODEL))
                    .extracting(Recommendation::type)
                    .contains(RecommendationType.INVESTIGATE_ERRORS);
        }

        @Test
        @DisplayName("should suggest a cheaper endpoint within the latency SLA")
        void shouldSuggestCheaperEndpoint() {
            TestEndpoints.record(collector, "pricey", 40, 0, 100);
            TestEndpoints.record(collector, "cheap", 40, 0, 100);

            List<Recommendation> recommendations = optimizer.analyzeDegradation(MODEL);

            assertThat(recommendations).singleElement().satisfies(r -> {
                assertThat(r.type()).isEqualTo(RecommendationType.SWITCH_TO_CHEAPER_ENDPOINT);
                assertThat(r.endpointId()).isEqualTo("pricey");
                assertThat(r.expectedImprovement()).isCloseTo(0.6, within(1e-9));
            });
            assertThat(sink.types()).containsExactly(ControllerEvent.Type.RECOMMENDATION);
            assertThat(optimizer.latestRecommendations(MODEL)).isEqualTo(recommendations);
        }

        @Test
        @DisplayName("should rank recommendations by expected improvement")
        void shouldRankRecommendations() {
            TestEndpoints.record(collector, "pricey", 40, 20, 100);
            TestEndpoints.record(collector, "cheap", 40, 0, 100);

            List<Recommendation> recommendations = optimizer.analyzeDegradation(MODEL);

            assertThat(recommendations).hasSizeGreaterThanOrEqualTo(2);
            assertThat(recommendations).extracting(Recommendation::expectedImprovement)
                    .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        }
    }
}
