package fr.lapetina.modeltraffic.infrastructure.metrics;

import fr.lapetina.modeltraffic.domain.model.AggregateWindow;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestMetricSample;
import fr.lapetina.modeltraffic.support.MutableClock;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsCollectorTest {

    private MutableClock clock;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        collector = new MetricsCollector(clock, 100, Duration.ofHours(1));
    }

    @Nested
    @DisplayName("Aggregates")
    class AggregateTests {

        @Test
        @DisplayName("should compute latency percentiles and error rate")
        void shouldComputeAggregate() {
            for (int i = 1; i <= 20; i++) {
                collector.record("a", i * 10, i > 2, 50);
            }

            AggregateWindow aggregate = collector.getAggregate("a", Duration.ofMinutes(5));

            assertThat(aggregate.sampleCount()).isEqualTo(20);
            assertThat(aggregate.avgLatencyMs()).isCloseTo(105.0, within(1e-9));
            assertThat(aggregate.p50LatencyMs()).isEqualTo(100.0);
            assertThat(aggregate.p95LatencyMs()).isEqualTo(190.0);
            assertThat(aggregate.errorRate()).isCloseTo(0.1, within(1e-9));
            assertThat(aggregate.totalTokens()).isEqualTo(1000);
        }

        @Test
        @DisplayName("should return an empty aggregate without samples")
        void shouldReturnEmptyAggregate() {
            AggregateWindow aggregate = collector.getAggregate("none", Duration.ofMinutes(5));

            assertThat(aggregate.isEmpty()).isTrue();
            assertThat(aggregate.errorRate()).isZero();
            assertThat(aggregate.costPerRequest()).isZero();
        }

        @Test
        @DisplayName("should only include samples within the window")
        void shouldRespectWindow() {
            TestEndpoints.record(collector, "a", 10, 10, 500);
            clock.advance(Duration.ofMinutes(10));
            TestEndpoints.record(collector, "a", 5, 0, 100);

            AggregateWindow recent = collector.getAggregate("a", Duration.ofMinutes(5));

            assertThat(recent.sampleCount()).isEqualTo(5);
            assertThat(recent.errorRate()).isZero();
        }

        @Test
        @DisplayName("should aggregate several endpoints as one group")
        void shouldAggregateGroup() {
            TestEndpoints.record(collector, "a", 10, 1, 100);
            TestEndpoints.record(collector, "b", 10, 3, 100);

            AggregateWindow group = collector.getAggregate(List.of("a", "b"), Duration.ofMinutes(5));

            assertThat(group.sampleCount()).isEqualTo(20);
            assertThat(group.errorRate()).isCloseTo(0.2, within(1e-9));
            assertThat(group.endpointId()).isEqualTo("a,b");
        }

        @Test
        @DisplayName("should derive cost from the resolved price per token")
        void shouldDeriveCost() {
            collector.setCostResolver(id -> "a".equals(id) ? 0.01 : 0.0);
            collector.record("a", 100, true, 200);
            collector.record("a", 100, true, 300);

            AggregateWindow aggregate = collector.getAggregate("a", Duration.ofMinutes(1));

            assertThat(aggregate.derivedCost()).isCloseTo(5.0, within(1e-9));
            assertThat(aggregate.costPerRequest()).isCloseTo(2.5, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Recent latency")
    class RecentLatencyTests {

        @Test
        @DisplayName("should start at the first sample and move toward newer latencies")
        void shouldFollowLatencyChange() {
            collector.record("a", 100, true, 10);
            assertThat(collector.recentLatency("a", Duration.ofMinutes(1)).getAsDouble())
                    .isCloseTo(100.0, within(1e-9));

            for (int i = 0; i < 50; i++) {
                collector.record("a", 1000, true, 10);
            }

            assertThat(collector.recentLatency("a", Duration.ofMinutes(1)).getAsDouble())
                    .isCloseTo(1000.0, within(1.0));
        }

        @Test
        @DisplayName("should be empty for unknown endpoints and once the last sample leaves the window")
        void shouldExpire() {
            assertThat(collector.recentLatency("none", Duration.ofMinutes(1))).isEmpty();

            collector.record("a", 100, true, 10);
            clock.advance(Duration.ofSeconds(30));
            assertThat(collector.recentLatency("a", Duration.ofMinutes(1))).isPresent();

            clock.advance(Duration.ofMinutes(1));
            assertThat(collector.recentLatency("a", Duration.ofMinutes(1))).isEmpty();
        }

        @Test
        @DisplayName("should be cleared when the endpoint is forgotten")
        void shouldForgetEstimate() {
            collector.record("a", 100, true, 10);

            collector.forget("a");

            assertThat(collector.recentLatency("a", Duration.ofMinutes(1))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Retention")
    class RetentionTests {

        @Test
        @DisplayName("should keep only the newest samples at capacity")
        void shouldOverwriteOldest() {
            for (int i = 0; i < 150; i++) {
                collector.record("a", i, true, 0);
            }

            assertThat(collector.bufferedSamples("a")).isEqualTo(100);
            assertThat(collector.getAggregate("a", Duration.ofMinutes(1)).p50LatencyMs()).isGreaterThanOrEqualTo(50);
        }

        @Test
        @DisplayName("should drop invalid and expired samples")
        void shouldDropInvalidSamples() {
            collector.record("a", -5, true, 10);
            collector.record("a", Double.NaN, true, 10);
            collector.record(new RequestMetricSample(clock.instant().minus(Duration.ofHours(2)), "a", 10, true, 1));

            assertThat(collector.getDroppedSamples()).isEqualTo(3);
            assertThat(collector.bufferedSamples("a")).isZero();
        }

        @Test
        @DisplayName("should forget an endpoint")
        void shouldForget() {
            TestEndpoints.record(collector, "a", 5, 0, 10);
            collector.acquire("a");

            collector.forget("a");

            assertThat(collector.bufferedSamples("a")).isZero();
            assertThat(collector.getInFlight("a")).isZero();
        }
    }

    @Test
    @DisplayName("should track in-flight requests and load")
    void shouldTrackInFlight() {
        ModelEndpoint endpoint = TestEndpoints.active("a", "v1", 0.01, 100);

        collector.acquire("a");
        collector.acquire("a");
        collector.acquire("b");

        assertThat(collector.getInFlight("a")).isEqualTo(2);
        assertThat(collector.getTotalInFlight()).isEqualTo(3);
        assertThat(collector.load(endpoint)).isCloseTo(0.2, within(1e-9));

        collector.release("a");
        collector.release("a");
        collector.release("a");
        assertThat(collector.getInFlight("a")).isZero();
    }

    @Test
    @DisplayName("should record concurrently without losing samples")
    void shouldRecordConcurrently() throws Exception {
        MetricsCollector large = new MetricsCollector(clock, 10_000, Duration.ofHours(1));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch latch = new CountDownLatch(8);

        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    large.record("a", 10, true, 1);
                }
                latch.countDown();
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(large.getAggregate("a", Duration.ofMinutes(1)).sampleCount()).isEqualTo(8000);
    }
}
