package fr.lapetina.modeltraffic.domain.strategy;

import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingStrategyTest {

    private static EndpointStats stats(String id, double cost, double latencyMs, double load) {
        ModelEndpoint endpoint = TestEndpoints.active(id, "v1", cost, 0);
        return new EndpointStats(endpoint, latencyMs, load);
    }

    @Nested
    @DisplayName("CostOptimized")
    class CostOptimizedTests {

        @Test
        @DisplayName("should select cheapest endpoint")
        void shouldSelectCheapest() {
            List<EndpointStats> candidates = List.of(
                    stats("a", 0.02, 10, 0),
                    stats("b", 0.01, 500, 0.9));

            assertThat(RoutingStrategy.COST_OPTIMIZED.select(candidates, RoutingParameters.DEFAULT))
                    .map(EndpointStats::id)
                    .contains("b");
        }

        @Test
        @DisplayName("should break ties by endpoint id")
        void shouldBreakTiesById() {
            List<EndpointStats> candidates = List.of(
                    stats("z", 0.01, 10, 0),
                    stats("m", 0.01, 10, 0));

            assertThat(RoutingStrategy.COST_OPTIMIZED.select(candidates, RoutingParameters.DEFAULT))
                    .map(EndpointStats::id)
                    .contains("m");
        }
    }

    @Nested
    @DisplayName("PerformanceOptimized")
    class PerformanceOptimizedTests {

        @Test
        @DisplayName("should select fastest endpoint below load threshold")
        void shouldSelectFastestBelowThreshold() {
            List<EndpointStats> candidates = List.of(
                    stats("fast-busy", 0.01, 50, 0.95),
                    stats("slow-idle", 0.01, 200, 0.1),
                    stats("medium-idle", 0.01, 120, 0.5));

            assertThat(RoutingStrategy.PERFORMANCE_OPTIMIZED.select(candidates, RoutingParameters.DEFAULT))
                    .map(EndpointStats::id)
                    .contains("medium-idle");
        }

        @Test
        @DisplayName("should fall back to all candidates when all are loaded")
        void shouldFallBackWhenAllLoaded() {
            List<EndpointStats> candidates = List.of(
                    stats("a", 0.01, 300, 0.9),
                    stats("b", 0.01, 100, 1.0));

            assertThat(RoutingStrategy.PERFORMANCE_OPTIMIZED.select(candidates, RoutingParameters.DEFAULT))
                    .map(EndpointStats::id)
                    .contains("b");
        }
    }

    @Nested
    @DisplayName("Balanced")
    class BalancedTests {

        @Test
        @DisplayName("should prefer endpoint best on weighted score")
        void shouldPreferBestScore() {
            List<EndpointStats> candidates = List.of(
                    stats("cheap-slow", 0.001, 1000, 0.5),
                    stats("fair-fast", 0.002, 100, 0.1));

            // cheap-slow: 0.3*1 + 0.4*0.1 + 0.3*0.5 = 0.49; fair-fast: 0.3*0.5 + 0.4*1 + 0.3*0.9 = 0.82
            assertThat(RoutingStrategy.BALANCED.select(candidates, RoutingParameters.DEFAULT))
                    .map(EndpointStats::id)
                    .contains("fair-fast");
        }

        @Test
        @DisplayName("should honour custom weights")
        void shouldHonourCustomWeights() {
            List<EndpointStats> candidates = List.of(
                    stats("cheap-slow", 0.001, 1000, 0.5),
                    stats("fair-fast", 0.002, 100, 0.1));
            RoutingParameters costHeavy = new RoutingParameters(0.8, new BalancedWeights(1.0, 0.0, 0.0));

            assertThat(RoutingStrategy.BALANCED.select(candidates, costHeavy))
                    .map(EndpointStats::id)
                    .contains("cheap-slow");
        }

        @Test
        @DisplayName("should return empty for no candidates")
        void shouldReturnEmptyForNoCandidates() {
            assertThat(RoutingStrategy.BALANCED.select(List.of(), RoutingParameters.DEFAULT)).isEmpty();
        }
    }

    @Test
    @DisplayName("should select the same endpoint regardless of candidate order")
    void shouldBeOrderIndependent() {
        List<EndpointStats> candidates = new ArrayList<>(List.of(
                stats("a", 0.01, 100, 0.2),
                stats("b", 0.01, 100, 0.2),
                stats("c", 0.01, 100, 0.2)));

        for (RoutingStrategy strategy : RoutingStrategy.values()) {
            String first = strategy.select(candidates, RoutingParameters.DEFAULT).orElseThrow().id();
            Collections.reverse(candidates);
            String second = strategy.select(candidates, RoutingParameters.DEFAULT).orElseThrow().id();
            assertThat(second).as(strategy.getName()).isEqualTo(first).isEqualTo("a");
        }
    }

    @Test
    @DisplayName("should resolve strategy from configuration names")
    void shouldResolveFromName() {
        assertThat(RoutingStrategy.fromName("cost-optimized")).contains(RoutingStrategy.COST_OPTIMIZED);
        assertThat(RoutingStrategy.fromName("PERFORMANCE_OPTIMIZED")).contains(RoutingStrategy.PERFORMANCE_OPTIMIZED);
        assertThat(RoutingStrategy.fromName(" Balanced ")).contains(RoutingStrategy.BALANCED);
        assertThat(RoutingStrategy.fromName("round-robin")).isEmpty();
        assertThat(RoutingStrategy.fromName(null)).isEmpty();
    }
}
