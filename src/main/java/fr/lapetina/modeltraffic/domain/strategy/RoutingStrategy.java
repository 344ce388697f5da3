package fr.lapetina.modeltraffic.domain.strategy;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of endpoint selection strategies.
 *
 * Each variant is a pure function of its candidates and parameters: the same input always
 * yields the same endpoint. Ties are broken by endpoint id, so candidate order does not matter.
 */
public enum RoutingStrategy {

    /**
     * Cheapest cost per token.
     */
    COST_OPTIMIZED("cost-optimized") {
        @Override
        public Optional<EndpointStats> select(List<EndpointStats> candidates, RoutingParameters parameters) {
            return candidates.stream()
                    .min(Comparator.comparingDouble(EndpointStats::costPerToken).thenComparing(BY_ID));
        }

        @Override
        public boolean usesLatency() {
            return false;
        }
    },

    /**
     * Lowest latency among candidates below the load threshold; the whole set when none is.
     */
    PERFORMANCE_OPTIMIZED("performance-optimized") {
        @Override
        public Optional<EndpointStats> select(List<EndpointStats> candidates, RoutingParameters parameters) {
            List<EndpointStats> unloaded = candidates.stream()
                    .filter(c -> c.load() < parameters.loadThreshold())
                    .toList();
            List<EndpointStats> pool = unloaded.isEmpty() ? candidates : unloaded;
            return pool.stream()
                    .min(Comparator.comparingDouble(EndpointStats::latencyMs).thenComparing(BY_ID));
        }
    },

    /**
     * Highest weighted score of inverse cost, inverse latency and spare capacity.
     *
     * The inverse terms are normalised against the best candidate so every term lies in [0, 1].
     */
    BALANCED("balanced") {
        @Override
        public Optional<EndpointStats> select(List<EndpointStats> candidates, RoutingParameters parameters) {
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            double minCost = candidates.stream()
                    .mapToDouble(c -> Math.max(c.costPerToken(), MIN_COST))
                    .min().orElse(MIN_COST);
            double minLatency = candidates.stream()
                    .mapToDouble(c -> Math.max(c.latencyMs(), MIN_LATENCY_MS))
                    .min().orElse(MIN_LATENCY_MS);
            BalancedWeights weights = parameters.balancedWeights();

            EndpointStats best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (EndpointStats candidate : candidates) {
                double score = score(candidate, minCost, minLatency, weights);
                if (best == null || score > bestScore
                        || (score == bestScore && candidate.id().compareTo(best.id()) < 0)) {
                    best = candidate;
                    bestScore = score;
                }
            }
            return Optional.of(best);
        }
    };

    static final double MIN_COST = 1e-9;
    static final double MIN_LATENCY_MS = 1.0;

    private static final Comparator<EndpointStats> BY_ID = Comparator.comparing(EndpointStats::id);

    private final String configName;

    RoutingStrategy(String configName) {
        this.configName = configName;
    }

    /**
     * Selects one endpoint among the candidates.
     *
     * @return the selected candidate, or empty if there is none
     */
    public abstract Optional<EndpointStats> select(List<EndpointStats> candidates, RoutingParameters parameters);

    /**
     * Whether {@link #select} reads {@link EndpointStats#latencyMs()}. Callers may skip the
     * latency lookup when it does not.
     */
    public boolean usesLatency() {
        return true;
    }

    /**
     * Returns the name used in configuration files and metrics.
     */
    public String getName() {
        return configName;
    }

    /**
     * Resolves a strategy from its configuration name or constant name, case-insensitively.
     */
    public static Optional<RoutingStrategy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RoutingStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    static double score(EndpointStats candidate, double minCost, double minLatency, BalancedWeights weights) {
        double costTerm = minCost / Math.max(candidate.costPerToken(), MIN_COST);
        double latencyTerm = minLatency / Math.max(candidate.latencyMs(), MIN_LATENCY_MS);
        double loadTerm = 1.0 - Math.min(candidate.load(), 1.0);
        return weights.cost() * costTerm + weights.latency() * latencyTerm + weights.load() * loadTerm;
    }
}
