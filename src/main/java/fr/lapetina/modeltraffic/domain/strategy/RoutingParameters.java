package fr.lapetina.modeltraffic.domain.strategy;

import java.util.Objects;

/**
 * Tunables shared by the routing strategies.
 *
 * @param loadThreshold   PERFORMANCE_OPTIMIZED only considers candidates whose load is strictly below this
 * @param balancedWeights term weights of the BALANCED score
 */
public record RoutingParameters(double loadThreshold, BalancedWeights balancedWeights) {

    public static final RoutingParameters DEFAULT = new RoutingParameters(0.8, BalancedWeights.DEFAULT);

    public RoutingParameters {
        Objects.requireNonNull(balancedWeights, "Balanced weights are required");
        if (loadThreshold <= 0 || Double.isNaN(loadThreshold)) {
            throw new IllegalArgumentException("Load threshold must be positive: " + loadThreshold);
        }
    }
}
