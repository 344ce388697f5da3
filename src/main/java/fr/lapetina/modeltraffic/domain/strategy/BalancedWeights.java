package fr.lapetina.modeltraffic.domain.strategy;

/**
 * Term weights of the BALANCED score: {@code cost·(1/cost) + latency·(1/latency) + load·(1 - load)}.
 */
public record BalancedWeights(double cost, double latency, double load) {

    public static final BalancedWeights DEFAULT = new BalancedWeights(0.3, 0.4, 0.3);

    public BalancedWeights {
        if (cost < 0 || latency < 0 || load < 0
                || Double.isNaN(cost) || Double.isNaN(latency) || Double.isNaN(load)) {
            throw new IllegalArgumentException("Balanced weights must be non-negative");
        }
        if (cost + latency + load == 0) {
            throw new IllegalArgumentException("At least one balanced weight must be positive");
        }
    }
}
