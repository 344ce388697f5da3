package fr.lapetina.modeltraffic.domain.model;

import java.util.Objects;

/**
 * Optimization recommendation for one endpoint.
 *
 * @param expectedImprovement estimated relative improvement in [0, 1]
 * @param confidence          confidence in [0, 1], derived from sample volume
 */
public record Recommendation(
        RecommendationType type,
        String model,
        String endpointId,
        String description,
        double expectedImprovement,
        double confidence
) {
    public Recommendation {
        Objects.requireNonNull(type, "Type is required");
        Objects.requireNonNull(endpointId, "Endpoint ID is required");
        expectedImprovement = clamp(expectedImprovement);
        confidence = clamp(confidence);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }
}
