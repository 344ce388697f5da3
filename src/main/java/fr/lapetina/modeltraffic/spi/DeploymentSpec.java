package fr.lapetina.modeltraffic.spi;

import java.util.Map;

/**
 * Deployment parameters handed to the {@link DeploymentBackend}.
 */
public record DeploymentSpec(
        String endpointId,
        double costPerToken,
        int maxConcurrentRequests,
        Map<String, String> settings
) {
    public DeploymentSpec {
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }
}
