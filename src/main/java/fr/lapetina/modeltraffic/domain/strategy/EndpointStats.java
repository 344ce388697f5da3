package fr.lapetina.modeltraffic.domain.strategy;

import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;

import java.util.Objects;

/**
 * A routing candidate together with the metric view the strategies score it on.
 *
 * @param endpoint  candidate endpoint
 * @param latencyMs recent average latency; the router substitutes the candidates' mean when unknown
 * @param load      in-flight requests divided by the endpoint's max concurrent requests
 */
public record EndpointStats(ModelEndpoint endpoint, double latencyMs, double load) {

    public EndpointStats {
        Objects.requireNonNull(endpoint, "Endpoint is required");
        if (Double.isNaN(latencyMs) || latencyMs < 0) {
            latencyMs = 0;
        }
        if (Double.isNaN(load) || load < 0) {
            load = 0;
        }
    }

    public String id() {
        return endpoint.id();
    }

    public double costPerToken() {
        return endpoint.costPerToken();
    }
}
