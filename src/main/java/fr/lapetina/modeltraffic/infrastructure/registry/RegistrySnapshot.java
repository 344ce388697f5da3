package fr.lapetina.modeltraffic.infrastructure.registry;

import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned view of every endpoint of one model.
 *
 * Endpoints are ordered by id so that iteration order is stable across snapshots.
 */
public record RegistrySnapshot(
        String model,
        long version,
        List<ModelEndpoint> endpoints,
        Instant committedAt
) {
    public RegistrySnapshot {
        Objects.requireNonNull(model, "Model is required");
        endpoints = endpoints.stream()
                .sorted(Comparator.comparing(ModelEndpoint::id))
                .toList();
    }

    public Optional<ModelEndpoint> endpoint(String endpointId) {
        return endpoints.stream()
                .filter(e -> e.id().equals(endpointId))
                .findFirst();
    }

    public boolean contains(String endpointId) {
        return endpoint(endpointId).isPresent();
    }

    public int totalWeight() {
        return endpoints.stream().mapToInt(ModelEndpoint::weight).sum();
    }

    /**
     * Weight table keyed by endpoint id, in id order.
     */
    public Map<String, Integer> weights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        for (ModelEndpoint endpoint : endpoints) {
            weights.put(endpoint.id(), endpoint.weight());
        }
        return weights;
    }

    /**
     * Endpoints that currently hold traffic weight.
     */
    public List<ModelEndpoint> servingEndpoints() {
        return endpoints.stream()
                .filter(ModelEndpoint::isServing)
                .toList();
    }

    public List<ModelEndpoint> endpointsInState(EndpointState state) {
        return endpoints.stream()
                .filter(e -> e.state() == state)
                .toList();
    }

    public Optional<ModelEndpoint> canary() {
        return endpointsInState(EndpointState.CANARY).stream().findFirst();
    }
}
