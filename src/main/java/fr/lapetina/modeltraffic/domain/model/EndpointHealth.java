package fr.lapetina.modeltraffic.domain.model;

/**
 * Health status of a model endpoint.
 *
 * UP: Endpoint is healthy and accepting requests
 * DEGRADED: Endpoint is responding but with issues (recent probe failures)
 * DOWN: Endpoint is not responding and is excluded from routing
 */
public enum EndpointHealth {
    UP,
    DEGRADED,
    DOWN
}
