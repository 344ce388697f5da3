package fr.lapetina.modeltraffic.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single request served by an endpoint.
 * Immutable and thread-safe.
 */
public record RequestMetricSample(
        Instant timestamp,
        String endpointId,
        double latencyMs,
        boolean success,
        int tokens
) {
    public RequestMetricSample {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        Objects.requireNonNull(endpointId, "Endpoint ID is required");
        if (Double.isNaN(latencyMs) || Double.isInfinite(latencyMs) || latencyMs < 0) {
            throw new IllegalArgumentException("Latency must be a finite non-negative value: " + latencyMs);
        }
        if (tokens < 0) {
            throw new IllegalArgumentException("Token count must be non-negative: " + tokens);
        }
    }
}
