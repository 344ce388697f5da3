package fr.lapetina.modeltraffic.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Routing-relevant view of an inbound inference request.
 * Immutable and thread-safe.
 *
 * <p>The request id is the routing key: two requests with the same id are split to the
 * same model version against the same registry snapshot.
 */
public record RequestContext(
        String requestId,
        String model,
        String correlationId,
        int estimatedTokens,
        Instant createdAt
) {
    public RequestContext {
        Objects.requireNonNull(model, "Model is required");
        if (model.isBlank()) {
            throw new IllegalArgumentException("Model must not be blank");
        }
        if (estimatedTokens < 0) {
            throw new IllegalArgumentException("Estimated tokens must be non-negative");
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates a context with a generated request id.
     */
    public static RequestContext of(String model) {
        return new RequestContext(null, model, null, 0, null);
    }

    /**
     * Creates a context with an explicit request id.
     */
    public static RequestContext of(String model, String requestId) {
        return new RequestContext(requestId, model, null, 0, null);
    }

    public String routingKey() {
        return requestId;
    }
}
