package fr.lapetina.modeltraffic.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a request dispatched through the routing pipeline.
 * Immutable and thread-safe.
 */
public record InferenceResult(
        String requestId,
        String model,
        String endpointId,
        String output,
        int tokens,
        Duration latency,
        ErrorType errorType,
        String errorMessage
) {
    public InferenceResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Creates a successful result.
     */
    public static InferenceResult success(
            String requestId,
            String model,
            String endpointId,
            String output,
            int tokens
    ) {
        return new InferenceResult(requestId, model, endpointId, output, tokens, Duration.ZERO, null, null);
    }

    /**
     * Creates an error result.
     */
    public static InferenceResult error(
            String requestId,
            String model,
            String endpointId,
            ErrorType errorType,
            String errorMessage
    ) {
        return new InferenceResult(requestId, model, endpointId, null, 0, Duration.ZERO, errorType, errorMessage);
    }

    public InferenceResult withLatency(Duration measured) {
        return new InferenceResult(requestId, model, endpointId, output, tokens, measured, errorType, errorMessage);
    }
}
