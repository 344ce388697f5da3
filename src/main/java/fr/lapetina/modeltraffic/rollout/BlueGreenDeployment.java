package fr.lapetina.modeltraffic.rollout;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable state of a blue-green deployment.
 *
 * @param blueWeights        weights of the blue endpoints before the swap
 * @param smokeTestAttempts  number of swap attempts blocked by a failing smoke test
 * @param swappedAt          when green took over, null before the swap
 */
public record BlueGreenDeployment(
        String id,
        BlueGreenConfig config,
        BlueGreenState state,
        String greenEndpointId,
        Map<String, Integer> blueWeights,
        int smokeTestAttempts,
        String lastSmokeTestReport,
        Instant swappedAt,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
    public BlueGreenDeployment {
        Objects.requireNonNull(id, "Deployment ID is required");
        Objects.requireNonNull(config, "Config is required");
        Objects.requireNonNull(state, "State is required");
        blueWeights = blueWeights != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(blueWeights))
                : Map.of();
    }

    public String model() {
        return config.model();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    BlueGreenDeployment withState(BlueGreenState newState, String reason, Instant at) {
        return new BlueGreenDeployment(id, config, newState, greenEndpointId, blueWeights, smokeTestAttempts,
                lastSmokeTestReport, swappedAt, reason != null ? reason : failureReason, createdAt, at);
    }

    BlueGreenDeployment withSmokeTestFailure(String report, Instant at) {
        return new BlueGreenDeployment(id, config, state, greenEndpointId, blueWeights, smokeTestAttempts + 1,
                report, swappedAt, failureReason, createdAt, at);
    }

    BlueGreenDeployment swapped(String report, Instant at) {
        return new BlueGreenDeployment(id, config, BlueGreenState.MONITORING, greenEndpointId, blueWeights,
                smokeTestAttempts, report, at, failureReason, createdAt, at);
    }
}
