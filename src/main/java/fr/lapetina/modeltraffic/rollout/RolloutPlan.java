package fr.lapetina.modeltraffic.rollout;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fr.lapetina.modeltraffic.domain.model.AggregateWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable state of a canary rollout. The controller replaces the plan on every transition.
 *
 * @param stepIndex         index into the traffic steps; non-decreasing until a terminal rollback
 * @param canaryTraffic     weight currently committed to the canary
 * @param deferrals         consecutive evaluations deferred for lack of samples
 * @param baselineWeights   weights of the baseline endpoints when the rollout started
 * @param baselineReference last baseline aggregate that met the sample threshold
 */
public record RolloutPlan(
        String id,
        RolloutConfig config,
        RolloutState state,
        int stepIndex,
        int canaryTraffic,
        int deferrals,
        String canaryEndpointId,
        Map<String, Integer> baselineWeights,
        List<EvaluationRecord> history,
        AggregateWindow baselineReference,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
    static final int MAX_HISTORY = 100;

    public RolloutPlan {
        Objects.requireNonNull(id, "Plan ID is required");
        Objects.requireNonNull(config, "Config is required");
        Objects.requireNonNull(state, "State is required");
        baselineWeights = baselineWeights != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(baselineWeights))
                : Map.of();
        history = history != null ? List.copyOf(history) : List.of();
    }

    public String model() {
        return config.model();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    @JsonIgnore
    public boolean isFinalStep() {
        return stepIndex >= config.trafficSteps().size() - 1;
    }

    public RolloutPlan withEvaluation(EvaluationRecord record) {
        List<EvaluationRecord> next = new ArrayList<>(history);
        next.add(record);
        while (next.size() > MAX_HISTORY) {
            next.remove(0);
        }
        return toBuilder().history(next).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .config(config)
                .state(state)
                .stepIndex(stepIndex)
                .canaryTraffic(canaryTraffic)
                .deferrals(deferrals)
                .canaryEndpointId(canaryEndpointId)
                .baselineWeights(baselineWeights)
                .history(history)
                .baselineReference(baselineReference)
                .failureReason(failureReason)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private RolloutConfig config;
        private RolloutState state = RolloutState.PENDING;
        private int stepIndex;
        private int canaryTraffic;
        private int deferrals;
        private String canaryEndpointId;
        private Map<String, Integer> baselineWeights = Map.of();
        private List<EvaluationRecord> history = List.of();
        private AggregateWindow baselineReference;
        private String failureReason;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder config(RolloutConfig config) {
            this.config = config;
            return this;
        }

        public Builder state(RolloutState state) {
            this.state = state;
            return this;
        }

        public Builder stepIndex(int stepIndex) {
            this.stepIndex = stepIndex;
            return this;
        }

        public Builder canaryTraffic(int canaryTraffic) {
            this.canaryTraffic = canaryTraffic;
            return this;
        }

        public Builder deferrals(int deferrals) {
            this.deferrals = deferrals;
            return this;
        }

        public Builder canaryEndpointId(String canaryEndpointId) {
            this.canaryEndpointId = canaryEndpointId;
            return this;
        }

        public Builder baselineWeights(Map<String, Integer> baselineWeights) {
            this.baselineWeights = baselineWeights;
            return this;
        }

        public Builder history(List<EvaluationRecord> history) {
            this.history = history;
            return this;
        }

        public Builder baselineReference(AggregateWindow baselineReference) {
            this.baselineReference = baselineReference;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public RolloutPlan build() {
            return new RolloutPlan(id, config, state, stepIndex, canaryTraffic, deferrals, canaryEndpointId,
                    baselineWeights, history, baselineReference, failureReason, createdAt, updatedAt);
        }
    }
}
