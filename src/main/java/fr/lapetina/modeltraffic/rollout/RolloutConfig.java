package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a canary rollout.
 *
 * @param trafficSteps        canary weight per step, strictly ascending within 1..100
 * @param evaluationInterval  delay between evaluations; also the metric window compared
 * @param minSampleCount      samples required on each side before an evaluation counts
 * @param maxDeferrals        consecutive deferrals after which the rollout is aborted
 * @param costPerToken        cost per token of the canary endpoint
 * @param settings            opaque settings passed to the deployment backend
 */
public record RolloutConfig(
        String model,
        String canaryVersion,
        String baselineVersion,
        List<Integer> trafficSteps,
        SuccessCriteria successCriteria,
        Duration evaluationInterval,
        int minSampleCount,
        int maxDeferrals,
        double costPerToken,
        int maxConcurrentRequests,
        Map<String, String> settings
) {
    public static final List<Integer> DEFAULT_STEPS = List.of(5, 20, 50, 100);

    public RolloutConfig {
        trafficSteps = trafficSteps != null ? List.copyOf(trafficSteps) : DEFAULT_STEPS;
        if (successCriteria == null) {
            successCriteria = SuccessCriteria.DEFAULT;
        }
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * Checks the configuration. Called before any state change.
     *
     * @throws ValidationException describing the first problem found
     */
    public void validate() {
        requireText(model, "model");
        requireText(canaryVersion, "canaryVersion");
        requireText(baselineVersion, "baselineVersion");
        if (canaryVersion.equals(baselineVersion)) {
            throw new ValidationException("Canary and baseline versions must differ: " + canaryVersion);
        }
        if (trafficSteps.isEmpty()) {
            throw new ValidationException("At least one traffic step is required");
        }
        int previous = 0;
        for (Integer step : trafficSteps) {
            if (step == null || step < 1 || step > 100) {
                throw new ValidationException("Traffic step out of range 1..100: " + step);
            }
            if (step <= previous) {
                throw new ValidationException("Traffic steps must be strictly ascending: " + trafficSteps);
            }
            previous = step;
        }
        successCriteria.validate();
        if (evaluationInterval == null || evaluationInterval.isZero() || evaluationInterval.isNegative()) {
            throw new ValidationException("Evaluation interval must be positive: " + evaluationInterval);
        }
        if (minSampleCount < 1) {
            throw new ValidationException("Minimum sample count must be at least 1: " + minSampleCount);
        }
        if (maxDeferrals < 1) {
            throw new ValidationException("Max deferrals must be at least 1: " + maxDeferrals);
        }
        if (!(costPerToken >= 0)) {
            throw new ValidationException("Cost per token must be non-negative: " + costPerToken);
        }
        if (maxConcurrentRequests < 1) {
            throw new ValidationException("Max concurrent requests must be positive: " + maxConcurrentRequests);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Rollout " + field + " is required");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String model;
        private String canaryVersion;
        private String baselineVersion;
        private List<Integer> trafficSteps = DEFAULT_STEPS;
        private SuccessCriteria successCriteria = SuccessCriteria.DEFAULT;
        private Duration evaluationInterval = Duration.ofMinutes(5);
        private int minSampleCount = 50;
        private int maxDeferrals = 3;
        private double costPerToken;
        private int maxConcurrentRequests = 10;
        private Map<String, String> settings = Map.of();

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder canaryVersion(String canaryVersion) {
            this.canaryVersion = canaryVersion;
            return this;
        }

        public Builder baselineVersion(String baselineVersion) {
            this.baselineVersion = baselineVersion;
            return this;
        }

        public Builder trafficSteps(List<Integer> trafficSteps) {
            this.trafficSteps = trafficSteps;
            return this;
        }

        public Builder successCriteria(SuccessCriteria successCriteria) {
            this.successCriteria = successCriteria;
            return this;
        }

        public Builder evaluationInterval(Duration evaluationInterval) {
            this.evaluationInterval = evaluationInterval;
            return this;
        }

        public Builder minSampleCount(int minSampleCount) {
            this.minSampleCount = minSampleCount;
            return this;
        }

        public Builder maxDeferrals(int maxDeferrals) {
            this.maxDeferrals = maxDeferrals;
            return this;
        }

        public Builder costPerToken(double costPerToken) {
            this.costPerToken = costPerToken;
            return this;
        }

        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder settings(Map<String, String> settings) {
            this.settings = settings;
            return this;
        }

        public RolloutConfig build() {
            return new RolloutConfig(model, canaryVersion, baselineVersion, trafficSteps, successCriteria,
                    evaluationInterval, minSampleCount, maxDeferrals, costPerToken, maxConcurrentRequests,
                    settings);
        }
    }
}
