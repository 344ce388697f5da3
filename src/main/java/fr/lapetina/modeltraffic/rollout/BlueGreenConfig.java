package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;

import java.time.Duration;
import java.util.Map;

/**
 * Parameters of a blue-green deployment.
 *
 * @param rollbackWindow     how long blue is kept at weight 0 after the swap
 * @param errorRateThreshold green error rate above which the swap is reverted
 * @param minSampleCount     green samples required before the error rate is trusted
 * @param monitorInterval    delay between checks of green during the rollback window
 */
public record BlueGreenConfig(
        String model,
        String greenVersion,
        double costPerToken,
        int maxConcurrentRequests,
        Duration rollbackWindow,
        double errorRateThreshold,
        int minSampleCount,
        Duration monitorInterval,
        Map<String, String> settings
) {
    public BlueGreenConfig {
        if (rollbackWindow == null) {
            rollbackWindow = Duration.ofMinutes(30);
        }
        if (monitorInterval == null) {
            monitorInterval = Duration.ofSeconds(30);
        }
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * @throws ValidationException describing the first problem found
     */
    public void validate() {
        if (model == null || model.isBlank()) {
            throw new ValidationException("Blue-green model is required");
        }
        if (greenVersion == null || greenVersion.isBlank()) {
            throw new ValidationException("Blue-green green version is required");
        }
        if (!(costPerToken >= 0)) {
            throw new ValidationException("Cost per token must be non-negative: " + costPerToken);
        }
        if (maxConcurrentRequests < 1) {
            throw new ValidationException("Max concurrent requests must be positive: " + maxConcurrentRequests);
        }
        if (rollbackWindow.isNegative()) {
            throw new ValidationException("Rollback window must not be negative: " + rollbackWindow);
        }
        if (!(errorRateThreshold >= 0 && errorRateThreshold <= 1)) {
            throw new ValidationException("Error rate threshold must be within 0..1: " + errorRateThreshold);
        }
        if (minSampleCount < 1) {
            throw new ValidationException("Minimum sample count must be at least 1: " + minSampleCount);
        }
        if (monitorInterval.isZero() || monitorInterval.isNegative()) {
            throw new ValidationException("Monitor interval must be positive: " + monitorInterval);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String model;
        private String greenVersion;
        private double costPerToken;
        private int maxConcurrentRequests = 10;
        private Duration rollbackWindow = Duration.ofMinutes(30);
        private double errorRateThreshold = 0.05;
        private int minSampleCount = 20;
        private Duration monitorInterval = Duration.ofSeconds(30);
        private Map<String, String> settings = Map.of();

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder greenVersion(String greenVersion) {
            this.greenVersion = greenVersion;
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

        public Builder rollbackWindow(Duration rollbackWindow) {
            this.rollbackWindow = rollbackWindow;
            return this;
        }

        public Builder errorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
            return this;
        }

        public Builder minSampleCount(int minSampleCount) {
            this.minSampleCount = minSampleCount;
            return this;
        }

        public Builder monitorInterval(Duration monitorInterval) {
            this.monitorInterval = monitorInterval;
            return this;
        }

        public Builder settings(Map<String, String> settings) {
            this.settings = settings;
            return this;
        }

        public BlueGreenConfig build() {
            return new BlueGreenConfig(model, greenVersion, costPerToken, maxConcurrentRequests, rollbackWindow,
                    errorRateThreshold, minSampleCount, monitorInterval, settings);
        }
    }
}
