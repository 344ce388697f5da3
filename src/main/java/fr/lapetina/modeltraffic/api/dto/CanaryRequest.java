package fr.lapetina.modeltraffic.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig;
import fr.lapetina.modeltraffic.rollout.RolloutConfig;
import fr.lapetina.modeltraffic.rollout.SuccessCriteria;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /rollouts/canary}. Missing fields take the configured rollout defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanaryRequest {

    private String model;

    @JsonProperty("canary_version")
    private String canaryVersion;

    @JsonProperty("baseline_version")
    private String baselineVersion;

    @JsonProperty("traffic_steps")
    private List<Integer> trafficSteps;

    @JsonProperty("max_error_rate_increase")
    private Double maxErrorRateIncrease;

    @JsonProperty("max_latency_increase")
    private Double maxLatencyIncrease;

    @JsonProperty("evaluation_interval_ms")
    private Long evaluationIntervalMs;

    @JsonProperty("min_sample_count")
    private Integer minSampleCount;

    @JsonProperty("max_deferrals")
    private Integer maxDeferrals;

    @JsonProperty("cost_per_token")
    private double costPerToken;

    @JsonProperty("max_concurrent_requests")
    private Integer maxConcurrentRequests;

    private Map<String, String> settings;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getCanaryVersion() { return canaryVersion; }
    public void setCanaryVersion(String canaryVersion) { this.canaryVersion = canaryVersion; }

    public String getBaselineVersion() { return baselineVersion; }
    public void setBaselineVersion(String baselineVersion) { this.baselineVersion = baselineVersion; }

    public List<Integer> getTrafficSteps() { return trafficSteps; }
    public void setTrafficSteps(List<Integer> trafficSteps) { this.trafficSteps = trafficSteps; }

    public Double getMaxErrorRateIncrease() { return maxErrorRateIncrease; }
    public void setMaxErrorRateIncrease(Double maxErrorRateIncrease) { this.maxErrorRateIncrease = maxErrorRateIncrease; }

    public Double getMaxLatencyIncrease() { return maxLatencyIncrease; }
    public void setMaxLatencyIncrease(Double maxLatencyIncrease) { this.maxLatencyIncrease = maxLatencyIncrease; }

    public Long getEvaluationIntervalMs() { return evaluationIntervalMs; }
    public void setEvaluationIntervalMs(Long evaluationIntervalMs) { this.evaluationIntervalMs = evaluationIntervalMs; }

    public Integer getMinSampleCount() { return minSampleCount; }
    public void setMinSampleCount(Integer minSampleCount) { this.minSampleCount = minSampleCount; }

    public Integer getMaxDeferrals() { return maxDeferrals; }
    public void setMaxDeferrals(Integer maxDeferrals) { this.maxDeferrals = maxDeferrals; }

    public double getCostPerToken() { return costPerToken; }
    public void setCostPerToken(double costPerToken) { this.costPerToken = costPerToken; }

    public Integer getMaxConcurrentRequests() { return maxConcurrentRequests; }
    public void setMaxConcurrentRequests(Integer maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

    public Map<String, String> getSettings() { return settings; }
    public void setSettings(Map<String, String> settings) { this.settings = settings; }

    public RolloutConfig toRolloutConfig(ControllerConfig.RolloutConfig defaults) {
        SuccessCriteria configured = defaults.toSuccessCriteria();
        SuccessCriteria criteria = new SuccessCriteria(
                maxErrorRateIncrease != null ? maxErrorRateIncrease : configured.maxErrorRateIncrease(),
                maxLatencyIncrease != null ? maxLatencyIncrease : configured.maxLatencyIncrease(),
                configured.absoluteErrorRateThreshold(),
                configured.absoluteLatencyThresholdMs());

        RolloutConfig.Builder builder = RolloutConfig.builder()
                .model(model)
                .canaryVersion(canaryVersion)
                .baselineVersion(baselineVersion)
                .trafficSteps(trafficSteps != null ? trafficSteps : defaults.getTrafficSteps())
                .successCriteria(criteria)
                .evaluationInterval(Duration.ofMillis(
                        evaluationIntervalMs != null ? evaluationIntervalMs : defaults.getEvaluationIntervalMs()))
                .minSampleCount(minSampleCount != null ? minSampleCount : defaults.getMinSampleCount())
                .maxDeferrals(maxDeferrals != null ? maxDeferrals : defaults.getMaxDeferrals())
                .costPerToken(costPerToken)
                .settings(settings);
        if (maxConcurrentRequests != null) {
            builder.maxConcurrentRequests(maxConcurrentRequests);
        }
        return builder.build();
    }
}
