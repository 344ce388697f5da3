package fr.lapetina.modeltraffic.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig;
import fr.lapetina.modeltraffic.rollout.BlueGreenConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Body of {@code POST /rollouts/blue-green}. Missing fields take the configured defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlueGreenRequest {

    private String model;

    @JsonProperty("green_version")
    private String greenVersion;

    @JsonProperty("cost_per_token")
    private double costPerToken;

    @JsonProperty("max_concurrent_requests")
    private Integer maxConcurrentRequests;

    @JsonProperty("rollback_window_ms")
    private Long rollbackWindowMs;

    @JsonProperty("error_rate_threshold")
    private Double errorRateThreshold;

    @JsonProperty("min_sample_count")
    private Integer minSampleCount;

    @JsonProperty("monitor_interval_ms")
    private Long monitorIntervalMs;

    private Map<String, String> settings;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getGreenVersion() { return greenVersion; }
    public void setGreenVersion(String greenVersion) { this.greenVersion = greenVersion; }

    public double getCostPerToken() { return costPerToken; }
    public void setCostPerToken(double costPerToken) { this.costPerToken = costPerToken; }

    public Integer getMaxConcurrentRequests() { return maxConcurrentRequests; }
    public void setMaxConcurrentRequests(Integer maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

    public Long getRollbackWindowMs() { return rollbackWindowMs; }
    public void setRollbackWindowMs(Long rollbackWindowMs) { this.rollbackWindowMs = rollbackWindowMs; }

    public Double getErrorRateThreshold() { return errorRateThreshold; }
    public void setErrorRateThreshold(Double errorRateThreshold) { this.errorRateThreshold = errorRateThreshold; }

    public Integer getMinSampleCount() { return minSampleCount; }
    public void setMinSampleCount(Integer minSampleCount) { this.minSampleCount = minSampleCount; }

    public Long getMonitorIntervalMs() { return monitorIntervalMs; }
    public void setMonitorIntervalMs(Long monitorIntervalMs) { this.monitorIntervalMs = monitorIntervalMs; }

    public Map<String, String> getSettings() { return settings; }
    public void setSettings(Map<String, String> settings) { this.settings = settings; }

    public BlueGreenConfig toBlueGreenConfig(ControllerConfig.BlueGreenConfig defaults) {
        BlueGreenConfig.Builder builder = BlueGreenConfig.builder()
                .model(model)
                .greenVersion(greenVersion)
                .costPerToken(costPerToken)
                .rollbackWindow(Duration.ofMillis(
                        rollbackWindowMs != null ? rollbackWindowMs : defaults.getRollbackWindowMs()))
                .errorRateThreshold(errorRateThreshold != null ? errorRateThreshold : defaults.getErrorRateThreshold())
                .minSampleCount(minSampleCount != null ? minSampleCount : defaults.getMinSampleCount())
                .monitorInterval(Duration.ofMillis(
                        monitorIntervalMs != null ? monitorIntervalMs : defaults.getMonitorIntervalMs()))
                .settings(settings);
        if (maxConcurrentRequests != null) {
            builder.maxConcurrentRequests(maxConcurrentRequests);
        }
        return builder.build();
    }
}
