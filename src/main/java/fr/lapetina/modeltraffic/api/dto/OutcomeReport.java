package fr.lapetina.modeltraffic.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/outcomes}: the result of a request the caller sent to a routed endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutcomeReport {

    @JsonProperty("endpoint_id")
    private String endpointId;

    @JsonProperty("latency_ms")
    private double latencyMs;

    private boolean success = true;

    private int tokens;

    public String getEndpointId() { return endpointId; }
    public void setEndpointId(String endpointId) { this.endpointId = endpointId; }

    public double getLatencyMs() { return latencyMs; }
    public void setLatencyMs(double latencyMs) { this.latencyMs = latencyMs; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public int getTokens() { return tokens; }
    public void setTokens(int tokens) { this.tokens = tokens; }
}
