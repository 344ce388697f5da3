package fr.lapetina.modeltraffic.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modeltraffic.domain.model.RequestContext;

/**
 * Body of {@code POST /v1/route}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteRequest {

    private String model;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("estimated_tokens")
    private int estimatedTokens;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getCorrelationId() { return correlationId; }
    public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

    public int getEstimatedTokens() { return estimatedTokens; }
    public void setEstimatedTokens(int estimatedTokens) { this.estimatedTokens = estimatedTokens; }

    public RequestContext toRequestContext() {
        return new RequestContext(requestId, model, correlationId, estimatedTokens, null);
    }
}
