package fr.lapetina.modeltraffic.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;

/**
 * Routing decision returned by {@code POST /v1/route}.
 */
public record RouteResponse(
        @JsonProperty("request_id") String requestId,
        String model,
        @JsonProperty("endpoint_id") String endpointId,
        String version,
        String address,
        String strategy
) {
    public static RouteResponse of(RequestContext request, ModelEndpoint endpoint, String strategy) {
        return new RouteResponse(request.requestId(), request.model(), endpoint.id(), endpoint.version(),
                endpoint.address().toString(), strategy);
    }
}
