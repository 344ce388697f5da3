package fr.lapetina.modeltraffic.spi;

import fr.lapetina.modeltraffic.domain.model.InferenceResult;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;

import java.util.concurrent.CompletableFuture;

/**
 * Transport that forwards a routed request to the selected endpoint.
 * Supplied by the embedding application.
 */
@FunctionalInterface
public interface InferenceBackend {

    CompletableFuture<InferenceResult> invoke(ModelEndpoint endpoint, RequestContext request);
}
