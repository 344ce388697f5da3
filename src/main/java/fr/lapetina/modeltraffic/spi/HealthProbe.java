package fr.lapetina.modeltraffic.spi;

import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous liveness probe for an endpoint.
 */
@FunctionalInterface
public interface HealthProbe {

    CompletableFuture<Boolean> check(ModelEndpoint endpoint);
}
