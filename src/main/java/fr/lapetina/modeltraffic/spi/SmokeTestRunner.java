package fr.lapetina.modeltraffic.spi;

import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;

/**
 * Runs a smoke test against a freshly created endpoint.
 * Gate for blue-green swaps.
 */
@FunctionalInterface
public interface SmokeTestRunner {

    SmokeTestResult run(ModelEndpoint endpoint);
}
