package fr.lapetina.modeltraffic.spi;

import fr.lapetina.modeltraffic.domain.exception.BackendOperationException;

import java.net.URI;

/**
 * Backend that provisions and removes model deployments.
 *
 * Calls are fallible and never retried by the controller; retries are the backend's concern.
 */
public interface DeploymentBackend {

    /**
     * Creates a deployment of a model version.
     *
     * @return the address the new deployment serves on
     * @throws BackendOperationException if the deployment could not be created
     */
    URI create(String model, String version, DeploymentSpec spec);

    /**
     * Deletes a deployment.
     *
     * @throws BackendOperationException if the deployment could not be deleted
     */
    void delete(String endpointId);
}
