package fr.lapetina.modeltraffic.infrastructure.backend;

import fr.lapetina.modeltraffic.domain.exception.BackendOperationException;
import fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig;
import fr.lapetina.modeltraffic.spi.DeploymentBackend;
import fr.lapetina.modeltraffic.spi.DeploymentSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deployment backend over pre-provisioned servers.
 *
 * "Creating" a version hands out the address configured for it; "deleting" forgets the
 * endpoint. Actual provisioning happens outside the controller.
 */
public final class ConfiguredDeploymentBackend implements DeploymentBackend {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredDeploymentBackend.class);

    private final Map<String, URI> addresses = new ConcurrentHashMap<>();
    private final Set<String> liveEndpoints = ConcurrentHashMap.newKeySet();

    public ConfiguredDeploymentBackend(Collection<ControllerConfig.DeploymentConfig> deployments) {
        for (ControllerConfig.DeploymentConfig deployment : deployments) {
            define(deployment.getModel(), deployment.getVersion(), URI.create(deployment.getUrl()));
        }
    }

    /**
     * Makes an address available for a model version.
     */
    public void define(String model, String version, URI address) {
        addresses.put(key(model, version), address);
        log.debug("Deployment address defined: model={}, version={}, address={}", model, version, address);
    }

    @Override
    public URI create(String model, String version, DeploymentSpec spec) {
        URI address = addresses.get(key(model, version));
        if (address == null) {
            throw new BackendOperationException(BackendOperationException.Operation.CREATE,
                    model + ":" + version, "No address configured for " + model + " version " + version);
        }
        liveEndpoints.add(spec.endpointId());
        log.info("Deployment created: model={}, version={}, endpointId={}, address={}",
                model, version, spec.endpointId(), address);
        return address;
    }

    @Override
    public void delete(String endpointId) {
        if (liveEndpoints.remove(endpointId)) {
            log.info("Deployment deleted: endpointId={}", endpointId);
        } else {
            log.debug("Delete of unmanaged endpoint ignored: endpointId={}", endpointId);
        }
    }

    public Set<String> getLiveEndpoints() {
        return Set.copyOf(liveEndpoints);
    }

    private static String key(String model, String version) {
        return model + ":" + version;
    }
}
