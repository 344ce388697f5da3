package fr.lapetina.modeltraffic.support;

import fr.lapetina.modeltraffic.domain.exception.BackendOperationException;
import fr.lapetina.modeltraffic.spi.DeploymentBackend;
import fr.lapetina.modeltraffic.spi.DeploymentSpec;

import java.net.URI;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory deployment backend whose create and delete can be made to fail.
 */
public final class FakeDeploymentBackend implements DeploymentBackend {

    private final Set<String> live = ConcurrentHashMap.newKeySet();
    private final List<String> deleted = new CopyOnWriteArrayList<>();
    private final List<DeploymentSpec> created = new CopyOnWriteArrayList<>();
    private volatile boolean failCreate;
    private volatile boolean failDelete;
    private int nextPort = 12000;

    @Override
    public synchronized URI create(String model, String version, DeploymentSpec spec) {
        if (failCreate) {
            throw new BackendOperationException(BackendOperationException.Operation.CREATE,
                    model + ":" + version, "quota exceeded");
        }
        created.add(spec);
        live.add(spec.endpointId());
        return URI.create("http://localhost:" + nextPort++);
    }

    @Override
    public void delete(String endpointId) {
        if (failDelete) {
            throw new BackendOperationException(BackendOperationException.Operation.DELETE,
                    endpointId, "backend unavailable");
        }
        live.remove(endpointId);
        deleted.add(endpointId);
    }

    public void failCreate(boolean fail) {
        this.failCreate = fail;
    }

    public void failDelete(boolean fail) {
        this.failDelete = fail;
    }

    public Set<String> live() {
        return Set.copyOf(live);
    }

    public List<String> deleted() {
        return List.copyOf(deleted);
    }

    public List<DeploymentSpec> created() {
        return List.copyOf(created);
    }
}
