package fr.lapetina.modeltraffic.infrastructure.registry;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Registry of model endpoints, partitioned per model.
 *
 * Each model maps to an immutable {@link RegistrySnapshot}. Every mutation builds a new
 * snapshot inside {@link ConcurrentHashMap#compute}, validates it and swaps it in, so readers
 * never take a lock and never observe a partial mutation. Mutations of different models do
 * not contend.
 *
 * Invariants checked on every commit:
 * - weights of a model's endpoints sum to 100 (or the model has no endpoint)
 * - at most one CANARY endpoint per model
 */
public final class EndpointRegistry {

    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

    static final String STORE_PREFIX = "registry/";

    private final Map<String, RegistrySnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, String> modelByEndpoint = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final SnapshotStore store;
    private final Clock clock;

    public EndpointRegistry(SnapshotStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Adds an endpoint. The first endpoint of a model receives weight 100, later ones weight 0.
     *
     * @throws ValidationException if the id is already registered
     */
    public RegistrySnapshot register(ModelEndpoint endpoint) {
        String existing = modelByEndpoint.putIfAbsent(endpoint.id(), endpoint.model());
        if (existing != null) {
            throw new ValidationException("Endpoint already registered: " + endpoint.id());
        }
        try {
            RegistrySnapshot snapshot = commit(endpoint.model(), current -> {
                List<ModelEndpoint> endpoints = new ArrayList<>(current.endpoints());
                int weight = endpoints.isEmpty() ? 100 : 0;
                endpoints.add(endpoint.withWeight(weight));
                return endpoints;
            });
            log.info("Endpoint registered: {}", snapshot.endpoint(endpoint.id()).orElse(endpoint));
            notifyListeners(new RegistryEvent(RegistryEvent.Type.REGISTERED, snapshot, endpoint.id()));
            return snapshot;
        } catch (RuntimeException e) {
            modelByEndpoint.remove(endpoint.id(), endpoint.model());
            throw e;
        }
    }

    /**
     * Loads the configured endpoints of a model with their declared weights, in one commit.
     * Used at startup when no persisted snapshot exists.
     */
    public RegistrySnapshot bootstrap(String model, Collection<ModelEndpoint> endpoints) {
        for (ModelEndpoint endpoint : endpoints) {
            if (!model.equals(endpoint.model())) {
                throw new ValidationException("Endpoint " + endpoint.id() + " does not belong to model " + model);
            }
            String existing = modelByEndpoint.putIfAbsent(endpoint.id(), model);
            if (existing != null) {
                throw new ValidationException("Endpoint already registered: " + endpoint.id());
            }
        }
        try {
            RegistrySnapshot snapshot = commit(model, current -> {
                if (!current.endpoints().isEmpty()) {
                    throw new ValidationException("Model already has endpoints: " + model);
                }
                return new ArrayList<>(endpoints);
            });
            log.info("Model bootstrapped: model={}, endpoints={}", model, snapshot.endpoints().size());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.REGISTERED, snapshot, null));
            return snapshot;
        } catch (RuntimeException e) {
            endpoints.forEach(ep -> modelByEndpoint.remove(ep.id(), model));
            throw e;
        }
    }

    /**
     * Removes an endpoint.
     *
     * @throws ValidationException if the endpoint is unknown or still holds weight
     */
    public RegistrySnapshot deregister(String endpointId) {
        String model = modelOf(endpointId);
        RegistrySnapshot snapshot = commit(model, current -> {
            ModelEndpoint endpoint = current.endpoint(endpointId)
                    .orElseThrow(() -> new ValidationException("Unknown endpoint: " + endpointId));
            if (endpoint.weight() > 0) {
                throw new ValidationException("Endpoint " + endpointId + " still holds weight " + endpoint.weight());
            }
            List<ModelEndpoint> endpoints = new ArrayList<>(current.endpoints());
            endpoints.removeIf(e -> e.id().equals(endpointId));
            return endpoints;
        });
        modelByEndpoint.remove(endpointId, model);
        log.info("Endpoint deregistered: endpointId={}, model={}", endpointId, model);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.DEREGISTERED, snapshot, endpointId));
        return snapshot;
    }

    /**
     * Replaces the weight table of a model in one commit. Endpoints absent from the map get 0.
     */
    public RegistrySnapshot commitWeights(String model, Map<String, Integer> weights) {
        return commitWeights(model, weights, Map.of());
    }

    /**
     * Replaces the weight table of a model and applies state changes in the same commit.
     *
     * @throws ValidationException if a weight is outside 0..100, the weights do not sum to 100,
     *                             an id is unknown, or more than one endpoint would be CANARY
     */
    public RegistrySnapshot commitWeights(
            String model,
            Map<String, Integer> weights,
            Map<String, EndpointState> stateChanges
    ) {
        RegistrySnapshot snapshot = commit(model, current -> {
            if (current.endpoints().isEmpty()) {
                throw new ValidationException("Unknown model: " + model);
            }
            requireKnown(current, weights.keySet());
            requireKnown(current, stateChanges.keySet());
            for (Map.Entry<String, Integer> entry : weights.entrySet()) {
                Integer w = entry.getValue();
                if (w == null || w < 0 || w > 100) {
                    throw new ValidationException("Weight out of range for " + entry.getKey() + ": " + w);
                }
            }
            List<ModelEndpoint> endpoints = new ArrayList<>();
            for (ModelEndpoint endpoint : current.endpoints()) {
                ModelEndpoint updated = endpoint.withWeight(weights.getOrDefault(endpoint.id(), 0));
                EndpointState state = stateChanges.get(endpoint.id());
                if (state != null) {
                    updated = updated.withState(state);
                }
                endpoints.add(updated);
            }
            return endpoints;
        });
        log.info("Weights committed: model={}, version={}, weights={}", model, snapshot.version(), snapshot.weights());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.WEIGHTS_COMMITTED, snapshot, null));
        return snapshot;
    }

    /**
     * Updates the health of an endpoint. No commit happens when the health is unchanged.
     */
    public void updateHealth(String endpointId, EndpointHealth health) {
        String model = modelByEndpoint.get(endpointId);
        if (model == null) {
            return;
        }
        AtomicReference<EndpointHealth> previous = new AtomicReference<>();
        RegistrySnapshot snapshot = commit(model, current -> {
            List<ModelEndpoint> endpoints = new ArrayList<>();
            for (ModelEndpoint endpoint : current.endpoints()) {
                if (endpoint.id().equals(endpointId)) {
                    previous.set(endpoint.health());
                    endpoint = endpoint.withHealth(health);
                }
                endpoints.add(endpoint);
            }
            return previous.get() == health ? null : endpoints;
        });
        if (previous.get() != null && previous.get() != health) {
            log.info("Endpoint health changed: endpointId={}, {} -> {}", endpointId, previous.get(), health);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, snapshot, endpointId));
        }
    }

    /**
     * Moves an endpoint to another lifecycle state without touching weights.
     */
    public RegistrySnapshot transitionState(String endpointId, EndpointState state) {
        String model = modelOf(endpointId);
        RegistrySnapshot snapshot = commit(model, current -> {
            List<ModelEndpoint> endpoints = new ArrayList<>();
            for (ModelEndpoint endpoint : current.endpoints()) {
                endpoints.add(endpoint.id().equals(endpointId) ? endpoint.withState(state) : endpoint);
            }
            return endpoints;
        });
        log.info("Endpoint state changed: endpointId={}, state={}", endpointId, state);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.STATE_CHANGED, snapshot, endpointId));
        return snapshot;
    }

    /**
     * Returns the current snapshot of a model; an empty snapshot (version 0) for unknown models.
     */
    public RegistrySnapshot getSnapshot(String model) {
        RegistrySnapshot snapshot = snapshots.get(model);
        return snapshot != null ? snapshot : new RegistrySnapshot(model, 0, List.of(), clock.instant());
    }

    public Optional<ModelEndpoint> findEndpoint(String endpointId) {
        String model = modelByEndpoint.get(endpointId);
        if (model == null) {
            return Optional.empty();
        }
        return getSnapshot(model).endpoint(endpointId);
    }

    /**
     * Returns every model with at least one endpoint, sorted.
     */
    public Set<String> models() {
        Set<String> models = new TreeSet<>();
        snapshots.forEach((model, snapshot) -> {
            if (!snapshot.endpoints().isEmpty()) {
                models.add(model);
            }
        });
        return models;
    }

    public List<ModelEndpoint> allEndpoints() {
        List<ModelEndpoint> all = new ArrayList<>();
        for (String model : models()) {
            all.addAll(getSnapshot(model).endpoints());
        }
        return all;
    }

    /**
     * Reloads the persisted snapshot of a model, if any.
     *
     * @return true if a snapshot was restored
     */
    public boolean restore(String model) {
        Optional<RegistrySnapshot> persisted = store.get(STORE_PREFIX + model, RegistrySnapshot.class);
        if (persisted.isEmpty() || persisted.get().endpoints().isEmpty()) {
            return false;
        }
        RegistrySnapshot restored = persisted.get();
        validate(restored);
        for (ModelEndpoint endpoint : restored.endpoints()) {
            String existing = modelByEndpoint.putIfAbsent(endpoint.id(), model);
            if (existing != null && !existing.equals(model)) {
                throw new ValidationException("Endpoint " + endpoint.id() + " already registered for " + existing);
            }
        }
        snapshots.put(model, restored);
        log.info("Registry restored: model={}, version={}, endpoints={}",
                model, restored.version(), restored.endpoints().size());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.RESTORED, restored, null));
        return true;
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private String modelOf(String endpointId) {
        String model = modelByEndpoint.get(endpointId);
        if (model == null) {
            throw new ValidationException("Unknown endpoint: " + endpointId);
        }
        return model;
    }

    /**
     * Builds, validates and publishes the next snapshot of a model. A mutation returning null
     * leaves the current snapshot in place.
     *
     * The store write happens inside the per-model critical section, so the persisted snapshot
     * always follows the in-memory version order.
     */
    private RegistrySnapshot commit(String model, Mutation mutation) {
        RegistrySnapshot committed = snapshots.compute(model, (key, current) -> {
            RegistrySnapshot base = current != null
                    ? current
                    : new RegistrySnapshot(model, 0, List.of(), clock.instant());
            List<ModelEndpoint> endpoints = mutation.apply(base);
            if (endpoints == null) {
                return current;
            }
            RegistrySnapshot next = new RegistrySnapshot(model, base.version() + 1, endpoints, clock.instant());
            validate(next);
            persist(next);
            return next;
        });
        return committed;
    }

    private void persist(RegistrySnapshot snapshot) {
        try {
            store.put(STORE_PREFIX + snapshot.model(), snapshot);
        } catch (RuntimeException e) {
            log.error("Failed to persist registry snapshot: model={}, version={}",
                    snapshot.model(), snapshot.version(), e);
        }
    }

    private static void validate(RegistrySnapshot snapshot) {
        if (snapshot.endpoints().isEmpty()) {
            return;
        }
        int total = snapshot.totalWeight();
        if (total != 100) {
            throw new ValidationException("Weights of model " + snapshot.model() + " sum to " + total + ", expected 100");
        }
        long canaries = snapshot.endpoints().stream()
                .filter(e -> e.state() == EndpointState.CANARY)
                .count();
        if (canaries > 1) {
            throw new ValidationException("Model " + snapshot.model() + " would have " + canaries + " canary endpoints");
        }
    }

    private static void requireKnown(RegistrySnapshot snapshot, Set<String> ids) {
        for (String id : ids) {
            if (!snapshot.contains(id)) {
                throw new ValidationException("Unknown endpoint for model " + snapshot.model() + ": " + id);
            }
        }
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    @FunctionalInterface
    private interface Mutation {
        List<ModelEndpoint> apply(RegistrySnapshot current);
    }
}
