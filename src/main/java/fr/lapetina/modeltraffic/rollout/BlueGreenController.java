package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.exception.BackendOperationException;
import fr.lapetina.modeltraffic.domain.exception.SmokeTestFailureException;
import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.AggregateWindow;
import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.spi.DeploymentBackend;
import fr.lapetina.modeltraffic.spi.DeploymentSpec;
import fr.lapetina.modeltraffic.spi.NotificationSink;
import fr.lapetina.modeltraffic.spi.SmokeTestResult;
import fr.lapetina.modeltraffic.spi.SmokeTestRunner;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs blue-green deployments.
 *
 * Green is created next to blue at weight 0. A passing smoke test allows one commit that
 * gives green all the traffic. Blue stays registered at weight 0 for the rollback window,
 * during which green's error rate is monitored; a breach or an operator rollback reverts
 * with another single commit. After the window blue is drained and removed.
 */
public final class BlueGreenController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlueGreenController.class);

    static final String STORE_PREFIX = "bluegreen/";
    static final String ACTIVE_PREFIX = "bluegreen/active/";

    private final EndpointRegistry registry;
    private final MetricsCollector collector;
    private final DeploymentBackend backend;
    private final SmokeTestRunner smokeTestRunner;
    private final NotificationSink sink;
    private final SnapshotStore store;
    private final EndpointDrainer drainer;
    private final RolloutLeases leases;
    private final MetricsRegistry metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, DeploymentHandle> deployments = new ConcurrentHashMap<>();

    public BlueGreenController(
            EndpointRegistry registry,
            MetricsCollector collector,
            DeploymentBackend backend,
            SmokeTestRunner smokeTestRunner,
            NotificationSink sink,
            SnapshotStore store,
            EndpointDrainer drainer,
            RolloutLeases leases,
            MetricsRegistry metrics,
            ScheduledExecutorService scheduler,
            Clock clock
    ) {
        this.registry = registry;
        this.collector = collector;
        this.backend = backend;
        this.smokeTestRunner = smokeTestRunner;
        this.sink = sink;
        this.store = store;
        this.drainer = drainer;
        this.leases = leases;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Creates green at weight 0 next to the serving blue endpoints.
     *
     * @throws ValidationException       if the model cannot take a blue-green deployment now
     * @throws BackendOperationException if green could not be created; the deployment is ABORTED
     */
    public BlueGreenDeployment start(BlueGreenConfig config) {
        config.validate();
        String model = config.model();
        RegistrySnapshot snapshot = registry.getSnapshot(model);
        if (snapshot.endpoints().isEmpty()) {
            throw new ValidationException("Unknown model: " + model);
        }
        if (snapshot.canary().isPresent()) {
            throw new ValidationException("Model " + model + " has a canary in progress: " + snapshot.canary().get().id());
        }
        Map<String, Integer> blueWeights = new LinkedHashMap<>();
        for (ModelEndpoint endpoint : snapshot.servingEndpoints()) {
            if (endpoint.version().equals(config.greenVersion())) {
                throw new ValidationException("Version " + config.greenVersion() + " is already serving " + model);
            }
            blueWeights.put(endpoint.id(), endpoint.weight());
        }

        String deploymentId = UUID.randomUUID().toString();
        if (!leases.tryAcquire(model, deploymentId)) {
            throw new ValidationException("Another rollout is active for model " + model + ": "
                    + leases.holder(model).orElse("?"));
        }

        Instant now = clock.instant();
        String greenId = model + "-" + config.greenVersion() + "-" + deploymentId.substring(0, 8);
        BlueGreenDeployment deployment = new BlueGreenDeployment(deploymentId, config, BlueGreenState.PENDING,
                greenId, blueWeights, 0, null, null, null, now, now);
        DeploymentHandle handle = new DeploymentHandle(deployment);
        deployments.put(deploymentId, handle);

        MDC.put("planId", deploymentId);
        try {
            synchronized (handle) {
                publish(handle, deployment);
                safePut(ACTIVE_PREFIX + model, deploymentId);
                URI address;
                try {
                    address = backend.create(model, config.greenVersion(), new DeploymentSpec(
                            greenId, config.costPerToken(), config.maxConcurrentRequests(), config.settings()));
                } catch (BackendOperationException e) {
                    abortCreation(handle, e);
                    throw e;
                } catch (RuntimeException e) {
                    abortCreation(handle, e);
                    throw new BackendOperationException(BackendOperationException.Operation.CREATE,
                            greenId, e.getMessage(), e);
                }

                try {
                    registry.register(ModelEndpoint.builder()
                            .id(greenId)
                            .model(model)
                            .version(config.greenVersion())
                            .address(address)
                            .costPerToken(config.costPerToken())
                            .maxConcurrentRequests(config.maxConcurrentRequests())
                            .state(EndpointState.DRAFT)
                            .build());
                } catch (RuntimeException e) {
                    finish(handle, deployment.withState(BlueGreenState.ABORTED,
                            "Green registration failed: " + e.getMessage(), clock.instant()));
                    notify(ControllerEvent.Type.BLUE_GREEN_ABORTED, handle.deployment, "Green registration failed");
                    deleteDeployment(greenId);
                    throw e;
                }

                log.info("Blue-green started: model={}, green={}, blue={}", model, greenId, blueWeights.keySet());
                notify(ControllerEvent.Type.BLUE_GREEN_STARTED, deployment,
                        "Green " + config.greenVersion() + " deployed at weight 0");
                return deployment;
            }
        } finally {
            MDC.remove("planId");
        }
    }

    /**
     * Runs the smoke test against green and, if it passes, gives green all traffic in one commit.
     *
     * @throws SmokeTestFailureException if the smoke test fails; weights are unchanged and the
     *                                   deployment stays PENDING, so the swap can be retried
     */
    public BlueGreenDeployment swap(String deploymentId) {
        DeploymentHandle handle = handle(deploymentId);
        MDC.put("planId", deploymentId);
        try {
            synchronized (handle) {
                BlueGreenDeployment deployment = handle.deployment;
                if (deployment.state() != BlueGreenState.PENDING) {
                    throw new ValidationException("Deployment " + deploymentId + " cannot swap from " + deployment.state());
                }
                ModelEndpoint green = registry.findEndpoint(deployment.greenEndpointId())
                        .orElseThrow(() -> new ValidationException("Green endpoint missing: " + deployment.greenEndpointId()));

                SmokeTestResult result = runSmokeTest(green);
                if (!result.passed()) {
                    BlueGreenDeployment failed = publish(handle,
                            deployment.withSmokeTestFailure(result.report(), clock.instant()));
                    log.warn("Smoke test failed: deploymentId={}, endpointId={}, attempts={}, report={}",
                            deploymentId, green.id(), failed.smokeTestAttempts(), result.report());
                    notify(ControllerEvent.Type.SMOKE_TEST_FAILED, failed, result.report());
                    throw new SmokeTestFailureException(deploymentId, green.id(), result.report());
                }

                Map<String, EndpointState> states = new HashMap<>();
                states.put(green.id(), EndpointState.ACTIVE);
                registry.commitWeights(deployment.model(), Map.of(green.id(), 100), states);

                BlueGreenDeployment swapped = publish(handle, deployment.swapped(result.report(), clock.instant()));
                scheduleMonitor(handle);
                log.info("Blue-green swapped: model={}, green={}, rollbackWindow={}",
                        deployment.model(), green.id(), deployment.config().rollbackWindow());
                notify(ControllerEvent.Type.BLUE_GREEN_SWAPPED, swapped, "Green serving 100% of traffic");
                return swapped;
            }
        } finally {
            MDC.remove("planId");
        }
    }

    /**
     * Checks green during the rollback window: reverts on an error-rate breach, retires blue
     * once the window has elapsed.
     */
    public BlueGreenDeployment monitor(String deploymentId) {
        DeploymentHandle handle = handle(deploymentId);
        MDC.put("planId", deploymentId);
        try {
            synchronized (handle) {
                BlueGreenDeployment deployment = handle.deployment;
                if (deployment.state() != BlueGreenState.MONITORING) {
                    return deployment;
                }
                BlueGreenConfig config = deployment.config();
                Instant now = clock.instant();
                Duration elapsed = Duration.between(deployment.swappedAt(), now);
                Duration window = elapsed.isZero() || elapsed.isNegative() ? config.monitorInterval() : elapsed;

                AggregateWindow green = collector.getAggregate(deployment.greenEndpointId(), window);
                if (green.sampleCount() >= config.minSampleCount() && green.errorRate() > config.errorRateThreshold()) {
                    String reason = String.format("Green error rate %.4f above threshold %.4f over %d samples",
                            green.errorRate(), config.errorRateThreshold(), green.sampleCount());
                    return revert(handle, BlueGreenState.ROLLED_BACK, reason);
                }

                if (elapsed.compareTo(config.rollbackWindow()) >= 0) {
                    return complete(handle);
                }
                return deployment;
            }
        } finally {
            MDC.remove("planId");
        }
    }

    /**
     * Operator-triggered revert during the rollback window.
     */
    public BlueGreenDeployment rollback(String deploymentId) {
        DeploymentHandle handle = handle(deploymentId);
        synchronized (handle) {
            if (handle.deployment.state() != BlueGreenState.MONITORING) {
                throw new ValidationException("Deployment " + deploymentId + " cannot roll back from "
                        + handle.deployment.state());
            }
            return revert(handle, BlueGreenState.ROLLED_BACK, "Rolled back by operator");
        }
    }

    /**
     * Aborts a non-terminal deployment. Before the swap green is retired; after it the swap is
     * reverted.
     *
     * @return false if the deployment was already terminal
     */
    public boolean cancel(String deploymentId) {
        DeploymentHandle handle = handle(deploymentId);
        synchronized (handle) {
            BlueGreenDeployment deployment = handle.deployment;
            if (deployment.isTerminal()) {
                return false;
            }
            if (deployment.state() == BlueGreenState.MONITORING) {
                revert(handle, BlueGreenState.ABORTED, "Cancelled by operator");
                return true;
            }
            retireGreen(deployment);
            BlueGreenDeployment aborted = finish(handle,
                    deployment.withState(BlueGreenState.ABORTED, "Cancelled by operator", clock.instant()));
            log.info("Blue-green cancelled before swap: deploymentId={}", deploymentId);
            notify(ControllerEvent.Type.BLUE_GREEN_ABORTED, aborted, "Cancelled by operator");
            return true;
        }
    }

    public Optional<BlueGreenDeployment> getDeployment(String deploymentId) {
        DeploymentHandle handle = deployments.get(deploymentId);
        if (handle != null) {
            return Optional.of(handle.deployment);
        }
        return store.get(STORE_PREFIX + deploymentId, BlueGreenDeployment.class);
    }

    /**
     * Reloads the persisted non-terminal deployment of a model after a restart. A MONITORING
     * deployment gets its monitor back and completes at once if the rollback window has already
     * elapsed. A PENDING deployment is aborted and its green retired.
     */
    public Optional<BlueGreenDeployment> resume(String model) {
        Optional<String> deploymentId = store.get(ACTIVE_PREFIX + model, String.class);
        if (deploymentId.isEmpty()) {
            return Optional.empty();
        }
        Optional<BlueGreenDeployment> persisted = store.get(STORE_PREFIX + deploymentId.get(), BlueGreenDeployment.class);
        if (persisted.isEmpty() || persisted.get().isTerminal()) {
            safeDelete(ACTIVE_PREFIX + model);
            return Optional.empty();
        }
        BlueGreenDeployment deployment = persisted.get();
        if (!leases.tryAcquire(model, deployment.id())) {
            log.warn("Cannot resume blue-green deployment, model leased by another rollout: deploymentId={}, model={}",
                    deployment.id(), model);
            return Optional.empty();
        }
        DeploymentHandle handle = new DeploymentHandle(deployment);
        deployments.put(deployment.id(), handle);

        MDC.put("planId", deployment.id());
        try {
            synchronized (handle) {
                if (deployment.state() == BlueGreenState.PENDING) {
                    if (registry.findEndpoint(deployment.greenEndpointId()).isPresent()) {
                        retireGreen(deployment);
                    } else {
                        deleteDeployment(deployment.greenEndpointId());
                    }
                    BlueGreenDeployment aborted = finish(handle, deployment.withState(BlueGreenState.ABORTED,
                            "Interrupted before swap", clock.instant()));
                    log.warn("Blue-green aborted on resume: model={}, green={}", model, deployment.greenEndpointId());
                    notify(ControllerEvent.Type.BLUE_GREEN_ABORTED, aborted, "Interrupted before swap");
                    return Optional.of(aborted);
                }
                scheduleMonitor(handle);
                log.info("Blue-green deployment resumed: deploymentId={}, model={}, swappedAt={}",
                        deployment.id(), model, deployment.swappedAt());
            }
        } finally {
            MDC.remove("planId");
        }
        return Optional.of(monitor(deployment.id()));
    }

    public List<BlueGreenDeployment> activeDeployments() {
        return deployments.values().stream()
                .map(h -> h.deployment)
                .filter(d -> !d.isTerminal())
                .toList();
    }

    // Caller holds the deployment monitor.
    private BlueGreenDeployment revert(DeploymentHandle handle, BlueGreenState state, String reason) {
        BlueGreenDeployment deployment = handle.deployment;
        RegistrySnapshot snapshot = registry.getSnapshot(deployment.model());
        Map<String, Integer> present = new LinkedHashMap<>();
        deployment.blueWeights().forEach((id, weight) -> {
            if (snapshot.contains(id)) {
                present.put(id, weight);
            }
        });
        if (present.isEmpty()) {
            throw new ValidationException("Cannot revert, no blue endpoint left for model " + deployment.model());
        }
        Map<String, EndpointState> states = new HashMap<>();
        states.put(deployment.greenEndpointId(), EndpointState.RETIRING);
        registry.commitWeights(deployment.model(), WeightPlanner.split(100, present), states);
        drainer.retire(deployment.greenEndpointId());

        BlueGreenDeployment reverted = finish(handle, deployment.withState(state, reason, clock.instant()));
        log.warn("Blue-green reverted: model={}, green={}, reason={}", deployment.model(),
                deployment.greenEndpointId(), reason);
        notify(state == BlueGreenState.ABORTED
                ? ControllerEvent.Type.BLUE_GREEN_ABORTED
                : ControllerEvent.Type.BLUE_GREEN_REVERTED, reverted, reason);
        return reverted;
    }

    // Caller holds the deployment monitor.
    private BlueGreenDeployment complete(DeploymentHandle handle) {
        BlueGreenDeployment deployment = handle.deployment;
        RegistrySnapshot snapshot = registry.getSnapshot(deployment.model());
        Map<String, EndpointState> states = new HashMap<>();
        List<String> blue = deployment.blueWeights().keySet().stream()
                .filter(snapshot::contains)
                .toList();
        blue.forEach(id -> states.put(id, EndpointState.RETIRING));
        if (!states.isEmpty()) {
            registry.commitWeights(deployment.model(), snapshot.weights(), states);
        }
        blue.forEach(drainer::retire);

        BlueGreenDeployment succeeded = finish(handle,
                deployment.withState(BlueGreenState.SUCCEEDED, null, clock.instant()));
        log.info("Blue-green completed: model={}, green={}, retiring={}", deployment.model(),
                deployment.greenEndpointId(), blue);
        notify(ControllerEvent.Type.BLUE_GREEN_SUCCEEDED, succeeded, "Rollback window elapsed, blue retired");
        return succeeded;
    }

    // Caller holds the deployment monitor.
    private void abortCreation(DeploymentHandle handle, RuntimeException cause) {
        BlueGreenDeployment aborted = finish(handle, handle.deployment.withState(BlueGreenState.ABORTED,
                "Green creation failed: " + cause.getMessage(), clock.instant()));
        log.error("Blue-green aborted, green creation failed: model={}", aborted.model(), cause);
        notify(ControllerEvent.Type.BLUE_GREEN_ABORTED, aborted, aborted.failureReason());
    }

    private void retireGreen(BlueGreenDeployment deployment) {
        if (registry.findEndpoint(deployment.greenEndpointId()).isPresent()) {
            registry.transitionState(deployment.greenEndpointId(), EndpointState.RETIRING);
            drainer.retire(deployment.greenEndpointId());
        }
    }

    private SmokeTestResult runSmokeTest(ModelEndpoint green) {
        try {
            SmokeTestResult result = smokeTestRunner.run(green);
            return result != null ? result : SmokeTestResult.failed("Smoke test returned no result");
        } catch (RuntimeException e) {
            log.warn("Smoke test errored: endpointId={}", green.id(), e);
            return SmokeTestResult.failed("Smoke test errored: " + e.getMessage());
        }
    }

    // Caller holds the deployment monitor.
    private void scheduleMonitor(DeploymentHandle handle) {
        String deploymentId = handle.deployment.id();
        long interval = handle.deployment.config().monitorInterval().toMillis();
        handle.task = scheduler.scheduleWithFixedDelay(() -> monitorScheduled(deploymentId),
                interval, interval, TimeUnit.MILLISECONDS);
    }

    private void monitorScheduled(String deploymentId) {
        try {
            monitor(deploymentId);
        } catch (Exception e) {
            log.error("Scheduled blue-green monitor failed: deploymentId={}", deploymentId, e);
        }
    }

    // Caller holds the deployment monitor.
    private BlueGreenDeployment finish(DeploymentHandle handle, BlueGreenDeployment terminal) {
        publish(handle, terminal);
        ScheduledFuture<?> task = handle.task;
        if (task != null) {
            task.cancel(false);
            handle.task = null;
        }
        leases.release(terminal.model(), terminal.id());
        safeDelete(ACTIVE_PREFIX + terminal.model());
        return terminal;
    }

    private BlueGreenDeployment publish(DeploymentHandle handle, BlueGreenDeployment deployment) {
        BlueGreenState previous = handle.deployment.state();
        handle.deployment = deployment;
        try {
            store.put(STORE_PREFIX + deployment.id(), deployment);
        } catch (RuntimeException e) {
            log.error("Failed to persist blue-green deployment: deploymentId={}", deployment.id(), e);
        }
        if (previous != deployment.state() || handle.transitions++ == 0) {
            metrics.incrementRolloutTransition("blue_green", deployment.model(), deployment.state().name());
        }
        return deployment;
    }

    private void safePut(String key, Object value) {
        try {
            store.put(key, value);
        } catch (RuntimeException e) {
            log.error("Failed to persist store key: {}", key, e);
        }
    }

    private void safeDelete(String key) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.error("Failed to delete store key: {}", key, e);
        }
    }

    private void deleteDeployment(String endpointId) {
        try {
            backend.delete(endpointId);
        } catch (RuntimeException e) {
            log.error("Backend delete failed: endpointId={}", endpointId, e);
        }
    }

    private void notify(ControllerEvent.Type type, BlueGreenDeployment deployment, String message) {
        try {
            sink.notify(new ControllerEvent(type, deployment.model(), deployment.id(), message, clock.instant(),
                    Map.of("greenVersion", deployment.config().greenVersion(),
                            "greenEndpointId", deployment.greenEndpointId(),
                            "state", deployment.state().name())));
        } catch (RuntimeException e) {
            log.error("Notification failed: type={}, deploymentId={}", type, deployment.id(), e);
        }
    }

    private DeploymentHandle handle(String deploymentId) {
        DeploymentHandle handle = deployments.get(deploymentId);
        if (handle == null) {
            throw new ValidationException("Unknown blue-green deployment: " + deploymentId);
        }
        return handle;
    }

    @Override
    public void close() {
        for (DeploymentHandle handle : deployments.values()) {
            ScheduledFuture<?> task = handle.task;
            if (task != null) {
                task.cancel(false);
            }
        }
    }

    private static final class DeploymentHandle {
        private volatile BlueGreenDeployment deployment;
        private ScheduledFuture<?> task;
        private int transitions;

        private DeploymentHandle(BlueGreenDeployment deployment) {
            this.deployment = deployment;
        }
    }
}
