package fr.lapetina.modeltraffic;

import fr.lapetina.modeltraffic.disruptor.RoutingPipeline;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.strategy.RoutingStrategy;
import fr.lapetina.modeltraffic.infrastructure.backend.ConfiguredDeploymentBackend;
import fr.lapetina.modeltraffic.infrastructure.config.ConfigLoader;
import fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig;
import fr.lapetina.modeltraffic.infrastructure.health.EndpointHealthChecker;
import fr.lapetina.modeltraffic.infrastructure.health.HttpEndpointProbe;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.infrastructure.notification.LoggingNotificationSink;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistryEvent;
import fr.lapetina.modeltraffic.infrastructure.store.InMemorySnapshotStore;
import fr.lapetina.modeltraffic.infrastructure.store.JsonFileSnapshotStore;
import fr.lapetina.modeltraffic.optimizer.PerformanceOptimizer;
import fr.lapetina.modeltraffic.rollout.BlueGreenController;
import fr.lapetina.modeltraffic.rollout.CanaryController;
import fr.lapetina.modeltraffic.rollout.EndpointDrainer;
import fr.lapetina.modeltraffic.rollout.RolloutLeases;
import fr.lapetina.modeltraffic.routing.Router;
import fr.lapetina.modeltraffic.spi.DeploymentBackend;
import fr.lapetina.modeltraffic.spi.HealthProbe;
import fr.lapetina.modeltraffic.spi.InferenceBackend;
import fr.lapetina.modeltraffic.spi.NotificationSink;
import fr.lapetina.modeltraffic.spi.SmokeTestRunner;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a fully-wired traffic controller from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ControllerFactory factory = ControllerFactory.create("config.yaml").start()) {
 *     ModelEndpoint endpoint = factory.getRouter().route(RequestContext.of("llama3"));
 *     // ...
 * }
 * }</pre>
 *
 * <p>Models are restored from the snapshot store when a snapshot exists, otherwise bootstrapped
 * from the {@code models} section. Non-terminal canary plans are then resumed.
 */
public class ControllerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControllerFactory.class);

    private final ConfigLoader configLoader;
    private final ControllerConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final SnapshotStore store;
    private final NotificationSink sink;
    private final EndpointRegistry registry;
    private final MetricsCollector collector;
    private final Router router;
    private final ScheduledExecutorService scheduler;
    private final DeploymentBackend deploymentBackend;
    private final EndpointHealthChecker healthChecker;
    private final EndpointDrainer drainer;
    private final CanaryController canaryController;
    private final BlueGreenController blueGreenController;
    private final PerformanceOptimizer optimizer;
    private final RoutingPipeline pipeline;
    private final Set<String> weightGauges = ConcurrentHashMap.newKeySet();

    protected ControllerFactory(Builder builder) {
        log.info("Initializing ControllerFactory from config: {}", builder.configPath);

        this.configLoader = new ConfigLoader(builder.configPath);
        this.config = configLoader.load();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.store = builder.store != null ? builder.store : createStore();
        this.sink = builder.sink != null ? builder.sink : new LoggingNotificationSink();

        this.registry = new EndpointRegistry(store, clock);
        registry.addListener(this::registerWeightGauges);

        this.collector = new MetricsCollector(clock, config.getMetrics().getSamplesPerEndpoint(),
                Duration.ofMillis(config.getMetrics().getRetentionMs()));
        collector.setCostResolver(id -> registry.findEndpoint(id).map(ModelEndpoint::costPerToken).orElse(0.0));
        metricsRegistry.registerDroppedSamples(collector::getDroppedSamples);

        ControllerConfig.RoutingConfig routing = config.getRouting();
        this.router = new Router(registry, collector,
                RoutingStrategy.fromName(routing.getStrategy()).orElse(RoutingStrategy.BALANCED),
                routing.toParameters(),
                Duration.ofMillis(routing.getLatencyWindowMs()));
        log.info("Using routing strategy: {}", router.getStrategy().getName());

        this.scheduler = Executors.newScheduledThreadPool(2, new SchedulerThreadFactory());

        this.deploymentBackend = builder.deploymentBackend != null
                ? builder.deploymentBackend
                : new ConfiguredDeploymentBackend(config.getDeployments());

        ControllerConfig.HealthCheckConfig health = config.getHealthCheck();
        HttpEndpointProbe httpProbe = new HttpEndpointProbe(health.getPath(), health.getSmokeTestPath(),
                Duration.ofMillis(health.getTimeoutMs()));
        HealthProbe healthProbe = builder.healthProbe != null ? builder.healthProbe : httpProbe;
        SmokeTestRunner smokeTestRunner = builder.smokeTestRunner != null ? builder.smokeTestRunner : httpProbe;
        this.healthChecker = new EndpointHealthChecker(registry, healthProbe,
                Duration.ofMillis(health.getIntervalMs()), Duration.ofMillis(health.getTimeoutMs()),
                health.getDegradedThreshold(), health.getDownThreshold());

        this.drainer = new EndpointDrainer(registry, collector, deploymentBackend, sink, clock,
                Duration.ofMillis(config.getRollout().getDrainGracePeriodMs()));
        RolloutLeases leases = new RolloutLeases();
        this.canaryController = new CanaryController(registry, collector, deploymentBackend, sink, store,
                drainer, leases, metricsRegistry, scheduler, clock);
        this.blueGreenController = new BlueGreenController(registry, collector, deploymentBackend,
                smokeTestRunner, sink, store, drainer, leases, metricsRegistry, scheduler, clock);
        this.optimizer = new PerformanceOptimizer(registry, collector, sink, store, metricsRegistry, clock,
                config.getOptimizer().toSettings());

        this.pipeline = builder.inferenceBackend == null ? null : RoutingPipeline.builder()
                .fromConfig(config.getPipeline())
                .router(router)
                .backend(builder.inferenceBackend)
                .collector(collector)
                .metricsRegistry(metricsRegistry)
                .build();

        loadModels();
        configLoader.addListener(this::onConfigChanged);

        log.info("ControllerFactory initialized with {} models", registry.models().size());
    }

    public static ControllerFactory create(String configPath) {
        return builder(configPath).build();
    }

    public static ControllerFactory create() {
        return create("config.yaml");
    }

    public static Builder builder(String configPath) {
        return new Builder(configPath);
    }

    /**
     * Starts the pipeline and the background tasks: health checks, draining, degradation analysis
     * and configuration watching.
     */
    public ControllerFactory start() {
        if (pipeline != null) {
            pipeline.start();
        }
        if (config.getHealthCheck().isEnabled()) {
            healthChecker.start();
        }
        drainer.start(scheduler, Duration.ofMillis(config.getRollout().getDrainSweepIntervalMs()));
        if (config.getOptimizer().isEnabled()) {
            optimizer.start(scheduler, Duration.ofMillis(config.getOptimizer().getAnalysisIntervalMs()));
        }
        configLoader.startWatching();
        log.info("Controller started");
        return this;
    }

    private SnapshotStore createStore() {
        if ("file".equals(config.getStore().getType())) {
            return new JsonFileSnapshotStore(Paths.get(config.getStore().getDirectory()));
        }
        return new InMemorySnapshotStore();
    }

    private void loadModels() {
        for (ControllerConfig.ModelConfig modelConfig : config.getModels()) {
            String model = modelConfig.getName();
            if (registry.restore(model)) {
                continue;
            }
            List<ModelEndpoint> endpoints = modelConfig.getEndpoints().stream()
                    .map(endpoint -> endpoint.toEndpoint(model))
                    .toList();
            if (!endpoints.isEmpty()) {
                registry.bootstrap(model, endpoints);
            }
        }
        for (String model : registry.models()) {
            canaryController.resume(model).ifPresent(plan ->
                    log.info("Canary plan resumed: planId={}, model={}, state={}, step={}",
                            plan.id(), model, plan.state(), plan.stepIndex()));
            blueGreenController.resume(model).ifPresent(deployment ->
                    log.info("Blue-green deployment resumed: deploymentId={}, model={}, state={}",
                            deployment.id(), model, deployment.state()));
        }
    }

    private void registerWeightGauges(RegistryEvent event) {
        for (ModelEndpoint endpoint : event.snapshot().endpoints()) {
            String id = endpoint.id();
            if (weightGauges.add(id)) {
                metricsRegistry.registerEndpointWeight(id,
                        () -> registry.findEndpoint(id).map(ModelEndpoint::weight).orElse(0));
            }
        }
    }

    private void onConfigChanged(ControllerConfig oldConfig, ControllerConfig newConfig) {
        log.info("Configuration changed, applying routing updates...");
        ControllerConfig.RoutingConfig routing = newConfig.getRouting();
        RoutingStrategy.fromName(routing.getStrategy()).ifPresent(strategy -> {
            if (strategy != router.getStrategy()) {
                router.setStrategy(strategy);
            }
        });
        router.setParameters(routing.toParameters());
        log.info("Configuration updates applied");
    }

    public ControllerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public Clock getClock() {
        return clock;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public SnapshotStore getStore() {
        return store;
    }

    public EndpointRegistry getRegistry() {
        return registry;
    }

    public MetricsCollector getCollector() {
        return collector;
    }

    public Router getRouter() {
        return router;
    }

    public DeploymentBackend getDeploymentBackend() {
        return deploymentBackend;
    }

    public EndpointHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public EndpointDrainer getDrainer() {
        return drainer;
    }

    public CanaryController getCanaryController() {
        return canaryController;
    }

    public BlueGreenController getBlueGreenController() {
        return blueGreenController;
    }

    public PerformanceOptimizer getOptimizer() {
        return optimizer;
    }

    /**
     * The request pipeline, present when an {@link InferenceBackend} was supplied.
     */
    public Optional<RoutingPipeline> getPipeline() {
        return Optional.ofNullable(pipeline);
    }

    @Override
    public void close() {
        log.info("Shutting down ControllerFactory...");

        closeQuietly("health checker", healthChecker);
        if (pipeline != null) {
            closeQuietly("pipeline", pipeline);
        }
        closeQuietly("canary controller", canaryController);
        closeQuietly("blue-green controller", blueGreenController);
        closeQuietly("optimizer", optimizer);
        closeQuietly("drainer", drainer);

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        closeQuietly("metrics registry", metricsRegistry);
        closeQuietly("config loader", configLoader);

        log.info("ControllerFactory shut down");
    }

    private static void closeQuietly(String name, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }

    private static final class SchedulerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "controller-scheduler-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Replaces default collaborators, mainly for tests and embedding applications.
     */
    public static final class Builder {
        private final String configPath;
        private Clock clock;
        private SnapshotStore store;
        private NotificationSink sink;
        private DeploymentBackend deploymentBackend;
        private HealthProbe healthProbe;
        private SmokeTestRunner smokeTestRunner;
        private InferenceBackend inferenceBackend;

        private Builder(String configPath) {
            this.configPath = configPath;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder store(SnapshotStore store) {
            this.store = store;
            return this;
        }

        public Builder notificationSink(NotificationSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder deploymentBackend(DeploymentBackend backend) {
            this.deploymentBackend = backend;
            return this;
        }

        public Builder healthProbe(HealthProbe probe) {
            this.healthProbe = probe;
            return this;
        }

        public Builder smokeTestRunner(SmokeTestRunner runner) {
            this.smokeTestRunner = runner;
            return this;
        }

        public Builder inferenceBackend(InferenceBackend backend) {
            this.inferenceBackend = backend;
            return this;
        }

        public ControllerFactory build() {
            return new ControllerFactory(this);
        }
    }
}
