package fr.lapetina.modeltraffic.infrastructure.metrics;

import fr.lapetina.modeltraffic.domain.event.EventState;
import fr.lapetina.modeltraffic.domain.model.ErrorType;
import fr.lapetina.modeltraffic.domain.model.RecommendationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Operational metrics of the controller, exported in Prometheus format.
 *
 * Provides:
 * - Routing decisions per model, version and endpoint
 * - Routing failures by reason
 * - Request latency and errors per endpoint
 * - Rollout state transitions and emitted recommendations
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> routingCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> routingFailureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rolloutCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> recommendationCounters = new ConcurrentHashMap<>();

    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final AtomicInteger activeRollouts = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_requests_total", globalInFlight, AtomicInteger::get)
                .description("Total number of in-flight requests")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        Gauge.builder(prefix + "_active_rollouts", activeRollouts, AtomicInteger::get)
                .description("Number of non-terminal canary plans and blue-green deployments")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("model_traffic");
    }

    /**
     * Counts a routing decision.
     */
    public void incrementRoutingDecision(String model, String version, String endpointId, String strategy) {
        String key = model + ":" + version + ":" + endpointId + ":" + strategy;
        routingCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_routing_decisions_total")
                        .description("Requests routed per endpoint")
                        .tag("model", model)
                        .tag("version", version)
                        .tag("endpoint", endpointId)
                        .tag("strategy", strategy)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a request that could not be routed.
     */
    public void incrementRoutingFailure(String model, String reason) {
        String key = model + ":" + reason;
        routingFailureCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_routing_failures_total")
                        .description("Requests for which no endpoint could be selected")
                        .tag("model", model)
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the request counter for a model/endpoint/state combination.
     */
    public void incrementRequestCount(String model, String endpointId, EventState state) {
        String key = model + ":" + endpointId + ":" + state.name();
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("model", model)
                        .tag("endpoint", endpointId)
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records request latency.
     */
    public void recordLatency(String model, String endpointId, Duration latency) {
        String key = model + ":" + endpointId;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("model", model)
                        .tag("endpoint", endpointId)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records stage-specific latency (routing, dispatch).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String model, String endpointId, ErrorType errorType) {
        String key = model + ":" + endpointId + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", model)
                        .tag("endpoint", endpointId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a rollout entering a state.
     *
     * @param kind "canary" or "blue_green"
     */
    public void incrementRolloutTransition(String kind, String model, String state) {
        String key = kind + ":" + model + ":" + state;
        rolloutCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_rollout_transitions_total")
                        .description("Rollout state transitions")
                        .tag("kind", kind)
                        .tag("model", model)
                        .tag("state", state)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts an emitted optimization recommendation.
     */
    public void incrementRecommendation(String model, RecommendationType type) {
        String key = model + ":" + type.name();
        recommendationCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_recommendations_total")
                        .description("Optimization recommendations emitted")
                        .tag("model", model)
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for an endpoint's traffic weight.
     */
    public void registerEndpointWeight(String endpointId, Supplier<Number> weight) {
        Gauge.builder(prefix + "_endpoint_weight", weight, s -> s.get().doubleValue())
                .description("Traffic weight of the endpoint (0-100)")
                .tag("endpoint", endpointId)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers a gauge for the number of dropped metric samples.
     */
    public void registerDroppedSamples(Supplier<Number> dropped) {
        Gauge.builder(prefix + "_samples_dropped", dropped, s -> s.get().doubleValue())
                .description("Invalid or stale metric samples dropped by the collector")
                .strongReference(true)
                .register(registry);
    }

    public void setGlobalInFlight(int value) {
        globalInFlight.set(value);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public void setActiveRollouts(int value) {
        activeRollouts.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
