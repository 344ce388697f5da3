package fr.lapetina.modeltraffic.optimizer;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.AggregateWindow;
import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.Recommendation;
import fr.lapetina.modeltraffic.domain.model.RecommendationType;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.modeltraffic.rollout.DeltaComparison;
import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.spi.NotificationSink;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Detects performance degradation and cost inefficiency across a model's endpoints.
 *
 * A baseline captures each endpoint's aggregates over a historical window. Analysis compares
 * recent aggregates to it with the same relative-delta rule as canary evaluation, and also
 * looks for a cheaper endpoint that meets the latency SLA. Findings become recommendations
 * ranked by expected improvement.
 */
public final class PerformanceOptimizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PerformanceOptimizer.class);

    static final String STORE_PREFIX = "baseline/";

    private static final Comparator<Recommendation> RANKING =
            Comparator.comparingDouble(Recommendation::expectedImprovement).reversed()
                    .thenComparing(Recommendation::type)
                    .thenComparing(Recommendation::endpointId);

    private final EndpointRegistry registry;
    private final MetricsCollector collector;
    private final NotificationSink sink;
    private final SnapshotStore store;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final OptimizerSettings settings;
    private final Map<String, PerformanceBaseline> baselines = new ConcurrentHashMap<>();
    private final Map<String, List<Recommendation>> latest = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> analysisTask;

    public PerformanceOptimizer(
            EndpointRegistry registry,
            MetricsCollector collector,
            NotificationSink sink,
            SnapshotStore store,
            MetricsRegistry metrics,
            Clock clock,
            OptimizerSettings settings
    ) {
        this.registry = registry;
        this.collector = collector;
        this.sink = sink;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Captures the aggregates of every endpoint of the model with enough history.
     *
     * @throws ValidationException if the model is unknown or no endpoint has enough samples
     */
    public PerformanceBaseline establishBaseline(String model) {
        RegistrySnapshot snapshot = registry.getSnapshot(model);
        if (snapshot.endpoints().isEmpty()) {
            throw new ValidationException("Unknown model: " + model);
        }
        Map<String, AggregateWindow> aggregates = new HashMap<>();
        for (ModelEndpoint endpoint : snapshot.endpoints()) {
            AggregateWindow aggregate = collector.getAggregate(endpoint.id(), settings.baselineWindow());
            if (aggregate.sampleCount() >= settings.minSampleCount()) {
                aggregates.put(endpoint.id(), aggregate);
            }
        }
        if (aggregates.isEmpty()) {
            throw new ValidationException("Insufficient history for a baseline of model " + model
                    + ": no endpoint has " + settings.minSampleCount() + " samples in " + settings.baselineWindow());
        }

        PerformanceBaseline baseline = new PerformanceBaseline(model, clock.instant(), settings.baselineWindow(), aggregates);
        baselines.put(model, baseline);
        try {
            store.put(STORE_PREFIX + model, baseline);
        } catch (RuntimeException e) {
            log.error("Failed to persist baseline: model={}", model, e);
        }
        log.info("Baseline established: model={}, endpoints={}", model, aggregates.keySet());
        return baseline;
    }

    public Optional<PerformanceBaseline> getBaseline(String model) {
        PerformanceBaseline baseline = baselines.get(model);
        if (baseline != null) {
            return Optional.of(baseline);
        }
        Optional<PerformanceBaseline> persisted = store.get(STORE_PREFIX + model, PerformanceBaseline.class);
        persisted.ifPresent(b -> baselines.put(model, b));
        return persisted;
    }

    /**
     * Compares recent aggregates with the baseline and ranks the resulting recommendations.
     * Every recommendation is sent to the notification sink.
     *
     * @throws ValidationException if the model has no baseline
     */
    public List<Recommendation> analyzeDegradation(String model) {
        PerformanceBaseline baseline = getBaseline(model)
                .orElseThrow(() -> new ValidationException("No baseline for model " + model));
        RegistrySnapshot snapshot = registry.getSnapshot(model);

        Map<String, AggregateWindow> current = new HashMap<>();
        for (ModelEndpoint endpoint : snapshot.endpoints()) {
            current.put(endpoint.id(), collector.getAggregate(endpoint.id(), settings.analysisWindow()));
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (ModelEndpoint endpoint : snapshot.servingEndpoints()) {
            AggregateWindow now = current.get(endpoint.id());
            if (now.sampleCount() < settings.minSampleCount()) {
                continue;
            }
            AggregateWindow reference = baseline.endpoints().get(endpoint.id());
            if (reference != null) {
                checkLatency(model, endpoint, reference, now).ifPresent(recommendations::add);
                checkErrors(model, endpoint, reference, now).ifPresent(recommendations::add);
            }
            checkCost(model, endpoint, now, snapshot, current).ifPresent(recommendations::add);
        }

        recommendations.sort(RANKING);
        List<Recommendation> ranked = List.copyOf(recommendations);
        latest.put(model, ranked);
        for (Recommendation recommendation : ranked) {
            publish(recommendation);
        }
        log.info("Degradation analysis completed: model={}, recommendations={}", model, ranked.size());
        return ranked;
    }

    /**
     * Analyzes every model that has a baseline. Failures are logged per model.
     */
    public void analyzeAll() {
        for (String model : registry.models()) {
            if (getBaseline(model).isEmpty()) {
                continue;
            }
            try {
                analyzeDegradation(model);
            } catch (Exception e) {
                log.error("Degradation analysis failed: model={}", model, e);
            }
        }
    }

    /**
     * Recommendations of the last analysis of a model, ranked.
     */
    public List<Recommendation> latestRecommendations(String model) {
        return latest.getOrDefault(model, List.of());
    }

    public void start(ScheduledExecutorService scheduler, Duration interval) {
        if (analysisTask == null) {
            analysisTask = scheduler.scheduleWithFixedDelay(this::analyzeAll,
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Performance optimizer started: interval={}", interval);
        }
    }

    private Optional<Recommendation> checkLatency(
            String model, ModelEndpoint endpoint, AggregateWindow reference, AggregateWindow now) {
        DeltaComparison.CriterionResult latency = DeltaComparison.compare(DeltaComparison.P95_LATENCY,
                reference.p95LatencyMs(), now.p95LatencyMs(), settings.latencyTolerance(), settings.absoluteLatencyMs());
        if (latency.passed()) {
            return Optional.empty();
        }
        double regression = now.p95LatencyMs() > 0
                ? (now.p95LatencyMs() - reference.p95LatencyMs()) / now.p95LatencyMs()
                : 0;
        double load = collector.load(endpoint);
        if (load >= settings.highLoadThreshold()) {
            return Optional.of(new Recommendation(RecommendationType.SCALE_UP, model, endpoint.id(),
                    String.format("p95 latency %.1fms vs baseline %.1fms at load %.2f; add capacity",
                            now.p95LatencyMs(), reference.p95LatencyMs(), load),
                    regression, confidence(now.sampleCount())));
        }
        return Optional.of(new Recommendation(RecommendationType.ENABLE_CACHING, model, endpoint.id(),
                String.format("p95 latency %.1fms vs baseline %.1fms with spare capacity; cache repeated prompts",
                        now.p95LatencyMs(), reference.p95LatencyMs()),
                settings.cacheHitRatio() * regression, confidence(now.sampleCount())));
    }

    private Optional<Recommendation> checkErrors(
            String model, ModelEndpoint endpoint, AggregateWindow reference, AggregateWindow now) {
        DeltaComparison.CriterionResult errors = DeltaComparison.compare(DeltaComparison.ERROR_RATE,
                reference.errorRate(), now.errorRate(), settings.errorRateTolerance(), settings.absoluteErrorRate());
        if (errors.passed()) {
            return Optional.empty();
        }
        double improvement = now.errorRate() > 0 ? (now.errorRate() - reference.errorRate()) / now.errorRate() : 0;
        return Optional.of(new Recommendation(RecommendationType.INVESTIGATE_ERRORS, model, endpoint.id(),
                String.format("Error rate %.4f vs baseline %.4f", now.errorRate(), reference.errorRate()),
                improvement, confidence(now.sampleCount())));
    }

    private Optional<Recommendation> checkCost(
            String model,
            ModelEndpoint endpoint,
            AggregateWindow now,
            RegistrySnapshot snapshot,
            Map<String, AggregateWindow> current
    ) {
        if (endpoint.costPerToken() <= 0) {
            return Optional.empty();
        }
        Optional<ModelEndpoint> cheaper = snapshot.endpoints().stream()
                .filter(c -> !c.id().equals(endpoint.id()))
                .filter(c -> c.state() == EndpointState.ACTIVE && c.isHealthy())
                .filter(c -> c.costPerToken() < endpoint.costPerToken())
                .filter(c -> {
                    AggregateWindow a = current.get(c.id());
                    return a.sampleCount() >= settings.minSampleCount() && a.p95LatencyMs() <= settings.latencySlaMs();
                })
                .min(Comparator.comparingDouble(ModelEndpoint::costPerToken).thenComparing(ModelEndpoint::id));
        if (cheaper.isEmpty()) {
            return Optional.empty();
        }
        ModelEndpoint target = cheaper.get();
        double saving = (endpoint.costPerToken() - target.costPerToken()) / endpoint.costPerToken();
        int samples = Math.min(now.sampleCount(), current.get(target.id()).sampleCount());
        return Optional.of(new Recommendation(RecommendationType.SWITCH_TO_CHEAPER_ENDPOINT, model, endpoint.id(),
                String.format("Shift traffic to %s: cost per token %.6f vs %.6f, p95 %.1fms within SLA %.1fms",
                        target.id(), target.costPerToken(), endpoint.costPerToken(),
                        current.get(target.id()).p95LatencyMs(), settings.latencySlaMs()),
                saving, confidence(samples)));
    }

    private double confidence(int samples) {
        return Math.min(1.0, samples / (2.0 * settings.minSampleCount()));
    }

    private void publish(Recommendation recommendation) {
        metrics.incrementRecommendation(recommendation.model(), recommendation.type());
        try {
            sink.notify(new ControllerEvent(ControllerEvent.Type.RECOMMENDATION, recommendation.model(),
                    recommendation.endpointId(), recommendation.description(), clock.instant(), Map.of(
                    "type", recommendation.type().name(),
                    "expectedImprovement", recommendation.expectedImprovement(),
                    "confidence", recommendation.confidence())));
        } catch (RuntimeException e) {
            log.error("Notification failed: recommendation={}", recommendation, e);
        }
    }

    @Override
    public void close() {
        ScheduledFuture<?> task = analysisTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
