package fr.lapetina.modeltraffic.routing;

import fr.lapetina.modeltraffic.domain.exception.NoHealthyEndpointException;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;
import fr.lapetina.modeltraffic.domain.strategy.EndpointStats;
import fr.lapetina.modeltraffic.domain.strategy.RoutingParameters;
import fr.lapetina.modeltraffic.domain.strategy.RoutingStrategy;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Selects the endpoint that serves a request.
 *
 * Routing runs in two phases against one registry snapshot:
 * <ol>
 *   <li>Traffic split: the request id hashes to a bucket in [0, 100) which picks a version
 *       according to the summed weights of that version's endpoints.</li>
 *   <li>Strategy: the configured {@link RoutingStrategy} picks among the healthy weighted
 *       endpoints of that version.</li>
 * </ol>
 *
 * Never falls back to another version: if the selected version has no healthy endpoint the
 * request fails, so a broken canary cannot silently push its share onto the baseline.
 *
 * Thread-safe and lock-free; the strategy can be switched at runtime.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final EndpointRegistry registry;
    private final MetricsCollector collector;
    private final Duration latencyWindow;
    private final AtomicReference<Settings> settings;
    private final Map<String, LongAdder> routedCounts = new ConcurrentHashMap<>();

    public Router(
            EndpointRegistry registry,
            MetricsCollector collector,
            RoutingStrategy strategy,
            RoutingParameters parameters,
            Duration latencyWindow
    ) {
        this.registry = registry;
        this.collector = collector;
        this.latencyWindow = latencyWindow;
        this.settings = new AtomicReference<>(new Settings(strategy, parameters));
    }

    /**
     * Routes a request using the model named in its context.
     */
    public ModelEndpoint route(RequestContext context) {
        return route(context.model(), context);
    }

    /**
     * Selects an endpoint of the model for the request.
     *
     * @throws NoHealthyEndpointException if the model is unknown, no endpoint holds weight,
     *                                    or every endpoint of the selected version is down
     */
    public ModelEndpoint route(String model, RequestContext context) {
        Objects.requireNonNull(model, "Model is required");
        RegistrySnapshot snapshot = registry.getSnapshot(model);
        if (snapshot.endpoints().isEmpty()) {
            throw new NoHealthyEndpointException(model, NoHealthyEndpointException.Reason.UNKNOWN_MODEL);
        }

        Map<String, List<ModelEndpoint>> byVersion = weightedByVersion(snapshot);
        if (byVersion.isEmpty()) {
            throw new NoHealthyEndpointException(model, NoHealthyEndpointException.Reason.NO_WEIGHTED_ENDPOINT);
        }

        int bucket = bucket(context.routingKey());
        String version = selectVersion(byVersion, bucket);

        List<ModelEndpoint> healthy = byVersion.get(version).stream()
                .filter(ModelEndpoint::isHealthy)
                .toList();
        if (healthy.isEmpty()) {
            throw new NoHealthyEndpointException(model, NoHealthyEndpointException.Reason.VERSION_UNHEALTHY,
                    "version=" + version);
        }

        Settings current = settings.get();
        ModelEndpoint selected = current.strategy()
                .select(candidateStats(healthy, current.strategy()), current.parameters())
                .map(EndpointStats::endpoint)
                .orElseThrow(() -> new NoHealthyEndpointException(model,
                        NoHealthyEndpointException.Reason.VERSION_UNHEALTHY, "version=" + version));

        routedCounts.computeIfAbsent(selected.id(), id -> new LongAdder()).increment();
        log.debug("Request routed: requestId={}, model={}, bucket={}, version={}, endpointId={}, strategy={}",
                context.requestId(), model, bucket, version, selected.id(), current.strategy().getName());
        return selected;
    }

    /**
     * Groups weighted endpoints by version, versions in lexicographic order, endpoints by id.
     */
    static Map<String, List<ModelEndpoint>> weightedByVersion(RegistrySnapshot snapshot) {
        Map<String, List<ModelEndpoint>> byVersion = new TreeMap<>();
        for (ModelEndpoint endpoint : snapshot.endpoints()) {
            if (endpoint.isServing()) {
                byVersion.computeIfAbsent(endpoint.version(), v -> new ArrayList<>()).add(endpoint);
            }
        }
        return byVersion;
    }

    /**
     * Walks the versions in order, accumulating their weight, until the bucket is covered.
     */
    static String selectVersion(Map<String, List<ModelEndpoint>> byVersion, int bucket) {
        int cumulative = 0;
        String last = null;
        for (Map.Entry<String, List<ModelEndpoint>> entry : byVersion.entrySet()) {
            cumulative += entry.getValue().stream().mapToInt(ModelEndpoint::weight).sum();
            last = entry.getKey();
            if (bucket < cumulative) {
                return last;
            }
        }
        return last;
    }

    /**
     * Maps a routing key to a bucket in [0, 100). Stable across processes and restarts.
     */
    public static int bucket(String routingKey) {
        return Math.floorMod(mix(routingKey.hashCode()), 100);
    }

    // murmur3 finalizer, spreads String.hashCode over the low bits
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    private List<EndpointStats> candidateStats(List<ModelEndpoint> candidates, RoutingStrategy strategy) {
        Map<String, Double> known = new LinkedHashMap<>();
        if (strategy.usesLatency()) {
            for (ModelEndpoint endpoint : candidates) {
                OptionalDouble latency = collector.recentLatency(endpoint.id(), latencyWindow);
                if (latency.isPresent()) {
                    known.put(endpoint.id(), latency.getAsDouble());
                }
            }
        }
        double fallbackLatency = known.values().stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0);

        List<EndpointStats> stats = new ArrayList<>(candidates.size());
        for (ModelEndpoint endpoint : candidates) {
            double latency = known.getOrDefault(endpoint.id(), fallbackLatency);
            stats.add(new EndpointStats(endpoint, latency, collector.load(endpoint)));
        }
        return stats;
    }

    /**
     * Requests routed to each endpoint of the model since startup.
     */
    public Map<String, Long> trafficStatistics(String model) {
        Map<String, Long> stats = new LinkedHashMap<>();
        for (ModelEndpoint endpoint : registry.getSnapshot(model).endpoints()) {
            LongAdder count = routedCounts.get(endpoint.id());
            stats.put(endpoint.id(), count == null ? 0L : count.sum());
        }
        return stats;
    }

    public RoutingStrategy getStrategy() {
        return settings.get().strategy();
    }

    public RoutingParameters getParameters() {
        return settings.get().parameters();
    }

    /**
     * Switches the strategy. Requests already being routed finish with the previous one.
     */
    public void setStrategy(RoutingStrategy strategy) {
        Objects.requireNonNull(strategy, "Strategy is required");
        Settings previous = settings.getAndUpdate(s -> new Settings(strategy, s.parameters()));
        log.info("Routing strategy changed: {} -> {}", previous.strategy().getName(), strategy.getName());
    }

    public void setParameters(RoutingParameters parameters) {
        Objects.requireNonNull(parameters, "Parameters are required");
        settings.getAndUpdate(s -> new Settings(s.strategy(), parameters));
        log.info("Routing parameters changed: {}", parameters);
    }

    private record Settings(RoutingStrategy strategy, RoutingParameters parameters) {
    }
}
