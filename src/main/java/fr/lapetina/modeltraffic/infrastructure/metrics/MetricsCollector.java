package fr.lapetina.modeltraffic.infrastructure.metrics;

import fr.lapetina.modeltraffic.domain.model.AggregateWindow;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestMetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;

/**
 * Collects per-request samples per endpoint and computes rolling aggregates.
 *
 * Thread-safe. {@link #record} is called from request threads and only takes the lock of the
 * endpoint being written. Aggregates are computed from a copy taken under that lock, so slow
 * readers never hold up writers.
 *
 * Also tracks in-flight requests per endpoint, which the router turns into load.
 */
public final class MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final Map<String, EndpointSampleBuffer> buffers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong droppedSamples = new AtomicLong();
    private final Clock clock;
    private final int capacityPerEndpoint;
    private final Duration retention;
    private volatile ToDoubleFunction<String> costResolver = id -> 0.0;

    public MetricsCollector(Clock clock, int capacityPerEndpoint, Duration retention) {
        if (capacityPerEndpoint <= 0) {
            throw new IllegalArgumentException("Capacity per endpoint must be positive");
        }
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("Retention must be positive");
        }
        this.clock = clock;
        this.capacityPerEndpoint = capacityPerEndpoint;
        this.retention = retention;
    }

    /**
     * Sets how the cost per token of an endpoint is looked up when deriving cost.
     */
    public void setCostResolver(ToDoubleFunction<String> costResolver) {
        this.costResolver = costResolver;
    }

    /**
     * Records a request outcome timestamped now. Invalid samples are dropped and logged.
     */
    public void record(String endpointId, double latencyMs, boolean success, int tokens) {
        RequestMetricSample sample;
        try {
            sample = new RequestMetricSample(clock.instant(), endpointId, latencyMs, success, tokens);
        } catch (IllegalArgumentException | NullPointerException e) {
            drop(endpointId, e.getMessage());
            return;
        }
        record(sample);
    }

    /**
     * Records a request outcome. Samples older than the retention window are dropped.
     */
    public void record(RequestMetricSample sample) {
        if (sample == null) {
            drop(null, "null sample");
            return;
        }
        Instant now = clock.instant();
        if (sample.timestamp().isBefore(now.minus(retention))) {
            drop(sample.endpointId(), "sample older than retention window");
            return;
        }
        buffers.computeIfAbsent(sample.endpointId(), id -> new EndpointSampleBuffer(capacityPerEndpoint, retention))
                .add(sample, now);
    }

    /**
     * Aggregates the samples of one endpoint over the trailing window.
     */
    public AggregateWindow getAggregate(String endpointId, Duration window) {
        return getAggregate(List.of(endpointId), window);
    }

    /**
     * Aggregates the samples of several endpoints, as if they were one, over the trailing window.
     */
    public AggregateWindow getAggregate(Collection<String> endpointIds, Duration window) {
        Instant end = clock.instant();
        Instant start = end.minus(window);
        String label = String.join(",", endpointIds);

        List<RequestMetricSample> samples = new ArrayList<>();
        for (String id : endpointIds) {
            EndpointSampleBuffer buffer = buffers.get(id);
            if (buffer != null) {
                samples.addAll(buffer.snapshot(start, end));
            }
        }
        if (samples.isEmpty()) {
            return AggregateWindow.empty(label, start, end);
        }

        int n = samples.size();
        double[] latencies = new double[n];
        double latencySum = 0;
        int failures = 0;
        long tokens = 0;
        double cost = 0;
        for (int i = 0; i < n; i++) {
            RequestMetricSample s = samples.get(i);
            latencies[i] = s.latencyMs();
            latencySum += s.latencyMs();
            if (!s.success()) {
                failures++;
            }
            tokens += s.tokens();
            cost += s.tokens() * costResolver.applyAsDouble(s.endpointId());
        }
        Arrays.sort(latencies);

        double seconds = Math.max(window.toMillis() / 1000.0, 0.001);
        return new AggregateWindow(
                label,
                start,
                end,
                n,
                latencySum / n,
                percentile(latencies, 0.50),
                percentile(latencies, 0.95),
                (double) failures / n,
                n / seconds,
                tokens,
                cost
        );
    }

    /**
     * Nearest-rank percentile over a sorted array.
     */
    static double percentile(double[] sorted, double q) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(q * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }

    /**
     * Smoothed latency of an endpoint, if it received a sample within the window.
     *
     * Reads a value published on write: no copy, no sort, no lock. Meant for the routing hot path;
     * use {@link #getAggregate} where exact window statistics are needed.
     */
    public OptionalDouble recentLatency(String endpointId, Duration window) {
        EndpointSampleBuffer buffer = buffers.get(endpointId);
        if (buffer == null) {
            return OptionalDouble.empty();
        }
        EndpointSampleBuffer.LatencyEstimate estimate = buffer.latency();
        if (estimate == null || estimate.lastSampleAt().isBefore(clock.instant().minus(window))) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(estimate.averageMs());
    }

    /**
     * Marks a request as in flight on an endpoint.
     */
    public int acquire(String endpointId) {
        return inFlight.computeIfAbsent(endpointId, id -> new AtomicInteger()).incrementAndGet();
    }

    /**
     * Marks an in-flight request as finished. Never goes below zero.
     */
    public int release(String endpointId) {
        AtomicInteger counter = inFlight.get(endpointId);
        if (counter == null) {
            return 0;
        }
        return counter.updateAndGet(v -> Math.max(0, v - 1));
    }

    public int getInFlight(String endpointId) {
        AtomicInteger counter = inFlight.get(endpointId);
        return counter == null ? 0 : counter.get();
    }

    public int getTotalInFlight() {
        return inFlight.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    /**
     * In-flight requests divided by the endpoint's capacity.
     */
    public double load(ModelEndpoint endpoint) {
        return (double) getInFlight(endpoint.id()) / endpoint.maxConcurrentRequests();
    }

    /**
     * Drops every sample and counter of an endpoint. Called once it is deregistered.
     */
    public void forget(String endpointId) {
        buffers.remove(endpointId);
        inFlight.remove(endpointId);
        log.debug("Metrics forgotten: endpointId={}", endpointId);
    }

    public int bufferedSamples(String endpointId) {
        EndpointSampleBuffer buffer = buffers.get(endpointId);
        return buffer == null ? 0 : buffer.size();
    }

    public long getDroppedSamples() {
        return droppedSamples.get();
    }

    public Duration getRetention() {
        return retention;
    }

    private void drop(String endpointId, String reason) {
        long dropped = droppedSamples.incrementAndGet();
        log.warn("Metric sample dropped: endpointId={}, reason={}, totalDropped={}", endpointId, reason, dropped);
    }
}
