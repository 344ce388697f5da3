package fr.lapetina.modeltraffic.infrastructure.health;

import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.spi.HealthProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background health checker for model endpoints.
 *
 * Periodically probes each registered endpoint and feeds the result into the registry,
 * where the router's healthy filter picks it up. An endpoint becomes DEGRADED after
 * {@code degradedThreshold} consecutive failures and DOWN after {@code downThreshold};
 * a single successful probe brings it back UP.
 */
public final class EndpointHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EndpointHealthChecker.class);

    private final EndpointRegistry registry;
    private final HealthProbe probe;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration timeout;
    private final int degradedThreshold;
    private final int downThreshold;
    private final Map<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public EndpointHealthChecker(
            EndpointRegistry registry,
            HealthProbe probe,
            Duration checkInterval,
            Duration timeout,
            int degradedThreshold,
            int downThreshold
    ) {
        if (degradedThreshold <= 0 || downThreshold < degradedThreshold) {
            throw new IllegalArgumentException("Require 0 < degradedThreshold <= downThreshold, got "
                    + degradedThreshold + " and " + downThreshold);
        }
        this.registry = registry;
        this.probe = probe;
        this.checkInterval = checkInterval;
        this.timeout = timeout;
        this.degradedThreshold = degradedThreshold;
        this.downThreshold = downThreshold;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    public EndpointHealthChecker(EndpointRegistry registry, HealthProbe probe) {
        this(registry, probe, Duration.ofSeconds(30), Duration.ofSeconds(5), 3, 6);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    private void runCycle() {
        try {
            checkAllEndpoints();
        } catch (Exception e) {
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes every registered endpoint.
     *
     * @return a future completing once every probe has been applied
     */
    public CompletableFuture<Void> checkAllEndpoints() {
        List<ModelEndpoint> endpoints = registry.allEndpoints();
        log.debug("Starting health check cycle: endpointCount={}", endpoints.size());

        consecutiveFailures.keySet().removeIf(id -> registry.findEndpoint(id).isEmpty());

        CompletableFuture<?>[] checks = endpoints.stream()
                .map(this::checkEndpoint)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(checks);
    }

    /**
     * Probes a single endpoint and applies the result.
     *
     * @return the health recorded for the endpoint
     */
    public CompletableFuture<EndpointHealth> checkEndpoint(ModelEndpoint endpoint) {
        CompletableFuture<Boolean> result;
        try {
            result = probe.check(endpoint);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(handleFailure(endpoint, e));
        }
        return result
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((healthy, ex) -> {
                    if (ex != null) {
                        return handleFailure(endpoint, ex);
                    }
                    return Boolean.TRUE.equals(healthy) ? handleSuccess(endpoint) : handleFailure(endpoint, null);
                });
    }

    private EndpointHealth handleSuccess(ModelEndpoint endpoint) {
        AtomicInteger failures = consecutiveFailures.get(endpoint.id());
        if (failures != null) {
            failures.set(0);
        }
        setHealth(endpoint, EndpointHealth.UP);
        return EndpointHealth.UP;
    }

    private EndpointHealth handleFailure(ModelEndpoint endpoint, Throwable ex) {
        int failures = consecutiveFailures
                .computeIfAbsent(endpoint.id(), id -> new AtomicInteger())
                .incrementAndGet();

        EndpointHealth newHealth;
        if (failures >= downThreshold) {
            newHealth = EndpointHealth.DOWN;
        } else if (failures >= degradedThreshold) {
            newHealth = EndpointHealth.DEGRADED;
        } else {
            newHealth = endpoint.health();
        }

        if (ex != null) {
            log.warn("Health check failed: endpointId={}, consecutiveFailures={}, newHealth={}, error={}",
                    endpoint.id(), failures, newHealth, ex.getMessage());
        } else {
            log.warn("Health check returned unhealthy: endpointId={}, consecutiveFailures={}, newHealth={}",
                    endpoint.id(), failures, newHealth);
        }

        setHealth(endpoint, newHealth);
        return newHealth;
    }

    private void setHealth(ModelEndpoint endpoint, EndpointHealth health) {
        // The registry ignores unchanged health and unknown endpoints
        registry.updateHealth(endpoint.id(), health);
    }

    public int getConsecutiveFailures(String endpointId) {
        AtomicInteger failures = consecutiveFailures.get(endpointId);
        return failures != null ? failures.get() : 0;
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }
}
