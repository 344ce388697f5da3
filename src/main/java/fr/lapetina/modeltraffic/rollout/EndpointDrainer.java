package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.registry.EndpointRegistry;
import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.spi.DeploymentBackend;
import fr.lapetina.modeltraffic.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Removes RETIRING endpoints once their drain grace period has elapsed.
 *
 * Removal deregisters the endpoint, forgets its metrics and deletes the backend deployment.
 * A backend delete failure is reported but does not resurrect the endpoint.
 */
public final class EndpointDrainer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EndpointDrainer.class);

    private final EndpointRegistry registry;
    private final MetricsCollector collector;
    private final DeploymentBackend backend;
    private final NotificationSink sink;
    private final Clock clock;
    private final Duration gracePeriod;
    private final Map<String, Instant> dueAt = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> sweepTask;

    public EndpointDrainer(
            EndpointRegistry registry,
            MetricsCollector collector,
            DeploymentBackend backend,
            NotificationSink sink,
            Clock clock,
            Duration gracePeriod
    ) {
        this.registry = registry;
        this.collector = collector;
        this.backend = backend;
        this.sink = sink;
        this.clock = clock;
        this.gracePeriod = gracePeriod;
    }

    /**
     * Starts periodic sweeps on the shared scheduler.
     */
    public void start(ScheduledExecutorService scheduler, Duration interval) {
        if (sweepTask == null) {
            sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely,
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Endpoint drainer started: gracePeriod={}, interval={}", gracePeriod, interval);
        }
    }

    /**
     * Schedules an endpoint for removal after the grace period.
     */
    public void retire(String endpointId) {
        Instant due = clock.instant().plus(gracePeriod);
        dueAt.putIfAbsent(endpointId, due);
        log.info("Endpoint draining: endpointId={}, removeAfter={}", endpointId, due);
    }

    /**
     * Removes every endpoint whose grace period has elapsed.
     *
     * @return ids of the endpoints removed
     */
    public List<String> sweep() {
        Instant now = clock.instant();
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, Instant> entry : dueAt.entrySet()) {
            if (now.isBefore(entry.getValue())) {
                continue;
            }
            String endpointId = entry.getKey();
            dueAt.remove(endpointId);
            if (remove(endpointId)) {
                removed.add(endpointId);
            }
        }
        return removed;
    }

    public boolean isDraining(String endpointId) {
        return dueAt.containsKey(endpointId);
    }

    public Map<String, Instant> pending() {
        return Map.copyOf(dueAt);
    }

    private boolean remove(String endpointId) {
        Optional<ModelEndpoint> found = registry.findEndpoint(endpointId);
        if (found.isEmpty()) {
            log.debug("Drained endpoint already gone: endpointId={}", endpointId);
            return false;
        }
        ModelEndpoint endpoint = found.get();
        if (endpoint.weight() > 0 || endpoint.state() != EndpointState.RETIRING) {
            log.info("Drain cancelled, endpoint back in service: {}", endpoint);
            return false;
        }

        try {
            registry.deregister(endpointId);
        } catch (ValidationException e) {
            log.warn("Drain skipped: endpointId={}, reason={}", endpointId, e.getMessage());
            return false;
        }
        collector.forget(endpointId);

        try {
            backend.delete(endpointId);
        } catch (RuntimeException e) {
            log.error("Backend delete failed: endpointId={}", endpointId, e);
            notify(ControllerEvent.Type.BACKEND_FAILURE, endpoint,
                    "Failed to delete deployment: " + e.getMessage());
        }

        log.info("Endpoint retired: endpointId={}, model={}, version={}",
                endpointId, endpoint.model(), endpoint.version());
        notify(ControllerEvent.Type.ENDPOINT_RETIRED, endpoint, "Endpoint drained and removed");
        return true;
    }

    private void notify(ControllerEvent.Type type, ModelEndpoint endpoint, String message) {
        try {
            sink.notify(ControllerEvent.of(type, endpoint.model(), endpoint.id(), message, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Notification failed: type={}, endpointId={}", type, endpoint.id(), e);
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Drain sweep failed", e);
        }
    }

    @Override
    public void close() {
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
