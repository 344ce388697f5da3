package fr.lapetina.modeltraffic.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.modeltraffic.domain.event.EventState;
import fr.lapetina.modeltraffic.domain.event.RoutingEvent;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Third stage handler: records pipeline metrics.
 *
 * Records:
 * - Request count by model, endpoint and pipeline state
 * - Stage latencies (route selection, dispatch queueing)
 * - Pre-dispatch errors
 * - Sets MDC context for structured logging
 *
 * Outcome metrics of dispatched requests are recorded by the dispatch callback.
 */
public final class MetricsHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;
    private final MetricsCollector collector;

    public MetricsHandler(MetricsRegistry metricsRegistry, MetricsCollector collector) {
        this.metricsRegistry = metricsRegistry;
        this.collector = collector;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
            if (endOfBatch) {
                metricsRegistry.setGlobalInFlight(collector.getTotalInFlight());
            }
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(RoutingEvent event) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
            MDC.put("correlationId", event.getRequest().correlationId());
            MDC.put("model", event.getRequest().model());
        }
        if (event.getSelectedEndpoint() != null) {
            MDC.put("endpointId", event.getSelectedEndpoint().id());
        }
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("correlationId");
        MDC.remove("model");
        MDC.remove("endpointId");
        MDC.remove("eventState");
    }

    private void recordMetrics(RoutingEvent event) {
        if (event.getRequest() == null || event.getState() == null) {
            return;
        }
        String model = event.getRequest().model();
        String endpointId = event.getSelectedEndpoint() != null ? event.getSelectedEndpoint().id() : "none";
        EventState state = event.getState();

        metricsRegistry.incrementRequestCount(model, endpointId, state);

        if (event.getRoutedAt() != null && event.getAcceptedAt() != null) {
            metricsRegistry.recordStageLatency("route_selection",
                    Duration.between(event.getAcceptedAt(), event.getRoutedAt()));
        }
        if (event.getDispatchedAt() != null && event.getRoutedAt() != null) {
            metricsRegistry.recordStageLatency("queue",
                    Duration.between(event.getRoutedAt(), event.getDispatchedAt()));
        }

        if (event.getErrorType() != null) {
            metricsRegistry.incrementErrorCount(model, endpointId, event.getErrorType());

            log.warn("Request error recorded: model={}, endpoint={}, errorType={}, message={}",
                    model, endpointId, event.getErrorType(), event.getErrorMessage());
        }
    }
}
