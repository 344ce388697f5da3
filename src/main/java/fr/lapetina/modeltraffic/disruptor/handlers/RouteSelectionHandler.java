package fr.lapetina.modeltraffic.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.modeltraffic.domain.event.EventState;
import fr.lapetina.modeltraffic.domain.event.RoutingEvent;
import fr.lapetina.modeltraffic.domain.exception.NoHealthyEndpointException;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: selects an endpoint through the {@link Router}.
 *
 * The router applies the version split, then the active strategy among the healthy
 * endpoints of the chosen version.
 */
public final class RouteSelectionHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(RouteSelectionHandler.class);

    private final Router router;
    private final MetricsRegistry metricsRegistry;

    public RouteSelectionHandler(Router router, MetricsRegistry metricsRegistry) {
        this.router = router;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.CREATED) {
            return;
        }

        RequestContext request = event.getRequest();
        try {
            ModelEndpoint endpoint = router.route(request);
            event.markRouted(endpoint);
            metricsRegistry.incrementRoutingDecision(
                    request.model(), endpoint.version(), endpoint.id(), router.getStrategy().getName());

            log.info("Endpoint selected: requestId={}, model={}, endpointId={}, version={}, strategy={}",
                    request.requestId(), request.model(), endpoint.id(), endpoint.version(),
                    router.getStrategy().getName());
        } catch (NoHealthyEndpointException e) {
            event.markNoHealthyEndpoint(e.getMessage());
            metricsRegistry.incrementRoutingFailure(request.model(), e.getReason().name());

            log.warn("No healthy endpoint: requestId={}, model={}, reason={}, error={}",
                    request.requestId(), request.model(), e.getReason(), e.getMessage());
        }
    }
}
