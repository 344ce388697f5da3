package fr.lapetina.modeltraffic.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.modeltraffic.domain.event.EventState;
import fr.lapetina.modeltraffic.domain.event.RoutingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: logs requests that ended inside the pipeline and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        try {
            logSummary(event);
        } finally {
            event.clear();
        }
    }

    private void logSummary(RoutingEvent event) {
        if (event.getRequest() == null) {
            return;
        }
        if (event.getState() == EventState.DISPATCHED) {
            log.debug("Request in flight: requestId={}, endpointId={}",
                    event.getRequest().requestId(), event.getSelectedEndpoint().id());
            return;
        }
        log.warn("Request not dispatched: requestId={}, model={}, state={}, errorType={}, errorMessage={}",
                event.getRequest().requestId(), event.getRequest().model(), event.getState(),
                event.getErrorType(), event.getErrorMessage());
    }
}
