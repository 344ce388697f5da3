package fr.lapetina.modeltraffic.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating RoutingEvent instances in the Disruptor ring buffer.
 */
public final class RoutingEventFactory implements EventFactory<RoutingEvent> {

    @Override
    public RoutingEvent newInstance() {
        return new RoutingEvent();
    }
}
