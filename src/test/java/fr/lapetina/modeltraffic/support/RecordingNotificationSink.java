package fr.lapetina.modeltraffic.support;

import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.spi.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingNotificationSink implements NotificationSink {

    private final List<ControllerEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void notify(ControllerEvent event) {
        events.add(event);
    }

    public List<ControllerEvent> events() {
        return List.copyOf(events);
    }

    public List<ControllerEvent.Type> types() {
        return events.stream().map(ControllerEvent::type).toList();
    }

    public void clear() {
        events.clear();
    }
}
