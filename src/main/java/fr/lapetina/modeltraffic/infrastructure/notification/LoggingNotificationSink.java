package fr.lapetina.modeltraffic.infrastructure.notification;

import fr.lapetina.modeltraffic.spi.ControllerEvent;
import fr.lapetina.modeltraffic.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes controller events to a dedicated logger, so they can be routed to their own appender.
 */
public final class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger("fr.lapetina.modeltraffic.events");

    @Override
    public void notify(ControllerEvent event) {
        switch (event.type()) {
            case CANARY_ROLLED_BACK, CANARY_ABORTED, SMOKE_TEST_FAILED, BLUE_GREEN_REVERTED,
                    BLUE_GREEN_ABORTED, BACKEND_FAILURE ->
                    log.warn("{} model={} subject={} message={} attributes={}",
                            event.type(), event.model(), event.subjectId(), event.message(), event.attributes());
            default ->
                    log.info("{} model={} subject={} message={} attributes={}",
                            event.type(), event.model(), event.subjectId(), event.message(), event.attributes());
        }
    }
}
