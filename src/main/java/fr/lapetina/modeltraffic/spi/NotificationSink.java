package fr.lapetina.modeltraffic.spi;

/**
 * Receives rollout, swap and optimizer events.
 *
 * Implementations must be thread-safe and should not block: they are called
 * from the evaluation scheduler.
 */
@FunctionalInterface
public interface NotificationSink {

    void notify(ControllerEvent event);
}
