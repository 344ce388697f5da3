package fr.lapetina.modeltraffic.spi;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Event published to the {@link NotificationSink}.
 *
 * @param subjectId plan, deployment or endpoint id the event is about
 */
public record ControllerEvent(
        Type type,
        String model,
        String subjectId,
        String message,
        Instant timestamp,
        Map<String, Object> attributes
) {
    public ControllerEvent {
        Objects.requireNonNull(type, "Type is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static ControllerEvent of(Type type, String model, String subjectId, String message, Instant at) {
        return new ControllerEvent(type, model, subjectId, message, at, Map.of());
    }

    public enum Type {
        CANARY_STARTED,
        CANARY_STEP_ADVANCED,
        CANARY_SUCCEEDED,
        CANARY_ROLLED_BACK,
        CANARY_ABORTED,
        BLUE_GREEN_STARTED,
        SMOKE_TEST_FAILED,
        BLUE_GREEN_SWAPPED,
        BLUE_GREEN_REVERTED,
        BLUE_GREEN_SUCCEEDED,
        BLUE_GREEN_ABORTED,
        ENDPOINT_RETIRED,
        BACKEND_FAILURE,
        RECOMMENDATION
    }
}
