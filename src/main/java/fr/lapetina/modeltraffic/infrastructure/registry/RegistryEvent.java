package fr.lapetina.modeltraffic.infrastructure.registry;

/**
 * Event for endpoint registry commits.
 */
public record RegistryEvent(Type type, RegistrySnapshot snapshot, String endpointId) {

    public enum Type {
        REGISTERED,
        DEREGISTERED,
        WEIGHTS_COMMITTED,
        HEALTH_CHANGED,
        STATE_CHANGED,
        RESTORED
    }
}
