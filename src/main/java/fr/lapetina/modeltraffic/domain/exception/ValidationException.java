package fr.lapetina.modeltraffic.domain.exception;

/**
 * Thrown when a registry mutation or rollout configuration is malformed.
 *
 * Always raised before any state change is committed.
 */
public final class ValidationException extends ControllerException {

    public ValidationException(String message) {
        super(message);
    }
}
