package fr.lapetina.modeltraffic.domain.exception;

/**
 * Thrown when routing finds no viable endpoint.
 *
 * Surfaced to the caller; the router never falls back to another version.
 */
public final class NoHealthyEndpointException extends ControllerException {

    private final String model;
    private final Reason reason;

    public NoHealthyEndpointException(String model, Reason reason) {
        super("No healthy endpoint for model '" + model + "': " + reason.getMessage());
        this.model = model;
        this.reason = reason;
    }

    public NoHealthyEndpointException(String model, Reason reason, String details) {
        super("No healthy endpoint for model '" + model + "': " + reason.getMessage() + " - " + details);
        this.model = model;
        this.reason = reason;
    }

    public String getModel() {
        return model;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        UNKNOWN_MODEL("Model has no registered endpoints"),
        NO_WEIGHTED_ENDPOINT("No endpoint holds traffic weight"),
        VERSION_UNHEALTHY("Every endpoint of the selected version is down");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
