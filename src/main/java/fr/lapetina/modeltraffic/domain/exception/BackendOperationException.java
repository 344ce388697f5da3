package fr.lapetina.modeltraffic.domain.exception;

/**
 * Thrown when the deployment backend fails to create or delete a deployment.
 *
 * Fatal to the active rollout: the controller aborts and rolls back.
 */
public final class BackendOperationException extends ControllerException {

    private final Operation operation;
    private final String target;

    public BackendOperationException(Operation operation, String target, String message) {
        super("Backend " + operation.name().toLowerCase() + " failed for " + target + ": " + message);
        this.operation = operation;
        this.target = target;
    }

    public BackendOperationException(Operation operation, String target, String message, Throwable cause) {
        super("Backend " + operation.name().toLowerCase() + " failed for " + target + ": " + message, cause);
        this.operation = operation;
        this.target = target;
    }

    public Operation getOperation() {
        return operation;
    }

    public String getTarget() {
        return target;
    }

    public enum Operation {
        CREATE,
        DELETE
    }
}
