package fr.lapetina.modeltraffic.domain.exception;

/**
 * Base class for failures raised by the traffic controller.
 */
public abstract class ControllerException extends RuntimeException {

    protected ControllerException(String message) {
        super(message);
    }

    protected ControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
