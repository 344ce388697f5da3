package fr.lapetina.modeltraffic.disruptor.exception;

/**
 * Exception thrown when the pipeline refuses a request to protect itself.
 *
 * This occurs when:
 * - Ring buffer is full and cannot accept new requests
 * - Global in-flight limit is reached
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        GLOBAL_LIMIT_REACHED("Global in-flight request limit reached");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
