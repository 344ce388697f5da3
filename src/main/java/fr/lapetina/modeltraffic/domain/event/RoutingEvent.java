package fr.lapetina.modeltraffic.domain.event;

import fr.lapetina.modeltraffic.domain.model.ErrorType;
import fr.lapetina.modeltraffic.domain.model.InferenceResult;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer; each handler stage updates it as the request
 * progresses. Asynchronous callbacks must not touch it once the handler that started them
 * has returned, since the slot may already carry another request.
 */
public final class RoutingEvent {

    private RequestContext request;

    private EventState state;
    private ModelEndpoint selectedEndpoint;
    private InferenceResult result;
    private ErrorType errorType;
    private String errorMessage;

    private Instant acceptedAt;
    private Instant routedAt;
    private Instant dispatchedAt;
    private Instant completedAt;

    private CompletableFuture<InferenceResult> resultFuture;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.state = null;
        this.selectedEndpoint = null;
        this.result = null;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.routedAt = null;
        this.dispatchedAt = null;
        this.completedAt = null;
        this.resultFuture = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(RequestContext request, CompletableFuture<InferenceResult> resultFuture) {
        clear();
        this.request = request;
        this.resultFuture = resultFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public RequestContext getRequest() {
        return request;
    }

    public EventState getState() {
        return state;
    }

    public ModelEndpoint getSelectedEndpoint() {
        return selectedEndpoint;
    }

    public InferenceResult getResult() {
        return result;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getRoutedAt() {
        return routedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public CompletableFuture<InferenceResult> getResultFuture() {
        return resultFuture;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void setResult(InferenceResult result) {
        this.result = result;
    }

    public void markRouted(ModelEndpoint endpoint) {
        this.selectedEndpoint = endpoint;
        this.state = EventState.ROUTED;
        this.routedAt = Instant.now();
    }

    public void markNoHealthyEndpoint(String message) {
        this.state = EventState.NO_HEALTHY_ENDPOINT;
        this.errorType = ErrorType.NO_HEALTHY_ENDPOINT;
        this.errorMessage = message;
        this.completedAt = Instant.now();
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    public void markFailed(ErrorType errorType, String message) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
        this.errorMessage = message;
        this.completedAt = Instant.now();
    }

    /**
     * Checks if processing should skip the dispatch stage.
     */
    public boolean shouldSkip() {
        return state == EventState.NO_HEALTHY_ENDPOINT
            || state == EventState.FAILED
            || state == EventState.COMPLETED;
    }

    @Override
    public String toString() {
        return "RoutingEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", endpoint=" + (selectedEndpoint != null ? selectedEndpoint.id() : "null") +
                ", seq=" + sequence +
                '}';
    }
}
