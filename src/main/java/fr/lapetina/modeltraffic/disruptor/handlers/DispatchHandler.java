package fr.lapetina.modeltraffic.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.modeltraffic.domain.event.EventState;
import fr.lapetina.modeltraffic.domain.event.RoutingEvent;
import fr.lapetina.modeltraffic.domain.model.ErrorType;
import fr.lapetina.modeltraffic.domain.model.InferenceResult;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.spi.InferenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Second stage handler: hands routed requests to the {@link InferenceBackend}.
 *
 * The backend call is asynchronous. Its callback feeds the outcome into the
 * {@link MetricsCollector}, which closes the loop for routing and rollout evaluation.
 *
 * IMPORTANT: the callback runs after this handler has returned, when the ring buffer slot
 * may already hold another request. Everything it needs is copied out of the event first.
 */
public final class DispatchHandler implements EventHandler<RoutingEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final InferenceBackend backend;
    private final MetricsCollector collector;
    private final MetricsRegistry metricsRegistry;
    private final long requestTimeoutMs;

    public DispatchHandler(
            InferenceBackend backend,
            MetricsCollector collector,
            MetricsRegistry metricsRegistry,
            long requestTimeoutMs
    ) {
        this.backend = backend;
        this.collector = collector;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            completeWithError(event);
            return;
        }

        if (event.getState() != EventState.ROUTED) {
            if (event.getErrorType() == null) {
                event.markFailed(ErrorType.INTERNAL_ERROR, "Invalid state for dispatch: " + event.getState());
            }
            completeWithError(event);
            return;
        }

        dispatch(event);
    }

    private void dispatch(RoutingEvent event) {
        RequestContext request = event.getRequest();
        ModelEndpoint endpoint = event.getSelectedEndpoint();
        CompletableFuture<InferenceResult> future = event.getResultFuture();

        int inFlight = collector.acquire(endpoint.id());
        event.markDispatched();

        log.debug("Dispatching request: requestId={}, model={}, endpointId={}, address={}, inFlight={}/{}",
                request.requestId(), request.model(), endpoint.id(), endpoint.address(),
                inFlight, endpoint.maxConcurrentRequests());

        long startNanos = System.nanoTime();
        CompletableFuture<InferenceResult> call;
        try {
            call = backend.invoke(endpoint, request);
        } catch (Exception e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((result, throwable) ->
                        handleOutcome(request, endpoint, future, result, throwable, startNanos));
    }

    private void handleOutcome(
            RequestContext request,
            ModelEndpoint endpoint,
            CompletableFuture<InferenceResult> future,
            InferenceResult result,
            Throwable throwable,
            long startNanos
    ) {
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        InferenceResult outcome;
        try {
            if (throwable != null) {
                Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause() : throwable;
                ErrorType errorType = classifyError(cause);
                outcome = InferenceResult.error(request.requestId(), request.model(), endpoint.id(),
                        errorType, cause.getMessage()).withLatency(latency);
            } else if (result == null) {
                outcome = InferenceResult.error(request.requestId(), request.model(), endpoint.id(),
                        ErrorType.INTERNAL_ERROR, "Backend returned no result").withLatency(latency);
            } else {
                outcome = result.withLatency(latency);
            }

            collector.record(endpoint.id(), latency.toNanos() / 1_000_000.0, outcome.isSuccess(), outcome.tokens());
            metricsRegistry.recordLatency(request.model(), endpoint.id(), latency);
            metricsRegistry.incrementRequestCount(request.model(), endpoint.id(),
                    outcome.isSuccess() ? EventState.COMPLETED : EventState.FAILED);

            if (outcome.isSuccess()) {
                log.info("Request completed: requestId={}, model={}, endpointId={}, latencyMs={}, tokens={}",
                        request.requestId(), request.model(), endpoint.id(), latency.toMillis(), outcome.tokens());
            } else {
                metricsRegistry.incrementErrorCount(request.model(), endpoint.id(), outcome.errorType());
                log.warn("Request failed: requestId={}, model={}, endpointId={}, errorType={}, error={}, latencyMs={}",
                        request.requestId(), request.model(), endpoint.id(), outcome.errorType(),
                        outcome.errorMessage(), latency.toMillis());
            }
        } finally {
            collector.release(endpoint.id());
        }

        if (future != null) {
            future.complete(outcome);
        }
    }

    private void completeWithError(RoutingEvent event) {
        CompletableFuture<InferenceResult> future = event.getResultFuture();
        if (future == null || future.isDone()) {
            return;
        }

        ErrorType errorType = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
        RequestContext request = event.getRequest();
        String requestId = request != null ? request.requestId() : "unknown";
        String model = request != null ? request.model() : "unknown";
        Duration latency = event.getAcceptedAt() != null
                ? Duration.between(event.getAcceptedAt(), Instant.now())
                : Duration.ZERO;

        InferenceResult result = InferenceResult.error(requestId, model, null, errorType, event.getErrorMessage())
                .withLatency(latency);
        event.setResult(result);

        log.debug("Completing request with pre-dispatch error: requestId={}, model={}, errorType={}, error={}",
                requestId, model, errorType, event.getErrorMessage());

        future.complete(result);
    }

    static ErrorType classifyError(Throwable throwable) {
        if (throwable instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (throwable instanceof java.io.IOException) {
            return ErrorType.ENDPOINT_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }
}
