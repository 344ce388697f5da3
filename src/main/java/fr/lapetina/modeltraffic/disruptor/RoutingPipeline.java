package fr.lapetina.modeltraffic.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.modeltraffic.disruptor.exception.BackpressureException;
import fr.lapetina.modeltraffic.disruptor.handlers.CompletionHandler;
import fr.lapetina.modeltraffic.disruptor.handlers.DispatchHandler;
import fr.lapetina.modeltraffic.disruptor.handlers.MetricsHandler;
import fr.lapetina.modeltraffic.disruptor.handlers.RouteSelectionHandler;
import fr.lapetina.modeltraffic.domain.event.RoutingEvent;
import fr.lapetina.modeltraffic.domain.event.RoutingEventFactory;
import fr.lapetina.modeltraffic.domain.model.InferenceResult;
import fr.lapetina.modeltraffic.domain.model.RequestContext;
import fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsCollector;
import fr.lapetina.modeltraffic.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modeltraffic.routing.Router;
import fr.lapetina.modeltraffic.spi.InferenceBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline carrying requests from submission to the selected endpoint.
 *
 * Stages: route selection -> dispatch -> metrics -> completion.
 *
 * Requests come from many threads, so the ring buffer uses a MULTI producer. A full ring buffer
 * or a saturated in-flight budget is reported immediately as a {@link BackpressureException}
 * rather than blocking the caller.
 *
 * Completed requests feed the {@link MetricsCollector}, which in turn drives the latency and
 * load terms of the routing strategies and the rollout evaluations.
 */
public final class RoutingPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoutingPipeline.class);

    private final Disruptor<RoutingEvent> disruptor;
    private final RingBuffer<RoutingEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final MetricsCollector collector;
    private final MetricsRegistry metricsRegistry;
    private final int maxGlobalInFlight;

    private RoutingPipeline(Builder builder) {
        this.collector = builder.collector;
        this.metricsRegistry = builder.metricsRegistry;
        this.maxGlobalInFlight = builder.maxGlobalInFlight;

        this.disruptor = new Disruptor<>(
                new RoutingEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("routing-pipeline"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor
                .handleEventsWith(new RouteSelectionHandler(builder.router, builder.metricsRegistry))
                .then(new DispatchHandler(builder.backend, builder.collector, builder.metricsRegistry,
                        builder.requestTimeoutMs))
                .then(new MetricsHandler(builder.metricsRegistry, builder.collector))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("RoutingPipeline created: ringBufferSize={}, waitStrategy={}, maxGlobalInFlight={}",
                builder.ringBufferSize, builder.waitStrategy, builder.maxGlobalInFlight);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("RoutingPipeline started");
        }
    }

    /**
     * Submits a request for routing and dispatch.
     *
     * @return future completing with the result; routing failures complete it with an error result
     * @throws BackpressureException if the ring buffer is full or the in-flight budget is spent
     */
    public CompletableFuture<InferenceResult> submit(RequestContext request) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Pipeline not running"));
        }

        int inFlight = collector.getTotalInFlight();
        if (inFlight >= maxGlobalInFlight) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.GLOBAL_LIMIT_REACHED,
                    "inFlight=" + inFlight + ", max=" + maxGlobalInFlight
            );
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        CompletableFuture<InferenceResult> resultFuture = new CompletableFuture<>();
        try {
            RoutingEvent event = ringBuffer.get(sequence);
            event.initialize(request, resultFuture);
            event.setSequence(sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Request submitted: requestId={}, model={}, sequence={}",
                request.requestId(), request.model(), sequence);

        return resultFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down RoutingPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("RoutingPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("RoutingPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using YieldingWaitStrategy", name);
                yield new YieldingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class PipelineExceptionHandler implements com.lmax.disruptor.ExceptionHandler<RoutingEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, RoutingEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getResultFuture() != null && !event.getResultFuture().isDone()) {
                event.getResultFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during pipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "yielding";
        private int maxGlobalInFlight = 1000;
        private long requestTimeoutMs = 60_000;
        private Router router;
        private InferenceBackend backend;
        private MetricsCollector collector;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxGlobalInFlight(int max) {
            this.maxGlobalInFlight = max;
            return this;
        }

        public Builder requestTimeoutMs(long timeoutMs) {
            this.requestTimeoutMs = timeoutMs;
            return this;
        }

        public Builder router(Router router) {
            this.router = router;
            return this;
        }

        public Builder backend(InferenceBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder collector(MetricsCollector collector) {
            this.collector = collector;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(ControllerConfig.PipelineConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            this.maxGlobalInFlight = config.getMaxGlobalInFlight();
            this.requestTimeoutMs = config.getRequestTimeoutMs();
            return this;
        }

        public RoutingPipeline build() {
            if (router == null) {
                throw new IllegalStateException("Router is required");
            }
            if (backend == null) {
                throw new IllegalStateException("InferenceBackend is required");
            }
            if (collector == null) {
                throw new IllegalStateException("MetricsCollector is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new RoutingPipeline(this);
        }
    }
}
