package fr.lapetina.inference.gateway.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.inference.gateway.disruptor.exception.BackpressureException;
import fr.lapetina.inference.gateway.disruptor.handlers.AdmissionHandler;
import fr.lapetina.inference.gateway.disruptor.handlers.ValidationHandler;
import fr.lapetina.inference.gateway.domain.event.IngressEvent;
import fr.lapetina.inference.gateway.domain.event.IngressEventFactory;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.QueuedRequest;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Ingress ring buffer in front of the router.
 *
 * HTTP handler threads publish concurrently (MULTI producer). Events go
 * through validation, then admission, which hands the request to the router.
 * A full ring buffer is reported to the publisher as a
 * {@link BackpressureException} instead of blocking it.
 *
 * WAIT STRATEGY: configurable. "blocking" suits shared hosts, "yielding" and
 * "busy-spin" trade CPU for latency.
 */
public final class IngressPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IngressPipeline.class);

    private final Disruptor<IngressEvent> disruptor;
    private final RingBuffer<IngressEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ValidationHandler validationHandler;
    private final AdmissionHandler admissionHandler;

    private IngressPipeline(Builder builder) {
        ThreadFactory threadFactory = new DisruptorThreadFactory("ingress-handler");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new IngressEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        this.validationHandler = new ValidationHandler(
                builder.allowedModels, builder.maxMessageLength, builder.maxMessages);
        this.admissionHandler = new AdmissionHandler(builder.admission);

        // Order: Validation -> Admission
        disruptor
                .handleEventsWith(validationHandler)
                .then(admissionHandler);

        disruptor.setDefaultExceptionHandler(new IngressExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("IngressPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("IngressPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes a request for validation and admission.
     *
     * @throws BackpressureException if the ring buffer is full
     * @throws IllegalStateException if the pipeline is not running
     */
    public void publish(QueuedRequest queued) {
        if (!running.get()) {
            throw new IllegalStateException("Ingress pipeline not running");
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            IngressEvent event = ringBuffer.get(sequence);
            event.initialize(queued, Instant.now());
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request published: requestId={}, sequence={}", queued.requestId(), sequence);
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public ValidationHandler getValidationHandler() {
        return validationHandler;
    }

    /**
     * Drains published events and stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down IngressPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("IngressPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("IngressPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Resolves the event's request with INTERNAL_ERROR when a handler throws.
     */
    private static class IngressExceptionHandler implements ExceptionHandler<IngressEvent> {

        private static final Logger log = LoggerFactory.getLogger(IngressExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, IngressEvent event) {
            log.error("Exception in ingress handler: sequence={}, event={}", sequence, event, ex);

            QueuedRequest queued = event.getQueued();
            if (queued != null) {
                queued.fail(ErrorType.INTERNAL_ERROR, "Internal error: " + ex.getMessage());
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for IngressPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxMessageLength = 100_000;
        private int maxMessages = 256;
        private Set<String> allowedModels = Set.of();
        private Consumer<QueuedRequest> admission;

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

        public Builder maxMessageLength(int maxLength) {
            this.maxMessageLength = maxLength;
            return this;
        }

        public Builder maxMessages(int maxMessages) {
            this.maxMessages = maxMessages;
            return this;
        }

        public Builder allowedModels(Set<String> models) {
            this.allowedModels = models;
            return this;
        }

        /**
         * Callback receiving each validated request, on the handler thread.
         */
        public Builder admission(Consumer<QueuedRequest> admission) {
            this.admission = admission;
            return this;
        }

        public Builder fromConfig(GatewayConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.maxMessageLength = config.getValidation().getMaxMessageLength();
            this.maxMessages = config.getValidation().getMaxMessages();
            this.allowedModels = config.getValidation().getAllowedModels();
            return this;
        }

        public IngressPipeline build() {
            if (admission == null) {
                throw new IllegalStateException("Admission callback is required");
            }
            return new IngressPipeline(this);
        }
    }
}
