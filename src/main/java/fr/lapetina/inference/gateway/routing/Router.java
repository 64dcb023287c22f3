package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.batching.BatchExecutionException;
import fr.lapetina.inference.gateway.batching.BatchExecutor;
import fr.lapetina.inference.gateway.batching.BatchQueue;
import fr.lapetina.inference.gateway.batching.InFlightBatches;
import fr.lapetina.inference.gateway.disruptor.IngressPipeline;
import fr.lapetina.inference.gateway.disruptor.exception.BackpressureException;
import fr.lapetina.inference.gateway.domain.model.Batch;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.QueuedRequest;
import fr.lapetina.inference.gateway.domain.model.Runner;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the gateway core.
 *
 * <p>{@link #submit} publishes a request to the ingress ring buffer. Once
 * validated, it is admitted on one of two paths:
 * <ul>
 *   <li>batched: appended to its model's queue, the {@link
 *       fr.lapetina.inference.gateway.batching.BatchDispatcher} resolves it</li>
 *   <li>immediate (streaming requests, or batching disabled): executed right
 *       away on the least-loaded runner serving the model</li>
 * </ul>
 *
 * <p>Every returned future is resolved exactly once with an {@link InferenceResponse};
 * failures are error responses, never exceptional completion.
 */
public final class Router implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    static final String PATH_BATCHED = "batched";
    static final String PATH_IMMEDIATE = "immediate";

    private final RunnerRegistry registry;
    private final BatchQueue batchQueue;
    private final BatchExecutor executor;
    private final InFlightBatches inFlight;
    private final MetricsRegistry metrics;
    private final ModelResolver modelResolver;
    private final boolean batchingEnabled;
    private final Duration executionTimeout;
    private final Clock clock;
    private final IngressPipeline ingress;

    private final Map<String, QueuedRequest> pending = new ConcurrentHashMap<>();

    private Router(Builder builder) {
        this.registry = builder.registry;
        this.batchQueue = builder.batchQueue;
        this.executor = builder.executor;
        this.inFlight = builder.inFlight;
        this.metrics = builder.metrics;
        this.modelResolver = builder.modelResolver != null
                ? builder.modelResolver
                : new ModelResolver(builder.registry, Map.of());
        this.batchingEnabled = builder.batchingEnabled;
        this.executionTimeout = builder.executionTimeout;
        this.clock = builder.clock;
        this.ingress = builder.ingress
                .admission(this::admit)
                .build();

        log.info("Router created: batchingEnabled={}, executionTimeout={}", batchingEnabled, executionTimeout);
    }

    public void start() {
        ingress.start();
    }

    public boolean isRunning() {
        return ingress.isRunning();
    }

    /**
     * Submits a request.
     *
     * @return the caller's result, resolved exactly once
     * @throws BackpressureException if the ingress ring buffer is full
     * @throws IllegalStateException if the router is not started
     */
    public CompletableFuture<InferenceResponse> submit(InferenceRequest request) {
        if (!ingress.isRunning()) {
            throw new IllegalStateException("Router not running");
        }

        Optional<String> resolved = modelResolver.resolve(request.model());
        if (resolved.isEmpty()) {
            log.warn("No model available for class: requestId={}, model={}", request.requestId(), request.model());
            metrics.recordOutcome(request.model(), ErrorType.MODEL_UNAVAILABLE);
            return CompletableFuture.completedFuture(InferenceResponse.error(
                    request.requestId(), request.model(), ErrorType.MODEL_UNAVAILABLE,
                    "No runner serves a model of " + request.model(), request.createdAt()));
        }

        String modelId = resolved.get();
        InferenceRequest effective = modelId.equals(request.model()) ? request : request.withModel(modelId);
        QueuedRequest queued = new QueuedRequest(effective, modelId, clock.instant());

        if (pending.putIfAbsent(queued.requestId(), queued) != null) {
            log.warn("Duplicate request ID rejected: requestId={}", queued.requestId());
            return CompletableFuture.completedFuture(InferenceResponse.error(
                    queued.requestId(), modelId, ErrorType.INVALID_REQUEST,
                    "Request ID already in progress: " + queued.requestId(), request.createdAt()));
        }

        try {
            ingress.publish(queued);
        } catch (RuntimeException e) {
            pending.remove(queued.requestId(), queued);
            throw e;
        }

        CompletableFuture<InferenceResponse> result = queued.result();
        result.whenComplete((response, error) -> onResolved(queued, response, error));
        return result;
    }

    private void onResolved(QueuedRequest queued, InferenceResponse response, Throwable error) {
        pending.remove(queued.requestId(), queued);
        if (error != null) {
            // The caller cancelled the future itself
            if (error instanceof CancellationException) {
                queued.markCancelled();
                batchQueue.remove(queued.requestId());
                queued.cancelExecution();
            }
            metrics.recordOutcome(queued.modelId(), ErrorType.CANCELLED);
            return;
        }
        metrics.recordOutcome(queued.modelId(), response.errorType());
        metrics.recordLatency(queued.modelId(), queued.age(clock.instant()));
        if (response.isError()) {
            log.debug("Request failed: requestId={}, model={}, errorType={}, message={}",
                    queued.requestId(), queued.modelId(), response.errorType(), response.errorMessage());
        }
    }

    /**
     * Admission callback of the ingress pipeline, run on its handler thread.
     */
    void admit(QueuedRequest queued) {
        if (queued.isCancelled() || queued.isResolved()) {
            return;
        }
        if (queued.request().stream() || !batchingEnabled) {
            metrics.incrementRequestCount(queued.modelId(), PATH_IMMEDIATE);
            dispatchImmediately(queued);
        } else {
            metrics.incrementRequestCount(queued.modelId(), PATH_BATCHED);
            batchQueue.enqueue(queued);
        }
    }

    private void dispatchImmediately(QueuedRequest queued) {
        String modelId = queued.modelId();
        List<RunnerSnapshot> candidates = registry.candidatesFor(modelId);
        if (candidates.isEmpty()) {
            queued.fail(ErrorType.MODEL_UNAVAILABLE, "No runner serves model " + modelId);
            log.warn("No runner for immediate request: requestId={}, model={}", queued.requestId(), modelId);
            return;
        }

        RunnerSnapshot runner = candidates.get(0);
        Batch batch = new Batch(modelId, List.of(queued), runner, clock.instant());
        inFlight.track(batch);
        Optional<Runner> acquired = registry.acquire(runner.id());
        if (acquired.isEmpty()) {
            inFlight.fail(batch, ErrorType.RUNNER_LOST, "Runner lost before dispatch: " + runner.id());
            return;
        }

        log.debug("Immediate dispatch: requestId={}, model={}, runnerId={}, stream={}",
                queued.requestId(), modelId, runner.id(), queued.request().stream());

        CompletableFuture<InferenceResponse> call;
        try {
            call = executor.execute(runner, runner.localModelName(modelId), queued.request());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        queued.attachExecution(call);
        call.orTimeout(executionTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, error) -> {
                    registry.release(acquired.get());
                    if (!inFlight.settle(batch)) {
                        return;
                    }
                    if (error != null) {
                        ErrorType type = BatchExecutionException.classify(error);
                        batch.failAll(type, BatchExecutionException.describe(error));
                        log.warn("Immediate request failed: requestId={}, runnerId={}, errorType={}",
                                queued.requestId(), runner.id(), type);
                    } else {
                        batch.completeAll(List.of(response));
                    }
                });
    }

    /**
     * Cancels a request, best effort.
     *
     * A request still queued is withdrawn and an immediate call is aborted. A
     * request already in a dispatched batch is computed anyway; its result is
     * discarded. The caller is resolved with CANCELLED.
     *
     * @return false if the request is unknown or already resolved
     */
    public boolean cancel(String requestId) {
        QueuedRequest queued = pending.get(requestId);
        if (queued == null || queued.isResolved()) {
            return false;
        }
        queued.markCancelled();
        boolean dequeued = batchQueue.remove(requestId).isPresent();
        boolean resolved = queued.fail(ErrorType.CANCELLED, "Request cancelled");
        queued.cancelExecution();
        if (resolved) {
            log.info("Request cancelled: requestId={}, model={}, dequeued={}", requestId, queued.modelId(), dequeued);
        }
        return resolved;
    }

    public List<RunnerSnapshot> listRunners() {
        return registry.listRunners();
    }

    public Set<String> listModels() {
        return registry.listModels();
    }

    public Map<String, Integer> queueDepths() {
        return batchQueue.queueDepths();
    }

    /**
     * Requests submitted and not yet resolved, on any path.
     */
    public int pendingCount() {
        return pending.size();
    }

    public long getRemainingCapacity() {
        return ingress.getRemainingCapacity();
    }

    @Override
    public void close() {
        ingress.close();
        log.info("Router closed: pending={}", pending.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Router.
     */
    public static final class Builder {
        private RunnerRegistry registry;
        private BatchQueue batchQueue;
        private BatchExecutor executor;
        private InFlightBatches inFlight;
        private MetricsRegistry metrics;
        private ModelResolver modelResolver;
        private boolean batchingEnabled = true;
        private Duration executionTimeout = Duration.ofMinutes(5);
        private Clock clock = Clock.systemUTC();
        private final IngressPipeline.Builder ingress = IngressPipeline.builder();

        public Builder registry(RunnerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder batchQueue(BatchQueue batchQueue) {
            this.batchQueue = batchQueue;
            return this;
        }

        public Builder executor(BatchExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder inFlight(InFlightBatches inFlight) {
            this.inFlight = inFlight;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder modelResolver(ModelResolver modelResolver) {
            this.modelResolver = modelResolver;
            return this;
        }

        public Builder batchingEnabled(boolean enabled) {
            this.batchingEnabled = enabled;
            return this;
        }

        public Builder executionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder ringBufferSize(int size) {
            ingress.ringBufferSize(size);
            return this;
        }

        public Builder waitStrategy(String strategy) {
            ingress.waitStrategy(strategy);
            return this;
        }

        public Builder allowedModels(Set<String> models) {
            ingress.allowedModels(models);
            return this;
        }

        public Builder maxMessageLength(int maxLength) {
            ingress.maxMessageLength(maxLength);
            return this;
        }

        public Builder maxMessages(int maxMessages) {
            ingress.maxMessages(maxMessages);
            return this;
        }

        public Builder fromConfig(GatewayConfig config) {
            ingress.fromConfig(config);
            this.batchingEnabled = config.getBatching().isEnabled();
            this.executionTimeout = config.getTimeouts().getExecutionTimeout();
            return this;
        }

        public Router build() {
            if (registry == null) {
                throw new IllegalStateException("RunnerRegistry is required");
            }
            if (batchQueue == null) {
                throw new IllegalStateException("BatchQueue is required");
            }
            if (executor == null) {
                throw new IllegalStateException("BatchExecutor is required");
            }
            if (inFlight == null) {
                throw new IllegalStateException("InFlightBatches is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new Router(this);
        }
    }
}
