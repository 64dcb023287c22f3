package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.Batch;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.QueuedRequest;
import fr.lapetina.inference.gateway.domain.model.Runner;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls ready batches from the {@link BatchQueue} and executes them on runners.
 *
 * A single {@code batch-dispatcher} thread runs a cycle on every tick and on
 * every wake signal from the queue. A cycle that dispatched anything is
 * repeated straight away. Executions are asynchronous, so a slow runner for
 * one model never holds up another model. Nothing is retried.
 */
public final class BatchDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final BatchQueue batchQueue;
    private final RunnerRegistry registry;
    private final BatchExecutor executor;
    private final InFlightBatches inFlight;
    private final MetricsRegistry metrics;
    private final Duration tickInterval;
    private final Duration noRunnerTimeout;
    private final Duration executionTimeout;
    private final Clock clock;

    private final Semaphore wakeSignal = new Semaphore(0);
    private final BatchQueue.WakeListener wakeListener = this::onEnqueued;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread worker;

    private BatchDispatcher(Builder builder) {
        this.batchQueue = builder.batchQueue;
        this.registry = builder.registry;
        this.executor = builder.executor;
        this.inFlight = builder.inFlight;
        this.metrics = builder.metrics;
        this.tickInterval = builder.tickInterval;
        this.noRunnerTimeout = builder.noRunnerTimeout;
        this.executionTimeout = builder.executionTimeout;
        this.clock = builder.clock;
    }

    /**
     * Starts the dispatcher thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            batchQueue.addWakeListener(wakeListener);
            Thread thread = new Thread(this::runLoop, "batch-dispatcher");
            thread.setDaemon(true);
            worker = thread;
            thread.start();
            log.info("BatchDispatcher started: tickInterval={}, noRunnerTimeout={}, executionTimeout={}",
                    tickInterval, noRunnerTimeout, executionTimeout);
        }
    }

    /**
     * Requests a cycle without waiting for the next tick.
     */
    public void wake() {
        wakeSignal.release();
    }

    private void onEnqueued(String modelId, int queueLength) {
        if (shouldWake(modelId, queueLength)) {
            wake();
        }
    }

    /**
     * Whether a queue of this length is size-ready, i.e. holds
     * {@code min(minBatchSize, maxBatchSize)} requests for the best runner.
     */
    boolean shouldWake(String modelId, int queueLength) {
        if (queueLength >= batchQueue.getMinBatchSize()) {
            return true;
        }
        OptionalInt capacity = registry.batchCapacity(modelId);
        return capacity.isPresent() && queueLength >= capacity.getAsInt();
    }

    private void runLoop() {
        while (running.get()) {
            try {
                wakeSignal.tryAcquire(tickInterval.toMillis(), TimeUnit.MILLISECONDS);
                wakeSignal.drainPermits();
                while (running.get() && dispatchCycle() > 0) {
                    // Drain queues left above their threshold
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Dispatch cycle failed", e);
            }
        }
        log.debug("Dispatcher loop exited");
    }

    /**
     * Runs one dispatch cycle over every ready model.
     *
     * @return number of batches dispatched
     */
    public synchronized int dispatchCycle() {
        Set<String> ready = batchQueue.readyModels(registry::batchCapacity);
        int dispatched = 0;
        for (String modelId : ready) {
            List<RunnerSnapshot> candidates = registry.candidatesFor(modelId);
            if (candidates.isEmpty()) {
                expireUnserved(modelId);
                continue;
            }
            if (dispatch(modelId, candidates.get(0))) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private void expireUnserved(String modelId) {
        List<QueuedRequest> expired = batchQueue.expire(modelId, noRunnerTimeout);
        if (expired.isEmpty()) {
            return;
        }
        String message = "No runner available for model " + modelId
                + " within " + noRunnerTimeout.toMillis() + "ms";
        for (QueuedRequest request : expired) {
            request.fail(ErrorType.QUEUE_TIMEOUT, message);
        }
        log.warn("Requests expired without runner: model={}, count={}, timeoutMs={}",
                modelId, expired.size(), noRunnerTimeout.toMillis());
    }

    private boolean dispatch(String modelId, RunnerSnapshot runner) {
        List<QueuedRequest> requests = batchQueue.takeBatch(modelId, runner.maxBatchSize(modelId));
        if (requests.isEmpty()) {
            return false;
        }

        Instant now = clock.instant();
        Batch batch = new Batch(modelId, requests, runner, now);
        inFlight.track(batch);
        Optional<Runner> acquired = registry.acquire(runner.id());
        if (acquired.isEmpty()) {
            inFlight.fail(batch, ErrorType.RUNNER_LOST, "Runner lost before dispatch: " + runner.id());
            metrics.recordBatchFailure(modelId, runner.id(), ErrorType.RUNNER_LOST);
            log.warn("Runner gone before dispatch: batchId={}, runnerId={}, model={}",
                    batch.batchId(), runner.id(), modelId);
            return true;
        }

        metrics.recordBatch(modelId, runner.id(), batch.size());
        for (QueuedRequest request : requests) {
            metrics.recordQueueWait(modelId, request.age(now));
        }
        log.debug("Batch dispatched: batchId={}, model={}, runnerId={}, size={}",
                batch.batchId(), modelId, runner.id(), batch.size());

        CompletableFuture<List<InferenceResponse>> call;
        try {
            call = executor.executeBatch(runner, runner.localModelName(modelId), batch.payloads());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.orTimeout(executionTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((results, error) -> onBatchComplete(batch, acquired.get(), results, error));
        return true;
    }

    private void onBatchComplete(Batch batch, Runner acquired, List<InferenceResponse> results, Throwable error) {
        String runnerId = batch.runner().id();
        registry.release(acquired);
        if (!inFlight.settle(batch)) {
            log.debug("Batch already settled: batchId={}, runnerId={}", batch.batchId(), runnerId);
            return;
        }

        if (error != null) {
            ErrorType type = BatchExecutionException.classify(error);
            String message = BatchExecutionException.describe(error);
            int resolved = batch.failAll(type, message);
            metrics.recordBatchFailure(batch.modelId(), runnerId, type);
            log.warn("Batch failed: batchId={}, model={}, runnerId={}, size={}, errorType={}, resolved={}, reason={}",
                    batch.batchId(), batch.modelId(), runnerId, batch.size(), type, resolved, message);
            return;
        }

        if (results == null || results.size() != batch.size()) {
            int received = results == null ? 0 : results.size();
            batch.failAll(ErrorType.EXECUTION_FAILED,
                    "Runner returned " + received + " results for a batch of " + batch.size());
            metrics.recordBatchFailure(batch.modelId(), runnerId, ErrorType.EXECUTION_FAILED);
            log.warn("Batch result count mismatch: batchId={}, runnerId={}, expected={}, received={}",
                    batch.batchId(), runnerId, batch.size(), received);
            return;
        }

        int resolved = batch.completeAll(results);
        log.debug("Batch completed: batchId={}, model={}, runnerId={}, size={}, resolved={}",
                batch.batchId(), batch.modelId(), runnerId, batch.size(), resolved);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            batchQueue.removeWakeListener(wakeListener);
            wakeSignal.release();
            Thread thread = worker;
            if (thread != null) {
                try {
                    thread.join(TimeUnit.SECONDS.toMillis(5));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            log.info("BatchDispatcher stopped");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for BatchDispatcher.
     */
    public static final class Builder {
        private BatchQueue batchQueue;
        private RunnerRegistry registry;
        private BatchExecutor executor;
        private InFlightBatches inFlight;
        private MetricsRegistry metrics;
        private Duration tickInterval = Duration.ofMillis(10);
        private Duration noRunnerTimeout = Duration.ofSeconds(30);
        private Duration executionTimeout = Duration.ofMinutes(5);
        private Clock clock = Clock.systemUTC();

        public Builder batchQueue(BatchQueue batchQueue) {
            this.batchQueue = batchQueue;
            return this;
        }

        public Builder registry(RunnerRegistry registry) {
            this.registry = registry;
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

        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder noRunnerTimeout(Duration noRunnerTimeout) {
            this.noRunnerTimeout = noRunnerTimeout;
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

        public BatchDispatcher build() {
            if (batchQueue == null) {
                throw new IllegalStateException("BatchQueue is required");
            }
            if (registry == null) {
                throw new IllegalStateException("RunnerRegistry is required");
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
            if (tickInterval.isNegative() || tickInterval.isZero()) {
                throw new IllegalArgumentException("Tick interval must be positive");
            }
            return new BatchDispatcher(this);
        }
    }
}
