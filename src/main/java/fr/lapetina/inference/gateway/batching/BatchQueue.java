package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.QueuedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Pending requests, one {@link ModelQueue} per model.
 *
 * Queues are created lazily on first enqueue and never removed. Readiness:
 * a non-empty queue is ready when its length reaches
 * {@code min(minBatchSize, maxBatchSize)}, when its oldest request has waited
 * {@code batchTimeout}, or when no live runner serves the model (so the
 * dispatcher can apply the no-runner timeout).
 */
public final class BatchQueue {

    private static final Logger log = LoggerFactory.getLogger(BatchQueue.class);

    private final Map<String, ModelQueue> queues = new ConcurrentHashMap<>();
    private final Map<String, QueuedRequest> byRequestId = new ConcurrentHashMap<>();
    private final List<WakeListener> wakeListeners = new CopyOnWriteArrayList<>();
    private final Duration batchTimeout;
    private final int minBatchSize;
    private final Clock clock;

    public BatchQueue(Duration batchTimeout, int minBatchSize, Clock clock) {
        if (batchTimeout.isNegative()) {
            throw new IllegalArgumentException("Batch timeout must not be negative");
        }
        if (minBatchSize < 1) {
            throw new IllegalArgumentException("minBatchSize must be >= 1, got " + minBatchSize);
        }
        this.batchTimeout = batchTimeout;
        this.minBatchSize = minBatchSize;
        this.clock = clock;
    }

    public BatchQueue(Duration batchTimeout, int minBatchSize) {
        this(batchTimeout, minBatchSize, Clock.systemUTC());
    }

    /**
     * Appends the request to its model's queue.
     *
     * @return the request's result sink
     * @throws IllegalArgumentException if a request with the same ID is already queued
     */
    public CompletableFuture<InferenceResponse> enqueue(QueuedRequest request) {
        QueuedRequest existing = byRequestId.putIfAbsent(request.requestId(), request);
        if (existing != null) {
            if (!existing.isResolved() || !byRequestId.replace(request.requestId(), existing, request)) {
                throw new IllegalArgumentException("Request already queued: " + request.requestId());
            }
        }
        ModelQueue queue = queues.computeIfAbsent(request.modelId(), ModelQueue::new);
        int length = queue.offer(request);

        log.debug("Request enqueued: requestId={}, model={}, queueLength={}",
                request.requestId(), request.modelId(), length);

        notifyWakeListeners(request.modelId(), length);
        return request.result();
    }

    /**
     * Models that should be dispatched now. Performs no mutation.
     *
     * @param capacityLookup maxBatchSize of the runner that would take the batch,
     *                       empty when no live runner serves the model
     */
    public Set<String> readyModels(Function<String, OptionalInt> capacityLookup) {
        Instant now = clock.instant();
        Set<String> ready = new LinkedHashSet<>();
        for (ModelQueue queue : queues.values()) {
            int length = queue.size();
            if (length == 0) {
                continue;
            }
            OptionalInt capacity = capacityLookup.apply(queue.getModelId());
            if (capacity.isEmpty()) {
                ready.add(queue.getModelId());
                continue;
            }
            int threshold = Math.min(minBatchSize, capacity.getAsInt());
            boolean timedOut = queue.oldestAge(now)
                    .map(age -> age.compareTo(batchTimeout) >= 0)
                    .orElse(false);
            if (length >= threshold || timedOut) {
                ready.add(queue.getModelId());
            }
        }
        return ready;
    }

    /**
     * Removes up to {@code maxSize} requests from the front of the model's queue.
     *
     * @return the taken requests in enqueue order, empty if nothing was pending
     */
    public List<QueuedRequest> takeBatch(String modelId, int maxSize) {
        ModelQueue queue = queues.get(modelId);
        if (queue == null) {
            return List.of();
        }
        List<QueuedRequest> taken = queue.poll(maxSize,
                dropped -> byRequestId.remove(dropped.requestId(), dropped));
        for (QueuedRequest request : taken) {
            byRequestId.remove(request.requestId(), request);
        }
        if (!taken.isEmpty()) {
            log.debug("Batch taken: model={}, size={}, remaining={}", modelId, taken.size(), queue.size());
        }
        return taken;
    }

    /**
     * Withdraws a still-pending request. No effect once the request was taken into a batch.
     */
    public Optional<QueuedRequest> remove(String requestId) {
        QueuedRequest request = byRequestId.get(requestId);
        if (request == null) {
            return Optional.empty();
        }
        ModelQueue queue = queues.get(request.modelId());
        if (queue == null || !queue.remove(request)) {
            return Optional.empty();
        }
        byRequestId.remove(requestId, request);
        log.debug("Request removed from queue: requestId={}, model={}", requestId, request.modelId());
        return Optional.of(request);
    }

    /**
     * Removes the requests of a model that have waited longer than {@code maxAge}.
     */
    public List<QueuedRequest> expire(String modelId, Duration maxAge) {
        ModelQueue queue = queues.get(modelId);
        if (queue == null) {
            return List.of();
        }
        List<QueuedRequest> expired = queue.pollEnqueuedBefore(clock.instant().minus(maxAge));
        for (QueuedRequest request : expired) {
            byRequestId.remove(request.requestId(), request);
        }
        return expired;
    }

    /**
     * Pending request count per model, including models whose queue is empty.
     */
    public Map<String, Integer> queueDepths() {
        Map<String, Integer> depths = new TreeMap<>();
        for (ModelQueue queue : queues.values()) {
            depths.put(queue.getModelId(), queue.size());
        }
        return depths;
    }

    public int pendingCount() {
        int total = 0;
        for (ModelQueue queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }

    public Optional<Duration> oldestAge(String modelId) {
        ModelQueue queue = queues.get(modelId);
        return queue == null ? Optional.empty() : queue.oldestAge(clock.instant());
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public int getMinBatchSize() {
        return minBatchSize;
    }

    /**
     * Adds a listener told about every enqueue, with the queue length after it.
     * Runs on the enqueuing thread and must not block.
     */
    public void addWakeListener(WakeListener listener) {
        wakeListeners.add(listener);
    }

    public void removeWakeListener(WakeListener listener) {
        wakeListeners.remove(listener);
    }

    private void notifyWakeListeners(String modelId, int length) {
        for (WakeListener listener : wakeListeners) {
            try {
                listener.onEnqueued(modelId, length);
            } catch (Exception e) {
                log.error("Error notifying wake listener", e);
            }
        }
    }

    /**
     * Observer of queue growth, used to dispatch a full batch before the next tick.
     */
    @FunctionalInterface
    public interface WakeListener {
        void onEnqueued(String modelId, int queueLength);
    }
}
