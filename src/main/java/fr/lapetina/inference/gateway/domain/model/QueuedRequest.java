package fr.lapetina.inference.gateway.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One caller's unit of work, from admission until its single resolution.
 *
 * <p>The result sink can be resolved at most once; {@link #resolve} and {@link #fail}
 * report whether the call was the one that resolved it, later results are dropped.
 */
public final class QueuedRequest {

    private final InferenceRequest request;
    private final String modelId;
    private final Instant enqueuedAt;
    private final CompletableFuture<InferenceResponse> sink = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<Future<?>> execution = new AtomicReference<>();

    public QueuedRequest(InferenceRequest request, String modelId, Instant enqueuedAt) {
        this.request = Objects.requireNonNull(request, "Request is required");
        this.modelId = Objects.requireNonNull(modelId, "Model ID is required");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "Enqueue time is required");
    }

    public static QueuedRequest of(InferenceRequest request, Instant enqueuedAt) {
        return new QueuedRequest(request, request.model(), enqueuedAt);
    }

    public String requestId() {
        return request.requestId();
    }

    public String modelId() {
        return modelId;
    }

    public InferenceRequest request() {
        return request;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public Duration age(Instant now) {
        return Duration.between(enqueuedAt, now);
    }

    public CompletableFuture<InferenceResponse> result() {
        return sink;
    }

    public boolean resolve(InferenceResponse response) {
        return sink.complete(response);
    }

    public boolean fail(ErrorType errorType, String message) {
        return resolve(InferenceResponse.error(
                request.requestId(), modelId, errorType, message, request.createdAt()
        ));
    }

    public boolean isResolved() {
        return sink.isDone();
    }

    /**
     * @return true if this call flipped the flag
     */
    public boolean markCancelled() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Attaches the in-progress runner call of the immediate path.
     * A request already cancelled aborts the call right away.
     */
    public void attachExecution(Future<?> call) {
        execution.set(call);
        if (cancelled.get()) {
            call.cancel(true);
        }
    }

    public boolean cancelExecution() {
        Future<?> call = execution.get();
        return call != null && call.cancel(true);
    }

    @Override
    public String toString() {
        return "QueuedRequest{" +
                "requestId=" + request.requestId() +
                ", model=" + modelId +
                ", enqueuedAt=" + enqueuedAt +
                ", resolved=" + sink.isDone() +
                ", cancelled=" + cancelled.get() +
                '}';
    }
}
