package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A size-bounded prefix of one model's queue, assigned to a runner.
 * Lives for a single dispatch; equality is identity.
 */
public final class Batch {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long batchId;
    private final String modelId;
    private final List<QueuedRequest> requests;
    private final RunnerSnapshot runner;
    private final Instant dispatchedAt;

    public Batch(String modelId, List<QueuedRequest> requests, RunnerSnapshot runner, Instant dispatchedAt) {
        this.modelId = Objects.requireNonNull(modelId, "Model ID is required");
        this.requests = List.copyOf(requests);
        this.runner = Objects.requireNonNull(runner, "Runner is required");
        this.dispatchedAt = Objects.requireNonNull(dispatchedAt, "Dispatch time is required");
        if (this.requests.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one request");
        }
        for (QueuedRequest request : this.requests) {
            if (!modelId.equals(request.modelId())) {
                throw new IllegalArgumentException(
                        "Request " + request.requestId() + " targets " + request.modelId() + ", not " + modelId);
            }
        }
        if (!runner.serves(modelId)) {
            throw new IllegalArgumentException("Runner " + runner.id() + " does not serve " + modelId);
        }
        if (this.requests.size() > runner.maxBatchSize(modelId)) {
            throw new IllegalArgumentException("Batch of " + this.requests.size()
                    + " exceeds maxBatchSize " + runner.maxBatchSize(modelId) + " of runner " + runner.id());
        }
        this.batchId = SEQUENCE.incrementAndGet();
    }

    public long batchId() {
        return batchId;
    }

    public String modelId() {
        return modelId;
    }

    public List<QueuedRequest> requests() {
        return requests;
    }

    public RunnerSnapshot runner() {
        return runner;
    }

    public Instant dispatchedAt() {
        return dispatchedAt;
    }

    public int size() {
        return requests.size();
    }

    public List<InferenceRequest> payloads() {
        return requests.stream().map(QueuedRequest::request).toList();
    }

    /**
     * Resolves each member with the result at the same position.
     *
     * @return number of members this call resolved
     */
    public int completeAll(List<InferenceResponse> results) {
        if (results.size() != requests.size()) {
            throw new IllegalArgumentException(
                    "Expected " + requests.size() + " results, got " + results.size());
        }
        int resolved = 0;
        for (int i = 0; i < requests.size(); i++) {
            if (requests.get(i).resolve(results.get(i))) {
                resolved++;
            }
        }
        return resolved;
    }

    /**
     * Resolves every member with the same error.
     *
     * @return number of members this call resolved
     */
    public int failAll(ErrorType errorType, String message) {
        int resolved = 0;
        for (QueuedRequest request : requests) {
            if (request.fail(errorType, message)) {
                resolved++;
            }
        }
        return resolved;
    }

    @Override
    public String toString() {
        return "Batch{" +
                "batchId=" + batchId +
                ", model=" + modelId +
                ", size=" + requests.size() +
                ", runner=" + runner.id() +
                '}';
    }
}
