package fr.lapetina.inference.gateway.domain.model;

/**
 * Error taxonomy for gateway requests.
 * Every failed request is resolved with exactly one of these kinds.
 */
public enum ErrorType {
    /** No live runner serves the requested model (or model class) */
    MODEL_UNAVAILABLE(false),

    /** The runner executing the request disconnected before answering */
    RUNNER_LOST(true),

    /** The runner answered with an engine-level error, or the call timed out */
    EXECUTION_FAILED(false),

    /** The request waited past the no-runner timeout without a runner showing up */
    QUEUE_TIMEOUT(false),

    /** The caller withdrew the request before it was resolved */
    CANCELLED(false),

    /** Request rejected by validation */
    INVALID_REQUEST(false),

    /** Unexpected gateway failure */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the caller may resubmit the same request unchanged.
     * The gateway itself never retries.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
