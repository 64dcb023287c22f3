package fr.lapetina.inference.gateway.domain.event;

/**
 * Lifecycle state of an ingress event in the Disruptor ring buffer.
 */
public enum EventState {
    /** Event published, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed, the request is resolved with INVALID_REQUEST */
    VALIDATION_FAILED,

    /** Request handed to the router (queued or executing) */
    ADMITTED,

    /** Request cancelled before admission */
    CANCELLED
}
