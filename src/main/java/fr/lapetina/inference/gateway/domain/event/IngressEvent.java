package fr.lapetina.inference.gateway.domain.event;

import fr.lapetina.inference.gateway.domain.model.QueuedRequest;

import java.time.Instant;

/**
 * Ring buffer slot carrying one submitted request through validation and admission.
 *
 * Mutable and reused across the ring buffer; never accessed outside the
 * Disruptor handlers.
 */
public final class IngressEvent {

    private QueuedRequest queued;
    private EventState state;
    private String errorMessage;
    private Instant publishedAt;
    private Instant validatedAt;
    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.queued = null;
        this.state = null;
        this.errorMessage = null;
        this.publishedAt = null;
        this.validatedAt = null;
        this.sequence = -1;
    }

    public void initialize(QueuedRequest queued, Instant publishedAt) {
        clear();
        this.queued = queued;
        this.state = EventState.CREATED;
        this.publishedAt = publishedAt;
    }

    public QueuedRequest getQueued() {
        return queued;
    }

    public EventState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markValidationFailed(String message) {
        this.state = EventState.VALIDATION_FAILED;
        this.errorMessage = message;
    }

    public void markAdmitted() {
        this.state = EventState.ADMITTED;
    }

    public void markCancelled() {
        this.state = EventState.CANCELLED;
    }

    /**
     * Checks if remaining handlers should leave the event alone.
     */
    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED
            || state == EventState.ADMITTED
            || state == EventState.CANCELLED;
    }

    @Override
    public String toString() {
        return "IngressEvent{" +
                "requestId=" + (queued != null ? queued.requestId() : "null") +
                ", state=" + state +
                ", seq=" + sequence +
                '}';
    }
}
