package fr.lapetina.inference.gateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.gateway.domain.event.EventState;
import fr.lapetina.inference.gateway.domain.event.IngressEvent;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.QueuedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Final stage handler: hands validated requests over for execution and clears the slot.
 *
 * Responsibilities:
 * - Resolves requests that failed validation with INVALID_REQUEST
 * - Drops requests cancelled while in the ring buffer
 * - Passes every other request to the admission callback (the router)
 * - Clears the event for reuse
 */
public final class AdmissionHandler implements EventHandler<IngressEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    private final Consumer<QueuedRequest> admission;

    public AdmissionHandler(Consumer<QueuedRequest> admission) {
        this.admission = admission;
    }

    @Override
    public void onEvent(IngressEvent event, long sequence, boolean endOfBatch) {
        try {
            QueuedRequest queued = event.getQueued();
            if (queued == null) {
                return;
            }
            if (event.getState() == EventState.VALIDATION_FAILED) {
                queued.fail(ErrorType.INVALID_REQUEST, event.getErrorMessage());
                return;
            }
            if (queued.isCancelled() || queued.isResolved()) {
                event.markCancelled();
                log.debug("Skipping request resolved before admission: requestId={}", queued.requestId());
                return;
            }
            try {
                admission.accept(queued);
                event.markAdmitted();
            } catch (RuntimeException e) {
                log.error("Admission failed: requestId={}, model={}", queued.requestId(), queued.modelId(), e);
                queued.fail(ErrorType.INTERNAL_ERROR, "Admission failed: " + e.getMessage());
            }
        } finally {
            event.clear();
        }
    }
}
