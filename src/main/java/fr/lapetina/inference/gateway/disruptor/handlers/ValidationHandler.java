package fr.lapetina.inference.gateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.inference.gateway.domain.event.IngressEvent;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * First stage handler: validates incoming chat requests.
 *
 * Validates:
 * - Model name is present (and allowed, if a model whitelist is configured)
 * - At least one message, and no more than the configured maximum
 * - Every message has a role and content within the length limit
 */
public final class ValidationHandler implements EventHandler<IngressEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final Set<String> allowedModels;
    private final int maxMessageLength;
    private final int maxMessages;

    public ValidationHandler(Set<String> allowedModels, int maxMessageLength, int maxMessages) {
        this.allowedModels = allowedModels != null ? Set.copyOf(allowedModels) : Set.of();
        this.maxMessageLength = maxMessageLength;
        this.maxMessages = maxMessages;
    }

    /**
     * Creates a handler with no model restrictions and default limits.
     */
    public static ValidationHandler withDefaults() {
        return new ValidationHandler(Set.of(), 100_000, 256);
    }

    @Override
    public void onEvent(IngressEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }
        event.setSequence(sequence);
        if (event.getQueued() == null) {
            event.markValidationFailed("Request is null");
            return;
        }
        InferenceRequest request = event.getQueued().request();

        try {
            validate(request, event.getQueued().modelId());
            event.markValidated();
            log.debug("Request validated: requestId={}, model={}, sequence={}",
                    request.requestId(), request.model(), sequence);
        } catch (ValidationException e) {
            event.markValidationFailed(e.getMessage());
            log.warn("Validation failed: requestId={}, model={}, reason={}, sequence={}",
                    request.requestId(), request.model(), e.getMessage(), sequence);
        }
    }

    /**
     * @param resolvedModel concrete model, after any model class resolution
     */
    void validate(InferenceRequest request, String resolvedModel) throws ValidationException {
        String model = request.model();
        if (model == null || model.isBlank()) {
            throw new ValidationException("Model name is required");
        }

        if (!allowedModels.isEmpty() && !allowedModels.contains(resolvedModel)) {
            throw new ValidationException("Model not allowed: " + resolvedModel);
        }

        if (request.messages() == null || request.messages().isEmpty()) {
            throw new ValidationException("At least one message is required");
        }
        if (request.messages().size() > maxMessages) {
            throw new ValidationException("Too many messages: " + request.messages().size()
                    + " (max " + maxMessages + ")");
        }

        for (InferenceRequest.Message message : request.messages()) {
            if (message.role() == null || message.role().isBlank()) {
                throw new ValidationException("Message role is required");
            }
            if (message.content() == null) {
                throw new ValidationException("Message content is required");
            }
            if (message.content().length() > maxMessageLength) {
                throw new ValidationException("Message content exceeds maximum length of " + maxMessageLength);
            }
        }
    }

    static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
