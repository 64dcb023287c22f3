package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A chat-completion request submitted to the gateway.
 * Immutable and thread-safe.
 */
public record InferenceRequest(
        String requestId,
        String model,
        List<Message> messages,
        Map<String, Object> options,
        boolean stream,
        Instant createdAt,
        String correlationId
) {
    public InferenceRequest {
        Objects.requireNonNull(model, "Model is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    /**
     * Chat message for conversation-style requests.
     */
    public record Message(String role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }
    }

    /**
     * Returns a copy addressed to another model, used when a model class is resolved.
     */
    public InferenceRequest withModel(String resolvedModel) {
        return new InferenceRequest(
                requestId, resolvedModel, messages, options, stream, createdAt, correlationId
        );
    }

    /**
     * Creates a non-streaming chat request.
     */
    public static InferenceRequest ofChat(String model, List<Message> messages) {
        return new InferenceRequest(null, model, messages, null, false, null, null);
    }

    /**
     * Creates a non-streaming chat request with a single user message.
     */
    public static InferenceRequest ofUserMessage(String model, String content) {
        return ofChat(model, List.of(new Message("user", content)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private List<Message> messages;
        private Map<String, Object> options;
        private boolean stream;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = options;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public InferenceRequest build() {
            return new InferenceRequest(
                    requestId, model, messages, options, stream, createdAt, correlationId
            );
        }
    }
}
