package fr.lapetina.inference.gateway.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome of a gateway request: a completion, or an error of a given {@link ErrorType}.
 * Immutable and thread-safe.
 */
public record InferenceResponse(
        String requestId,
        String model,
        String content,
        String finishReason,
        String runnerId,
        Instant createdAt,
        Instant completedAt,
        Duration totalDuration,
        int promptTokens,
        int completionTokens,
        ErrorType errorType,
        String errorMessage
) {
    public InferenceResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        if (createdAt == null) {
            createdAt = completedAt;
        }
        if (totalDuration == null) {
            totalDuration = Duration.between(createdAt, completedAt);
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public boolean isRetryable() {
        return errorType != null && errorType.isRetryable();
    }

    /**
     * Creates a successful response.
     */
    public static InferenceResponse success(
            String requestId,
            String model,
            String content,
            String runnerId,
            Instant createdAt
    ) {
        Instant now = Instant.now();
        return new InferenceResponse(
                requestId, model, content, "stop", runnerId,
                createdAt, now, Duration.between(createdAt, now),
                0, 0, null, null
        );
    }

    /**
     * Creates an error response.
     */
    public static InferenceResponse error(
            String requestId,
            String model,
            ErrorType errorType,
            String errorMessage,
            Instant createdAt
    ) {
        Objects.requireNonNull(errorType, "Error type is required");
        Instant now = Instant.now();
        return new InferenceResponse(
                requestId, model, null, null, null,
                createdAt, now, Duration.between(createdAt, now),
                0, 0, errorType, errorMessage
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private String content;
        private String finishReason;
        private String runnerId;
        private Instant createdAt;
        private Instant completedAt;
        private Duration totalDuration;
        private int promptTokens;
        private int completionTokens;
        private ErrorType errorType;
        private String errorMessage;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder finishReason(String finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder runnerId(String runnerId) {
            this.runnerId = runnerId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder totalDuration(Duration totalDuration) {
            this.totalDuration = totalDuration;
            return this;
        }

        public Builder promptTokens(int promptTokens) {
            this.promptTokens = promptTokens;
            return this;
        }

        public Builder completionTokens(int completionTokens) {
            this.completionTokens = completionTokens;
            return this;
        }

        public Builder errorType(ErrorType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public InferenceResponse build() {
            return new InferenceResponse(
                    requestId, model, content, finishReason, runnerId,
                    createdAt, completedAt, totalDuration,
                    promptTokens, completionTokens, errorType, errorMessage
            );
        }
    }
}
