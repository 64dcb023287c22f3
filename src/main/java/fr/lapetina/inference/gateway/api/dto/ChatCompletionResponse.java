package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;

import java.util.List;
import java.util.Map;

/**
 * API response DTO in the OpenAI chat-completion format, plus gateway fields
 * ({@code request_id}, {@code runner_id}) and, on failure, {@code error} and
 * {@code error_type}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionResponse {

    private String id;
    private String object;
    private Long created;
    private String model;
    private List<Choice> choices;
    private Map<String, Integer> usage;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("runner_id")
    private String runnerId;

    private String error;

    @JsonProperty("error_type")
    private String errorType;

    private Boolean retryable;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getObject() { return object; }
    public void setObject(String object) { this.object = object; }

    public Long getCreated() { return created; }
    public void setCreated(Long created) { this.created = created; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public List<Choice> getChoices() { return choices; }
    public void setChoices(List<Choice> choices) { this.choices = choices; }

    public Map<String, Integer> getUsage() { return usage; }
    public void setUsage(Map<String, Integer> usage) { this.usage = usage; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getRunnerId() { return runnerId; }
    public void setRunnerId(String runnerId) { this.runnerId = runnerId; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public Boolean getRetryable() { return retryable; }
    public void setRetryable(Boolean retryable) { this.retryable = retryable; }

    /**
     * Creates from domain InferenceResponse.
     */
    public static ChatCompletionResponse fromInferenceResponse(InferenceResponse response) {
        ChatCompletionResponse dto = new ChatCompletionResponse();
        dto.setId("chatcmpl-" + response.requestId());
        dto.setRequestId(response.requestId());
        dto.setModel(response.model());
        dto.setCreated(response.createdAt().getEpochSecond());
        dto.setRunnerId(response.runnerId());

        if (response.isError()) {
            dto.setError(response.errorMessage());
            dto.setErrorType(response.errorType().name());
            dto.setRetryable(response.isRetryable());
            return dto;
        }

        dto.setObject("chat.completion");
        dto.setChoices(List.of(new Choice(0,
                new ChatCompletionRequest.Message("assistant", response.content()), null,
                response.finishReason())));
        dto.setUsage(Map.of(
                "prompt_tokens", response.promptTokens(),
                "completion_tokens", response.completionTokens(),
                "total_tokens", response.promptTokens() + response.completionTokens()
        ));
        return dto;
    }

    /**
     * Creates a streaming chunk carrying the whole completion as a single delta.
     */
    public static ChatCompletionResponse chunkOf(InferenceResponse response) {
        ChatCompletionResponse dto = new ChatCompletionResponse();
        dto.setId("chatcmpl-" + response.requestId());
        dto.setObject("chat.completion.chunk");
        dto.setCreated(response.createdAt().getEpochSecond());
        dto.setModel(response.model());
        dto.setChoices(List.of(new Choice(0, null,
                new ChatCompletionRequest.Message("assistant", response.content()),
                response.finishReason())));
        return dto;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Choice {
        private int index;
        private ChatCompletionRequest.Message message;
        private ChatCompletionRequest.Message delta;

        @JsonProperty("finish_reason")
        private String finishReason;

        public Choice() {
        }

        public Choice(int index, ChatCompletionRequest.Message message,
                      ChatCompletionRequest.Message delta, String finishReason) {
            this.index = index;
            this.message = message;
            this.delta = delta;
            this.finishReason = finishReason;
        }

        public int getIndex() { return index; }
        public void setIndex(int index) { this.index = index; }

        public ChatCompletionRequest.Message getMessage() { return message; }
        public void setMessage(ChatCompletionRequest.Message message) { this.message = message; }

        public ChatCompletionRequest.Message getDelta() { return delta; }
        public void setDelta(ChatCompletionRequest.Message delta) { this.delta = delta; }

        public String getFinishReason() { return finishReason; }
        public void setFinishReason(String finishReason) { this.finishReason = finishReason; }
    }
}
