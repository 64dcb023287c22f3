package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * API request DTO in the OpenAI chat-completion format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionRequest {

    private String model;
    private List<Message> messages;
    private boolean stream;
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Object stop;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("correlation_id")
    private String correlationId;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public List<Message> getMessages() { return messages; }
    public void setMessages(List<Message> messages) { this.messages = messages; }

    public boolean isStream() { return stream; }
    public void setStream(boolean stream) { this.stream = stream; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public Double getTopP() { return topP; }
    public void setTopP(Double topP) { this.topP = topP; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    /** A single stop sequence or a list of them. */
    public Object getStop() { return stop; }
    public void setStop(Object stop) { this.stop = stop; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getCorrelationId() { return correlationId; }
    public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

    /**
     * Converts to domain InferenceRequest. Sampling parameters become request options.
     */
    public InferenceRequest toInferenceRequest() {
        List<InferenceRequest.Message> domainMessages = null;
        if (messages != null) {
            domainMessages = messages.stream()
                    .map(m -> new InferenceRequest.Message(
                            m.getRole() != null ? m.getRole() : "",
                            m.getContent() != null ? m.getContent() : ""))
                    .toList();
        }

        Map<String, Object> options = new LinkedHashMap<>();
        if (temperature != null) {
            options.put("temperature", temperature);
        }
        if (topP != null) {
            options.put("top_p", topP);
        }
        if (maxTokens != null) {
            options.put("max_tokens", maxTokens);
        }
        if (stop != null) {
            options.put("stop", stop);
        }

        return InferenceRequest.builder()
                .requestId(requestId)
                .model(model != null ? model : "")
                .messages(domainMessages)
                .options(options)
                .stream(stream)
                .correlationId(correlationId)
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;

        public Message() {
        }

        public Message(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }
}
