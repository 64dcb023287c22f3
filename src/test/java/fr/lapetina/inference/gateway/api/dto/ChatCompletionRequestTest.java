package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatCompletionRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should carry sampling parameters as request options")
    void shouldMapSamplingParameters() throws Exception {
        ChatCompletionRequest dto = objectMapper.readValue("""
                {"model": "llama3:8b", "temperature": 0.2, "top_p": 0.9, "max_tokens": 64,
                 "stop": ["\\n"], "request_id": "req-1", "user": "ignored",
                 "messages": [{"role": "system", "content": "be brief"}, {"role": "user", "content": "hi"}]}
                """, ChatCompletionRequest.class);

        InferenceRequest request = dto.toInferenceRequest();

        assertThat(request.requestId()).isEqualTo("req-1");
        assertThat(request.model()).isEqualTo("llama3:8b");
        assertThat(request.stream()).isFalse();
        assertThat(request.messages()).extracting(InferenceRequest.Message::role).containsExactly("system", "user");
        assertThat(request.options())
                .containsEntry("temperature", 0.2)
                .containsEntry("top_p", 0.9)
                .containsEntry("max_tokens", 64)
                .containsEntry("stop", List.of("\n"));
    }

    @Test
    @DisplayName("should leave unset parameters out of the options")
    void shouldOmitUnsetParameters() throws Exception {
        ChatCompletionRequest dto = objectMapper.readValue("""
                {"model": "llama3:8b", "stream": true, "messages": [{"role": "user", "content": "hi"}]}
                """, ChatCompletionRequest.class);

        InferenceRequest request = dto.toInferenceRequest();

        assertThat(request.options()).isEmpty();
        assertThat(request.stream()).isTrue();
        assertThat(request.requestId()).isNotBlank();
    }
}
