package fr.lapetina.inference.gateway.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.inference.gateway.batching.BatchExecutionException;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.RunnerConnection;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.domain.model.RunnerStatus;
import fr.lapetina.inference.gateway.domain.model.ServedModel;
import fr.lapetina.inference.gateway.support.Requests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunnerHttpClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer runnerServer;
    private RunnerHttpClient client;
    private RunnerSnapshot runner;
    private final AtomicReference<JsonNode> lastBody = new AtomicReference<>();
    private final AtomicReference<HttpExchange> lastExchange = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = "{}";

    @BeforeEach
    void setUp() throws IOException {
        runnerServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        runnerServer.createContext("/", exchange -> {
            lastExchange.set(exchange);
            lastBody.set(MAPPER.readTree(exchange.getRequestBody().readAllBytes()));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        runnerServer.start();

        client = new RunnerHttpClient(Duration.ofSeconds(2));
        runner = snapshotFor("http://127.0.0.1:" + runnerServer.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        runnerServer.stop(0);
        client.close();
    }

    private static RunnerSnapshot snapshotFor(String baseUrl) {
        Instant now = Instant.now();
        return new RunnerSnapshot("r1", RunnerConnection.of(baseUrl), RunnerStatus.READY,
                Map.of("llama3:8b", ServedModel.of("llama3:8b", 4)), 0, now, now);
    }

    private static String completion(String content) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + content
                + "\"},\"finish_reason\":\"stop\"}],\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":2}}";
    }

    @Nested
    class BatchCall {

        @Test
        @DisplayName("should send one batch call and map results by position")
        void shouldMapResultsByPosition() throws Exception {
            reply = "{\"results\":[" + completion("first") + "," + completion("second") + "]}";
            List<InferenceRequest> requests = List.of(
                    Requests.chat("a", "llama3:8b", "one"),
                    Requests.chat("b", "llama3:8b", "two"));

            List<InferenceResponse> results = client.executeBatch(runner, "llama3-local", requests)
                    .get(5, TimeUnit.SECONDS);

            assertThat(results).extracting(InferenceResponse::requestId).containsExactly("a", "b");
            assertThat(results).extracting(InferenceResponse::content).containsExactly("first", "second");
            assertThat(results.get(0).model()).isEqualTo("llama3:8b");
            assertThat(results.get(0).runnerId()).isEqualTo("r1");
            assertThat(results.get(0).promptTokens()).isEqualTo(5);
            assertThat(results.get(0).completionTokens()).isEqualTo(2);

            JsonNode body = lastBody.get();
            assertThat(lastExchange.get().getRequestURI().getPath()).isEqualTo("/v1/batch/chat/completions");
            assertThat(lastExchange.get().getRequestHeaders().getFirst("X-Batch-Size")).isEqualTo("2");
            assertThat(body.path("model").asText()).isEqualTo("llama3-local");
            assertThat(body.path("requests")).hasSize(2);
            assertThat(body.path("requests").get(0).path("request_id").asText()).isEqualTo("a");
            assertThat(body.path("requests").get(1).path("messages").get(0).path("content").asText()).isEqualTo("two");
            assertThat(body.path("requests").get(0).path("stream").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("should fail only the item the runner reported an error for")
        void shouldFailSingleItem() throws Exception {
            reply = "{\"results\":[" + completion("ok") + ",{\"error\":\"context length exceeded\"}]}";
            List<InferenceRequest> requests = List.of(
                    Requests.chat("a", "llama3:8b"),
                    Requests.chat("b", "llama3:8b"));

            List<InferenceResponse> results = client.executeBatch(runner, "llama3:8b", requests)
                    .get(5, TimeUnit.SECONDS);

            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(1).errorType()).isEqualTo(ErrorType.EXECUTION_FAILED);
            assertThat(results.get(1).errorMessage()).isEqualTo("context length exceeded");
        }

        @Test
        @DisplayName("should fail the call when the result count does not match")
        void shouldRejectCountMismatch() {
            reply = "{\"results\":[" + completion("only") + "]}";
            CompletableFuture<List<InferenceResponse>> future = client.executeBatch(runner, "llama3:8b",
                    List.of(Requests.chat("a", "llama3:8b"), Requests.chat("b", "llama3:8b")));

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(BatchExecutionException.class)
                    .hasMessageContaining("returned 1 results for a batch of 2");
        }

        @Test
        @DisplayName("should fail the call on an HTTP error status")
        void shouldFailOnHttpError() {
            status = 500;
            reply = "{\"error\":{\"message\":\"model not loaded\"}}";
            CompletableFuture<List<InferenceResponse>> future = client.executeBatch(runner, "llama3:8b",
                    List.of(Requests.chat("a", "llama3:8b")));

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .hasMessageContaining("HTTP 500")
                    .hasMessageContaining("model not loaded");
            assertThat(BatchExecutionException.classify(future.handle((r, e) -> e).join()))
                    .isEqualTo(ErrorType.EXECUTION_FAILED);
        }

        @Test
        @DisplayName("should fail the call on an unreadable body")
        void shouldFailOnUnreadableBody() {
            reply = "not json";
            CompletableFuture<List<InferenceResponse>> future = client.executeBatch(runner, "llama3:8b",
                    List.of(Requests.chat("a", "llama3:8b")));

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(BatchExecutionException.class)
                    .hasMessageContaining("Unreadable response");
        }
    }

    @Nested
    class SingleCall {

        @Test
        @DisplayName("should send a single chat completion with tracing headers")
        void shouldSendSingleRequest() throws Exception {
            reply = completion("hello");
            InferenceRequest request = InferenceRequest.builder()
                    .requestId("s1")
                    .correlationId("corr-1")
                    .model("llama3:8b")
                    .messages(List.of(new InferenceRequest.Message("user", "hi")))
                    .options(Map.of("temperature", 0.2))
                    .stream(true)
                    .build();

            InferenceResponse response = client.execute(runner, "llama3:8b", request).get(5, TimeUnit.SECONDS);

            assertThat(response.content()).isEqualTo("hello");
            assertThat(response.finishReason()).isEqualTo("stop");
            assertThat(lastExchange.get().getRequestURI().getPath()).isEqualTo("/v1/chat/completions");
            assertThat(lastExchange.get().getRequestHeaders().getFirst("X-Request-ID")).isEqualTo("s1");
            assertThat(lastExchange.get().getRequestHeaders().getFirst("X-Correlation-ID")).isEqualTo("corr-1");
            assertThat(lastBody.get().path("stream").asBoolean()).isFalse();
            assertThat(lastBody.get().path("temperature").asDouble()).isEqualTo(0.2);
        }

        @Test
        @DisplayName("should fail when the runner answers with an error")
        void shouldFailOnErrorBody() {
            reply = "{\"error\":\"out of memory\"}";
            CompletableFuture<InferenceResponse> future = client.execute(runner, "llama3:8b",
                    Requests.chat("s1", "llama3:8b"));

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(BatchExecutionException.class)
                    .hasMessage("out of memory");
        }
    }

    @Test
    @DisplayName("should report an unreachable runner as runner loss")
    void shouldClassifyUnreachableRunner() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        RunnerSnapshot gone = snapshotFor("http://127.0.0.1:" + freePort);

        CompletableFuture<List<InferenceResponse>> future = client.executeBatch(gone, "llama3:8b",
                List.of(Requests.chat("a", "llama3:8b")));
        Throwable error = future.handle((r, e) -> e).get(5, TimeUnit.SECONDS);

        assertThat(error).isNotNull();
        assertThat(BatchExecutionException.classify(error)).isEqualTo(ErrorType.RUNNER_LOST);
    }

    @Test
    @DisplayName("should resolve paths against base URLs with or without a trailing slash")
    void shouldResolvePaths() {
        assertThat(RunnerHttpClient.resolve(snapshotFor("http://host:9000"), RunnerHttpClient.CHAT_PATH))
                .hasToString("http://host:9000/v1/chat/completions");
        assertThat(RunnerHttpClient.resolve(snapshotFor("http://host:9000/runner/"), RunnerHttpClient.BATCH_PATH))
                .hasToString("http://host:9000/runner/v1/batch/chat/completions");
    }
}
