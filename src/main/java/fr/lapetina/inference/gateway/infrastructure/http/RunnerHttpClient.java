package fr.lapetina.inference.gateway.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.inference.gateway.batching.BatchExecutionException;
import fr.lapetina.inference.gateway.batching.BatchExecutor;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP transport to runners.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Runners speak the
 * OpenAI chat-completion format:
 * <ul>
 *   <li>single request: {@code POST {baseUrl}/v1/chat/completions}</li>
 *   <li>batch: {@code POST {baseUrl}/v1/batch/chat/completions} with
 *       {@code {"model", "requests": [...]}}, answered by {@code {"results": [...]}}
 *       in request order; a result of the form {@code {"error": "..."}} fails
 *       that item only</li>
 * </ul>
 * Connection failures surface as {@link java.io.IOException}s (runner lost);
 * HTTP errors and unreadable bodies as {@link BatchExecutionException}s.
 */
public class RunnerHttpClient implements BatchExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunnerHttpClient.class);

    static final String CHAT_PATH = "v1/chat/completions";
    static final String BATCH_PATH = "v1/batch/chat/completions";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RunnerHttpClient(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public RunnerHttpClient() {
        this(Duration.ofSeconds(10));
    }

    @Override
    public CompletableFuture<List<InferenceResponse>> executeBatch(
            RunnerSnapshot runner,
            String localModel,
            List<InferenceRequest> requests
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", localModel);
        body.put("requests", requests.stream().map(r -> toWire(r, localModel)).toList());

        HttpRequest httpRequest;
        try {
            httpRequest = post(runner, BATCH_PATH, body)
                    .header("X-Batch-Size", String.valueOf(requests.size()))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new BatchExecutionException(
                    ErrorType.EXECUTION_FAILED, "Failed to build batch request: " + e.getMessage(), e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending batch: runnerId={}, model={}, size={}, endpoint={}",
                runner.id(), localModel, requests.size(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    Duration latency = Duration.between(startTime, Instant.now());
                    JsonNode root = readBody(runner, response);
                    JsonNode results = root.path("results");
                    if (!results.isArray()) {
                        throw new BatchExecutionException(ErrorType.EXECUTION_FAILED,
                                "Runner " + runner.id() + " returned no results array");
                    }
                    if (results.size() != requests.size()) {
                        throw new BatchExecutionException(ErrorType.EXECUTION_FAILED, "Runner " + runner.id()
                                + " returned " + results.size() + " results for a batch of " + requests.size());
                    }
                    List<InferenceResponse> responses = new ArrayList<>(results.size());
                    for (int i = 0; i < results.size(); i++) {
                        responses.add(parseResult(runner, requests.get(i), results.get(i), latency));
                    }
                    log.debug("Batch answered: runnerId={}, size={}, results={}, latencyMs={}",
                            runner.id(), requests.size(), results.size(), latency.toMillis());
                    return responses;
                });
    }

    @Override
    public CompletableFuture<InferenceResponse> execute(
            RunnerSnapshot runner,
            String localModel,
            InferenceRequest request
    ) {
        HttpRequest httpRequest;
        try {
            httpRequest = post(runner, CHAT_PATH, toWire(request, localModel))
                    .header("X-Request-ID", request.requestId())
                    .header("X-Correlation-ID", request.correlationId())
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new BatchExecutionException(
                    ErrorType.EXECUTION_FAILED, "Failed to build request: " + e.getMessage(), e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: runnerId={}, requestId={}, model={}, endpoint={}",
                runner.id(), request.requestId(), localModel, httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    Duration latency = Duration.between(startTime, Instant.now());
                    JsonNode root = readBody(runner, response);
                    InferenceResponse result = parseResult(runner, request, root, latency);
                    if (result.isError()) {
                        throw new BatchExecutionException(result.errorType(), result.errorMessage());
                    }
                    log.debug("Request answered: runnerId={}, requestId={}, latencyMs={}",
                            runner.id(), request.requestId(), latency.toMillis());
                    return result;
                });
    }

    private HttpRequest.Builder post(RunnerSnapshot runner, String path, Object body) throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(resolve(runner, path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
    }

    static URI resolve(RunnerSnapshot runner, String path) {
        String basePath = runner.connection().baseUrl().toString();
        if (!basePath.endsWith("/")) {
            basePath += "/";
        }
        return URI.create(basePath + path);
    }

    /**
     * OpenAI-style request body. The gateway always reads the whole answer, so
     * the runner is never asked to stream.
     */
    private Map<String, Object> toWire(InferenceRequest request, String localModel) {
        Map<String, Object> body = new LinkedHashMap<>(request.options());
        body.put("request_id", request.requestId());
        body.put("model", localModel);
        body.put("messages", request.messages().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());
        body.put("stream", false);
        return body;
    }

    private JsonNode readBody(RunnerSnapshot runner, HttpResponse<String> response) {
        int status = response.statusCode();
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            if (status < 200 || status >= 300) {
                throw new BatchExecutionException(ErrorType.EXECUTION_FAILED,
                        "Runner " + runner.id() + " returned HTTP " + status);
            }
            throw new BatchExecutionException(ErrorType.EXECUTION_FAILED,
                    "Unreadable response from runner " + runner.id() + ": " + e.getOriginalMessage(), e);
        }
        if (status < 200 || status >= 300) {
            String message = "Runner " + runner.id() + " returned HTTP " + status;
            String detail = errorText(root);
            if (detail != null) {
                message += ": " + detail;
            }
            log.warn("Runner call failed: runnerId={}, status={}, error={}", runner.id(), status, detail);
            throw new BatchExecutionException(ErrorType.EXECUTION_FAILED, message);
        }
        return root;
    }

    private InferenceResponse parseResult(
            RunnerSnapshot runner,
            InferenceRequest request,
            JsonNode result,
            Duration latency
    ) {
        String error = errorText(result);
        if (error != null) {
            return InferenceResponse.builder()
                    .requestId(request.requestId())
                    .model(request.model())
                    .runnerId(runner.id())
                    .createdAt(request.createdAt())
                    .completedAt(Instant.now())
                    .errorType(ErrorType.EXECUTION_FAILED)
                    .errorMessage(error)
                    .build();
        }

        JsonNode choice = result.path("choices").path(0);
        JsonNode usage = result.path("usage");
        return InferenceResponse.builder()
                .requestId(request.requestId())
                .model(request.model())
                .content(choice.path("message").path("content").asText(""))
                .finishReason(choice.path("finish_reason").asText("stop"))
                .runnerId(runner.id())
                .createdAt(request.createdAt())
                .completedAt(Instant.now())
                .totalDuration(latency)
                .promptTokens(usage.path("prompt_tokens").asInt(0))
                .completionTokens(usage.path("completion_tokens").asInt(0))
                .build();
    }

    /**
     * The error text of a body, for both {@code {"error": "..."}} and
     * {@code {"error": {"message": "..."}}}.
     */
    private static String errorText(JsonNode node) {
        if (node == null || !node.has("error") || node.get("error").isNull()) {
            return null;
        }
        JsonNode error = node.get("error");
        if (error.isTextual()) {
            return error.asText();
        }
        return error.path("message").asText(error.toString());
    }

    @Override
    public void close() {
        // Nothing to release on JDK 17
    }
}
