package fr.lapetina.inference.gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.inference.gateway.api.dto.ChatCompletionRequest;
import fr.lapetina.inference.gateway.api.dto.ChatCompletionResponse;
import fr.lapetina.inference.gateway.api.dto.RunnerHeartbeat;
import fr.lapetina.inference.gateway.api.dto.RunnerRegistration;
import fr.lapetina.inference.gateway.disruptor.exception.BackpressureException;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.RunnerConnection;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.domain.model.RunnerStatus;
import fr.lapetina.inference.gateway.domain.model.ServedModel;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.infrastructure.registry.DuplicateRunnerException;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import fr.lapetina.inference.gateway.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Client endpoints:
 * - POST /v1/chat/completions - Chat completion (OpenAI compatible, SSE when stream=true)
 * - DELETE /v1/requests/{id} - Cancel a request
 * - GET /v1/models - Models served by the fleet
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/runners - Connected runners
 * - GET /admin/queues - Queue depths
 *
 * Runner endpoints:
 * - POST /runners/register - Register a runner
 * - POST /runners/{id}/heartbeat - Heartbeat, optionally with an updated model list
 * - POST /runners/{id}/drain - Stop routing new work to a runner
 * - DELETE /runners/{id} - Disconnect a runner
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    /** Non-standard "client closed request" status used for cancelled requests. */
    static final int STATUS_CANCELLED = 499;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Router router;
    private final RunnerRegistry registry;
    private final MetricsRegistry metricsRegistry;
    private final Duration requestTimeout;
    private final Duration heartbeatTimeout;
    private final String authToken;
    private final int protocolVersion;

    public HttpServer(
            GatewayConfig config,
            Router router,
            RunnerRegistry registry,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.router = router;
        this.registry = registry;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeout = config.getServer().getRequestTimeout();
        this.heartbeatTimeout = config.getRunners().getHeartbeatTimeout();
        this.authToken = config.getRunners().getAuthToken();
        this.protocolVersion = config.getRunners().getProtocolVersion();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(config.getServer().getHost(), config.getServer().getPort()),
                config.getServer().getBacklog()
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-handler-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/v1/chat/completions", new ChatCompletionsHandler());
        server.createContext("/v1/requests", new RequestsHandler());
        server.createContext("/v1/models", new ModelsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());
        server.createContext("/runners", new RunnersHandler());

        log.info("HTTP server configured on {}:{}", config.getServer().getHost(), getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * The bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== CHAT COMPLETIONS HANDLER ====================

    private class ChatCompletionsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String headerRequestId = exchange.getRequestHeaders().getFirst("X-Request-ID");
            String requestId = headerRequestId != null ? headerRequestId : UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                ChatCompletionRequest apiRequest;
                try (InputStream is = exchange.getRequestBody()) {
                    apiRequest = objectMapper.readValue(is, ChatCompletionRequest.class);
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Invalid JSON body: " + e.getOriginalMessage());
                    return;
                }

                if (apiRequest.getRequestId() == null) {
                    apiRequest.setRequestId(requestId);
                } else {
                    MDC.put("requestId", apiRequest.getRequestId());
                }
                String correlationId = exchange.getRequestHeaders().getFirst("X-Correlation-ID");
                if (correlationId != null && apiRequest.getCorrelationId() == null) {
                    apiRequest.setCorrelationId(correlationId);
                }

                InferenceRequest request = apiRequest.toInferenceRequest();

                CompletableFuture<InferenceResponse> future;
                try {
                    future = router.submit(request);
                } catch (BackpressureException e) {
                    log.warn("Backpressure: {}", e.getMessage());
                    sendError(exchange, 503, e.getMessage());
                    return;
                } catch (IllegalStateException e) {
                    sendError(exchange, 503, "Gateway not accepting requests: " + e.getMessage());
                    return;
                }

                InferenceResponse response;
                try {
                    response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    router.cancel(request.requestId());
                    log.warn("Request timed out: requestId={}, model={}, timeoutMs={}",
                            request.requestId(), request.model(), requestTimeout.toMillis());
                    sendJson(exchange, 504, ChatCompletionResponse.fromInferenceResponse(InferenceResponse.error(
                            request.requestId(), request.model(), ErrorType.QUEUE_TIMEOUT,
                            "No result within " + requestTimeout.toMillis() + "ms", request.createdAt())));
                    return;
                }

                if (response.isSuccess() && request.stream()) {
                    sendStream(exchange, response);
                    return;
                }
                int statusCode = response.isSuccess() ? 200 : statusFor(response.errorType());
                sendJson(exchange, statusCode, ChatCompletionResponse.fromInferenceResponse(response));

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Interrupted");
            } catch (ExecutionException | RuntimeException e) {
                log.error("Error handling chat completion request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void sendStream(HttpExchange exchange, InferenceResponse response) throws IOException {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody()) {
                String chunk = objectMapper.writeValueAsString(ChatCompletionResponse.chunkOf(response));
                os.write(("data: " + chunk + "\n\n").getBytes(StandardCharsets.UTF_8));
                os.write("data: [DONE]\n\n".getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    static int statusFor(ErrorType errorType) {
        if (errorType == null) {
            return 500;
        }
        return switch (errorType) {
            case INVALID_REQUEST -> 400;
            case MODEL_UNAVAILABLE -> 503;
            case RUNNER_LOST, EXECUTION_FAILED -> 502;
            case QUEUE_TIMEOUT -> 504;
            case CANCELLED -> STATUS_CANCELLED;
            case INTERNAL_ERROR -> 500;
        };
    }

    // ==================== REQUESTS HANDLER ====================

    private class RequestsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (!path.matches("/v1/requests/[^/]+")) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"DELETE".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            String requestId = path.substring("/v1/requests/".length());
            if (router.cancel(requestId)) {
                sendJson(exchange, 200, Map.of("request_id", requestId, "cancelled", true));
            } else {
                sendError(exchange, 404, "Unknown or already completed request: " + requestId);
            }
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            List<Map<String, Object>> data = new ArrayList<>();
            for (String model : router.listModels()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", model);
                entry.put("object", "model");
                entry.put("owned_by", "inference-gateway");
                data.add(entry);
            }
            sendJson(exchange, 200, Map.of("object", "list", "data", data));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            long ready = registry.countByStatus(RunnerStatus.READY);

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", ready > 0 ? "UP" : "DOWN");
            health.put("timestamp", System.currentTimeMillis());

            Map<String, Object> runners = new LinkedHashMap<>();
            runners.put("total", registry.size());
            runners.put("ready", ready);
            runners.put("draining", registry.countByStatus(RunnerStatus.DRAINING));
            health.put("runners", runners);

            Map<String, Object> gateway = new LinkedHashMap<>();
            gateway.put("pending", router.pendingCount());
            gateway.put("ringBufferRemaining", router.getRemainingCapacity());
            health.put("gateway", gateway);

            sendJson(exchange, ready > 0 ? 200 : 503, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/runners") && "GET".equals(method)) {
                    List<Map<String, Object>> runners = new ArrayList<>();
                    for (RunnerSnapshot runner : router.listRunners()) {
                        runners.add(describe(runner));
                    }
                    sendJson(exchange, 200, runners);
                } else if (path.equals("/admin/queues") && "GET".equals(method)) {
                    Map<String, Object> queues = new LinkedHashMap<>();
                    queues.put("depths", router.queueDepths());
                    queues.put("pending", router.pendingCount());
                    sendJson(exchange, 200, queues);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (RuntimeException e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }
    }

    // ==================== RUNNERS HANDLER ====================

    private class RunnersHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (!isAuthorized(exchange)) {
                    sendError(exchange, 401, "Invalid or missing runner token");
                    return;
                }
                if (path.equals("/runners/register") && "POST".equals(method)) {
                    handleRegister(exchange);
                } else if (path.matches("/runners/[^/]+/heartbeat") && "POST".equals(method)) {
                    handleHeartbeat(exchange, runnerIdOf(path));
                } else if (path.matches("/runners/[^/]+/drain") && "POST".equals(method)) {
                    if (registry.markDraining(runnerIdOf(path))) {
                        sendJson(exchange, 200, Map.of("runner_id", runnerIdOf(path), "status", "DRAINING"));
                    } else {
                        sendError(exchange, 404, "Unknown runner: " + runnerIdOf(path));
                    }
                } else if (path.matches("/runners/[^/]+") && "DELETE".equals(method)) {
                    if (registry.markDisconnected(runnerIdOf(path), "deregistered")) {
                        sendJson(exchange, 200, Map.of("runner_id", runnerIdOf(path), "status", "DISCONNECTED"));
                    } else {
                        sendError(exchange, 404, "Unknown runner: " + runnerIdOf(path));
                    }
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Invalid JSON body: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Error in runner handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleRegister(HttpExchange exchange) throws IOException {
            RunnerRegistration registration = readBody(exchange, RunnerRegistration.class);
            if (registration == null) {
                sendError(exchange, 400, "Registration body is required");
                return;
            }
            if (registration.getProtocolVersion() != protocolVersion) {
                log.warn("Runner protocol mismatch: runnerId={}, version={}, expected={}",
                        registration.getRunnerId(), registration.getProtocolVersion(), protocolVersion);
                sendJson(exchange, 400, Map.of(
                        "error", "Unsupported protocol version " + registration.getProtocolVersion(),
                        "expected", protocolVersion
                ));
                return;
            }
            if (registration.getBaseUrl() == null || registration.getBaseUrl().isBlank()) {
                sendError(exchange, 400, "base_url is required");
                return;
            }

            List<ServedModel> models = registration.toServedModels();
            RunnerConnection connection = new RunnerConnection(URI.create(registration.getBaseUrl()));
            try {
                RunnerSnapshot runner = registry.register(registration.getRunnerId(), models, connection);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("runner_id", runner.id());
                body.put("status", runner.status().name());
                body.put("heartbeat_timeout_ms", heartbeatTimeout.toMillis());
                sendJson(exchange, 201, body);
            } catch (DuplicateRunnerException e) {
                sendError(exchange, 409, e.getMessage());
            }
        }

        private void handleHeartbeat(HttpExchange exchange, String runnerId) throws IOException {
            RunnerHeartbeat heartbeat = readBody(exchange, RunnerHeartbeat.class);
            if (heartbeat == null) {
                heartbeat = new RunnerHeartbeat();
            }
            if (!registry.heartbeat(runnerId, heartbeat.getCurrentLoad())) {
                sendJson(exchange, 404, Map.of(
                        "error", "Unknown runner: " + runnerId,
                        "action", "re-register"
                ));
                return;
            }
            if (heartbeat.getModels() != null && !heartbeat.getModels().isEmpty()) {
                registry.updateModels(runnerId, heartbeat.getModels().stream()
                        .map(RunnerRegistration.Model::toServedModel)
                        .toList());
            }
            sendJson(exchange, 200, Map.of("runner_id", runnerId, "status", "ok"));
        }

        private boolean isAuthorized(HttpExchange exchange) {
            if (authToken == null || authToken.isBlank()) {
                return true;
            }
            String header = exchange.getRequestHeaders().getFirst("Authorization");
            return ("Bearer " + authToken).equals(header);
        }

        private String runnerIdOf(String path) {
            return path.split("/")[2];
        }
    }

    // ==================== HELPER METHODS ====================

    private Map<String, Object> describe(RunnerSnapshot runner) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", runner.id());
        info.put("url", runner.connection().baseUrl().toString());
        info.put("status", runner.status().name());
        List<Map<String, Object>> models = new ArrayList<>();
        for (ServedModel model : runner.models().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("model_id", model.modelId());
            entry.put("max_batch_size", model.maxBatchSize());
            entry.put("engine_type", model.engineType());
            entry.put("local_name", model.localName());
            models.add(entry);
        }
        info.put("models", models);
        info.put("inFlightBatches", runner.inFlightBatches());
        info.put("lastHeartbeatAt", String.valueOf(runner.lastHeartbeatAt()));
        info.put("registeredAt", String.valueOf(runner.registeredAt()));
        return info;
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        byte[] bytes;
        try (InputStream is = exchange.getRequestBody()) {
            bytes = is.readAllBytes();
        }
        if (bytes.length == 0) {
            return null;
        }
        return objectMapper.readValue(bytes, type);
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
