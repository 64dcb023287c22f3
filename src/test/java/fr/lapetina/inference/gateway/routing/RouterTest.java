package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.batching.BatchDispatcher;
import fr.lapetina.inference.gateway.batching.BatchExecutor;
import fr.lapetina.inference.gateway.batching.BatchQueue;
import fr.lapetina.inference.gateway.batching.InFlightBatches;
import fr.lapetina.inference.gateway.disruptor.exception.BackpressureException;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.ModelClass;
import fr.lapetina.inference.gateway.domain.model.RunnerConnection;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.domain.model.ServedModel;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import fr.lapetina.inference.gateway.support.Await;
import fr.lapetina.inference.gateway.support.Requests;
import fr.lapetina.inference.gateway.support.StubBatchExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest {

    private static final String MODEL = "llama3:8b";

    private RunnerRegistry registry;
    private BatchQueue batchQueue;
    private InFlightBatches inFlight;
    private MetricsRegistry metrics;
    private StubBatchExecutor executor;
    private BatchDispatcher dispatcher;
    private Router router;

    @BeforeEach
    void setUp() {
        registry = new RunnerRegistry();
        batchQueue = new BatchQueue(Duration.ofSeconds(1), 2);
        inFlight = new InFlightBatches();
        registry.addListener(inFlight);
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.close();
        }
        if (dispatcher != null) {
            dispatcher.close();
        }
        metrics.close();
    }

    private void start(StubBatchExecutor stub) {
        start(stub, builder -> { });
    }

    private void start(BatchExecutor batchExecutor, Consumer<Router.Builder> customizer) {
        Router.Builder builder = Router.builder()
                .registry(registry)
                .batchQueue(batchQueue)
                .executor(batchExecutor)
                .inFlight(inFlight)
                .metrics(metrics)
                .ringBufferSize(64)
                .modelResolver(new ModelResolver(registry, Map.of(
                        ModelClass.BIG, List.of("llama3:70b"),
                        ModelClass.FAST, List.of(MODEL, "mistral:7b"))));
        customizer.accept(builder);
        router = builder.build();
        dispatcher = BatchDispatcher.builder()
                .batchQueue(batchQueue)
                .registry(registry)
                .executor(batchExecutor)
                .inFlight(inFlight)
                .metrics(metrics)
                .noRunnerTimeout(Duration.ofMillis(300))
                .build();
        router.start();
        dispatcher.start();
    }

    private void registerRunner(String id, String model, int maxBatchSize) {
        registry.register(id, List.of(ServedModel.of(model, maxBatchSize)), RunnerConnection.of("http://" + id + ":9000"));
    }

    @Nested
    class Paths {

        @Test
        @DisplayName("should batch requests for the same model")
        void shouldBatchRequests() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor);
            registerRunner("r1", MODEL, 4);

            CompletableFuture<InferenceResponse> a = router.submit(Requests.chat("a", MODEL, "first"));
            CompletableFuture<InferenceResponse> b = router.submit(Requests.chat("b", MODEL, "second"));

            assertThat(a.get(5, TimeUnit.SECONDS).content()).isEqualTo("echo:first");
            assertThat(b.get(5, TimeUnit.SECONDS).content()).isEqualTo("echo:second");
            assertThat(executor.calls()).hasSize(1);
            assertThat(executor.lastCall().requestIds()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should execute streaming requests immediately")
        void shouldExecuteStreamingImmediately() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor);
            registerRunner("r1", MODEL, 4);

            InferenceResponse response = router.submit(Requests.streaming("s1", MODEL)).get(5, TimeUnit.SECONDS);

            assertThat(response.isSuccess()).isTrue();
            assertThat(executor.lastCall().requestIds()).containsExactly("s1");
            assertThat(batchQueue.queueDepths()).doesNotContainKey(MODEL);
        }

        @Test
        @DisplayName("should bypass the queue when batching is disabled")
        void shouldBypassQueueWhenDisabled() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor, builder -> builder.batchingEnabled(false));
            registerRunner("r1", MODEL, 4);

            InferenceResponse response = router.submit(Requests.chat("a", MODEL)).get(5, TimeUnit.SECONDS);

            assertThat(response.isSuccess()).isTrue();
            assertThat(batchQueue.queueDepths()).isEmpty();
        }

        @Test
        @DisplayName("should fail an immediate request when no runner serves the model")
        void shouldFailImmediateWithoutRunner() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor);

            InferenceResponse response = router.submit(Requests.streaming("s1", MODEL)).get(5, TimeUnit.SECONDS);

            assertThat(response.errorType()).isEqualTo(ErrorType.MODEL_UNAVAILABLE);
        }

        @Test
        @DisplayName("should time out a batched request when no runner shows up")
        void shouldTimeOutBatchedWithoutRunner() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor);

            InferenceResponse response = router.submit(Requests.chat("a", MODEL)).get(5, TimeUnit.SECONDS);

            assertThat(response.errorType()).isEqualTo(ErrorType.QUEUE_TIMEOUT);
            Await.until(() -> router.pendingCount() == 0);
        }

        @Test
        @DisplayName("should resolve invalid requests with INVALID_REQUEST")
        void shouldRejectInvalidRequest() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor);

            InferenceResponse response = router.submit(InferenceRequest.ofChat(MODEL, List.of()))
                    .get(5, TimeUnit.SECONDS);

            assertThat(response.errorType()).isEqualTo(ErrorType.INVALID_REQUEST);
        }
    }

    @Nested
    class ModelClasses {

        @Test
        @DisplayName("should route a class request to a served member")
        void shouldResolveClass() throws Exception {
            executor = StubBatchExecutor.echoing();
            start(executor);
            registerRunner("r1", "mistral:7b", 1);

            InferenceResponse response = router.submit(Requests.chat("a", "class:fast")).get(5, TimeUnit.SECONDS);

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.model()).isEqualTo("mistral:7b");
        }

        @Test
        @DisplayName("should answer MODEL_UNAVAILABLE when no member of the class is served")
        void shouldRejectUnservedClass() {
            executor = StubBatchExecutor.echoing();
            start(executor);
            registerRunner("r1", MODEL, 4);

            CompletableFuture<InferenceResponse> future = router.submit(Requests.chat("a", "class:big"));

            assertThat(future).isDone();
            assertThat(future.join().errorType()).isEqualTo(ErrorType.MODEL_UNAVAILABLE);
        }
    }

    @Nested
    class Cancellation {

        @Test
        @DisplayName("should withdraw a queued request")
        void shouldCancelQueuedRequest() throws Exception {
            executor = StubBatchExecutor.manual();
            start(executor);
            registerRunner("r1", MODEL, 4);

            CompletableFuture<InferenceResponse> future = router.submit(Requests.chat("a", MODEL));
            Await.until(() -> batchQueue.pendingCount() == 1);

            assertThat(router.cancel("a")).isTrue();

            assertThat(future.get(1, TimeUnit.SECONDS).errorType()).isEqualTo(ErrorType.CANCELLED);
            assertThat(batchQueue.pendingCount()).isZero();
            assertThat(router.cancel("a")).isFalse();
            assertThat(executor.callCount()).isZero();
        }

        @Test
        @DisplayName("should discard the result of a cancelled request already dispatched")
        void shouldCancelDispatchedRequest() throws Exception {
            executor = StubBatchExecutor.manual();
            start(executor);
            registerRunner("r1", MODEL, 4);

            CompletableFuture<InferenceResponse> a = router.submit(Requests.chat("a", MODEL));
            CompletableFuture<InferenceResponse> b = router.submit(Requests.chat("b", MODEL));
            Await.until(() -> executor.callCount() == 1);

            assertThat(router.cancel("a")).isTrue();
            executor.lastCall().succeed();

            assertThat(a.get(1, TimeUnit.SECONDS).errorType()).isEqualTo(ErrorType.CANCELLED);
            assertThat(b.get(1, TimeUnit.SECONDS).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should abort an immediate runner call")
        void shouldAbortImmediateCall() throws Exception {
            executor = StubBatchExecutor.manual();
            start(executor);
            registerRunner("r1", MODEL, 4);

            CompletableFuture<InferenceResponse> future = router.submit(Requests.streaming("s1", MODEL));
            Await.until(() -> executor.callCount() == 1);

            assertThat(router.cancel("s1")).isTrue();

            assertThat(future.get(1, TimeUnit.SECONDS).errorType()).isEqualTo(ErrorType.CANCELLED);
            Await.until(() -> inFlight.count() == 0);
        }

        @Test
        @DisplayName("should return false for unknown requests")
        void shouldIgnoreUnknownRequest() {
            executor = StubBatchExecutor.manual();
            start(executor);

            assertThat(router.cancel("nope")).isFalse();
        }

        @Test
        @DisplayName("should dequeue a request whose caller cancelled the future")
        void shouldHandleCallerCancellation() {
            executor = StubBatchExecutor.manual();
            start(executor);
            registerRunner("r1", MODEL, 4);

            CompletableFuture<InferenceResponse> future = router.submit(Requests.chat("a", MODEL));
            Await.until(() -> batchQueue.pendingCount() == 1);

            future.cancel(true);

            assertThat(batchQueue.pendingCount()).isZero();
            assertThat(router.pendingCount()).isZero();
        }
    }

    @Test
    @DisplayName("should resolve every request exactly once under concurrent submit and cancel")
    void shouldResolveExactlyOnceUnderContention() throws Exception {
        int count = 200;
        executor = StubBatchExecutor.echoing();
        // room for the whole burst, so no submission is rejected before the consumer catches up
        start(executor, builder -> builder.ringBufferSize(256));
        registerRunner("r1", MODEL, 4);
        registerRunner("r2", MODEL, 4);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<CompletableFuture<InferenceResponse>> futures = new ArrayList<>();
        try {
            List<Future<CompletableFuture<InferenceResponse>>> submissions = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String id = "req-" + i;
                boolean cancel = i % 3 == 0;
                submissions.add(pool.submit(() -> {
                    CompletableFuture<InferenceResponse> future = router.submit(Requests.chat(id, MODEL));
                    if (cancel) {
                        router.cancel(id);
                    }
                    return future;
                }));
            }
            for (Future<CompletableFuture<InferenceResponse>> submission : submissions) {
                futures.add(submission.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        for (int i = 0; i < count; i++) {
            InferenceResponse response = futures.get(i).join();
            assertThat(response.requestId()).isEqualTo("req-" + i);
            if (response.isError()) {
                assertThat(response.errorType()).isEqualTo(ErrorType.CANCELLED);
            } else {
                assertThat(response.content()).isEqualTo("echo:prompt req-" + i);
            }
        }
        Await.until(() -> router.pendingCount() == 0);
        Await.until(() -> inFlight.count() == 0);
        for (StubBatchExecutor.Call call : executor.calls()) {
            assertThat(call.requests()).hasSizeLessThanOrEqualTo(4);
        }
    }

    @Test
    @DisplayName("should reject a request ID that is still in progress")
    void shouldRejectDuplicateInProgress() throws Exception {
        executor = StubBatchExecutor.manual();
        start(executor);
        registerRunner("r1", MODEL, 4);

        router.submit(Requests.chat("a", MODEL));
        InferenceResponse duplicate = router.submit(Requests.chat("a", MODEL)).get(1, TimeUnit.SECONDS);

        assertThat(duplicate.errorType()).isEqualTo(ErrorType.INVALID_REQUEST);
    }

    @Test
    @DisplayName("should throw BackpressureException when the ring buffer is full")
    void shouldApplyBackpressure() {
        CountDownLatch release = new CountDownLatch(1);
        BatchExecutor blocking = new BatchExecutor() {
            @Override
            public CompletableFuture<List<InferenceResponse>> executeBatch(
                    RunnerSnapshot runner, String localModel, List<InferenceRequest> requests) {
                return new CompletableFuture<>();
            }

            @Override
            public CompletableFuture<InferenceResponse> execute(
                    RunnerSnapshot runner, String localModel, InferenceRequest request) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return CompletableFuture.completedFuture(InferenceResponse.success(
                        request.requestId(), request.model(), "late", runner.id(), request.createdAt()));
            }
        };
        start(blocking, builder -> builder.batchingEnabled(false).ringBufferSize(4));
        registerRunner("r1", MODEL, 4);

        try {
            assertThatThrownBy(() -> {
                for (int i = 0; i < 16; i++) {
                    router.submit(Requests.chat("bp-" + i, MODEL));
                }
            }).isInstanceOf(BackpressureException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("should refuse submissions before start")
    void shouldRefuseWhenNotStarted() {
        router = Router.builder()
                .registry(registry)
                .batchQueue(batchQueue)
                .executor(StubBatchExecutor.echoing())
                .inFlight(inFlight)
                .metrics(metrics)
                .build();

        assertThatThrownBy(() -> router.submit(Requests.chat("a", MODEL)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should expose runners, models and queue depths")
    void shouldExposeState() {
        executor = StubBatchExecutor.manual();
        start(executor);
        registerRunner("r1", MODEL, 4);
        registerRunner("r2", "mistral:7b", 2);

        assertThat(router.listRunners()).extracting(RunnerSnapshot::id).containsExactly("r1", "r2");
        assertThat(router.listModels()).isEqualTo(Set.of(MODEL, "mistral:7b"));
        assertThat(router.getRemainingCapacity()).isEqualTo(64);
    }
}
