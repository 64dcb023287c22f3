package fr.lapetina.inference.gateway.support;

import fr.lapetina.inference.gateway.batching.BatchExecutor;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Batch executor for tests.
 *
 * By default answers every request with {@code "echo:<last message>"}. In manual mode
 * calls stay pending until the test completes them through {@link Call}.
 */
public final class StubBatchExecutor implements BatchExecutor {

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile boolean manual;
    private volatile RuntimeException failure;
    private volatile Function<InferenceRequest, InferenceResponse> responder;

    public static StubBatchExecutor echoing() {
        return new StubBatchExecutor();
    }

    public static StubBatchExecutor manual() {
        StubBatchExecutor executor = new StubBatchExecutor();
        executor.manual = true;
        return executor;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public void respondWith(Function<InferenceRequest, InferenceResponse> responder) {
        this.responder = responder;
    }

    @Override
    public CompletableFuture<List<InferenceResponse>> executeBatch(
            RunnerSnapshot runner, String localModel, List<InferenceRequest> requests) {
        Call call = new Call(runner, localModel, requests);
        calls.add(call);
        if (failure != null) {
            call.future.completeExceptionally(failure);
        } else if (!manual) {
            call.succeed();
        }
        return call.future;
    }

    @Override
    public CompletableFuture<InferenceResponse> execute(
            RunnerSnapshot runner, String localModel, InferenceRequest request) {
        return executeBatch(runner, localModel, List.of(request)).thenApply(results -> results.get(0));
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public int callCount() {
        return calls.size();
    }

    public Call lastCall() {
        return calls.get(calls.size() - 1);
    }

    private InferenceResponse answer(RunnerSnapshot runner, InferenceRequest request) {
        Function<InferenceRequest, InferenceResponse> current = responder;
        if (current != null) {
            return current.apply(request);
        }
        String last = request.messages().isEmpty()
                ? ""
                : request.messages().get(request.messages().size() - 1).content();
        return InferenceResponse.success(request.requestId(), request.model(), "echo:" + last,
                runner.id(), request.createdAt());
    }

    /**
     * A recorded runner call.
     */
    public final class Call {
        private final RunnerSnapshot runner;
        private final String localModel;
        private final List<InferenceRequest> requests;
        private final CompletableFuture<List<InferenceResponse>> future = new CompletableFuture<>();

        private Call(RunnerSnapshot runner, String localModel, List<InferenceRequest> requests) {
            this.runner = runner;
            this.localModel = localModel;
            this.requests = List.copyOf(requests);
        }

        public RunnerSnapshot runner() {
            return runner;
        }

        public String localModel() {
            return localModel;
        }

        public List<InferenceRequest> requests() {
            return requests;
        }

        public List<String> requestIds() {
            return requests.stream().map(InferenceRequest::requestId).toList();
        }

        public CompletableFuture<List<InferenceResponse>> future() {
            return future;
        }

        public void succeed() {
            List<InferenceResponse> results = new ArrayList<>();
            for (InferenceRequest request : requests) {
                results.add(answer(runner, request));
            }
            future.complete(results);
        }

        public void complete(List<InferenceResponse> results) {
            future.complete(results);
        }

        public void fail(Throwable error) {
            future.completeExceptionally(error);
        }

        public InferenceResponse errorFor(InferenceRequest request, String message) {
            return InferenceResponse.error(request.requestId(), request.model(),
                    ErrorType.EXECUTION_FAILED,
                    message, Instant.now());
        }
    }
}
