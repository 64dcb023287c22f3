package fr.lapetina.inference.gateway.domain.model;

import fr.lapetina.inference.gateway.support.Requests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class QueuedRequestTest {

    private QueuedRequest queued;

    @BeforeEach
    void setUp() {
        queued = Requests.queued("req-1", "llama3:8b", Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("should resolve only once")
    void shouldResolveOnce() {
        InferenceResponse first = InferenceResponse.success("req-1", "llama3:8b", "one", "r1", Instant.now());
        InferenceResponse second = InferenceResponse.success("req-1", "llama3:8b", "two", "r1", Instant.now());

        assertThat(queued.resolve(first)).isTrue();
        assertThat(queued.resolve(second)).isFalse();
        assertThat(queued.fail(ErrorType.RUNNER_LOST, "lost")).isFalse();

        assertThat(queued.result().join().content()).isEqualTo("one");
    }

    @Test
    @DisplayName("should resolve failures as error responses")
    void shouldFailWithErrorResponse() {
        queued.fail(ErrorType.QUEUE_TIMEOUT, "too slow");

        InferenceResponse response = queued.result().join();
        assertThat(response.isError()).isTrue();
        assertThat(response.errorType()).isEqualTo(ErrorType.QUEUE_TIMEOUT);
        assertThat(response.errorMessage()).isEqualTo("too slow");
        assertThat(response.model()).isEqualTo("llama3:8b");
        assertThat(response.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("should flip the cancelled flag once")
    void shouldMarkCancelledOnce() {
        assertThat(queued.markCancelled()).isTrue();
        assertThat(queued.markCancelled()).isFalse();
        assertThat(queued.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should abort an attached call when already cancelled")
    void shouldAbortAttachedCallWhenCancelled() {
        CompletableFuture<InferenceResponse> call = new CompletableFuture<>();
        queued.markCancelled();

        queued.attachExecution(call);

        assertThat(call.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should cancel an attached call on request")
    void shouldCancelAttachedCall() {
        CompletableFuture<InferenceResponse> call = new CompletableFuture<>();
        queued.attachExecution(call);

        assertThat(queued.cancelExecution()).isTrue();
        assertThat(call.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should report runner loss as the only retryable error")
    void shouldReportRetryableErrors() {
        for (ErrorType type : ErrorType.values()) {
            assertThat(type.isRetryable()).isEqualTo(type == ErrorType.RUNNER_LOST);
        }
    }
}
