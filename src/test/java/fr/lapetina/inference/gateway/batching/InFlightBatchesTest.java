package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.Batch;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.domain.model.QueuedRequest;
import fr.lapetina.inference.gateway.domain.model.RunnerConnection;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.domain.model.ServedModel;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import fr.lapetina.inference.gateway.support.Requests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InFlightBatchesTest {

    private RunnerRegistry registry;
    private InFlightBatches inFlight;
    private RunnerSnapshot runner;

    @BeforeEach
    void setUp() {
        registry = new RunnerRegistry();
        inFlight = new InFlightBatches();
        registry.addListener(inFlight);
        runner = registry.register("r1", List.of(ServedModel.of("llama3:8b", 4)),
                RunnerConnection.of("http://localhost:9000"));
    }

    private Batch batchOf(String... ids) {
        List<QueuedRequest> requests = Arrays.stream(ids)
                .map(id -> Requests.queued(id, "llama3:8b", Instant.now()))
                .toList();
        return new Batch("llama3:8b", requests, runner, Instant.now());
    }

    @Test
    @DisplayName("should settle a tracked batch once")
    void shouldSettleOnce() {
        Batch batch = batchOf("a");
        inFlight.track(batch);

        assertThat(inFlight.countFor("r1")).isEqualTo(1);
        assertThat(inFlight.settle(batch)).isTrue();
        assertThat(inFlight.settle(batch)).isFalse();
        assertThat(inFlight.count()).isZero();
    }

    @Test
    @DisplayName("should fail every outstanding batch when its runner is lost")
    void shouldFailBatchesOnRunnerLoss() {
        Batch first = batchOf("a", "b");
        Batch second = batchOf("c");
        inFlight.track(first);
        inFlight.track(second);

        registry.markDisconnected("r1", "connection reset");

        for (Batch batch : List.of(first, second)) {
            for (QueuedRequest request : batch.requests()) {
                assertThat(request.result().join().errorType()).isEqualTo(ErrorType.RUNNER_LOST);
                assertThat(request.result().join().errorMessage()).contains("connection reset");
                assertThat(request.result().join().isRetryable()).isTrue();
            }
        }
        assertThat(inFlight.count()).isZero();
        assertThat(inFlight.settle(first)).isFalse();
    }

    @Test
    @DisplayName("should leave a batch settled before the loss untouched")
    void shouldIgnoreSettledBatchOnLoss() {
        Batch batch = batchOf("a");
        inFlight.track(batch);
        inFlight.settle(batch);

        registry.markDisconnected("r1");

        assertThat(batch.requests().get(0).isResolved()).isFalse();
    }

    @Test
    @DisplayName("should fail a tracked batch directly")
    void shouldFailTrackedBatch() {
        Batch batch = batchOf("a");
        inFlight.track(batch);

        assertThat(inFlight.fail(batch, ErrorType.RUNNER_LOST, "gone")).isTrue();
        assertThat(inFlight.fail(batch, ErrorType.EXECUTION_FAILED, "again")).isFalse();

        assertThat(batch.requests().get(0).result().join().errorType()).isEqualTo(ErrorType.RUNNER_LOST);
    }
}
