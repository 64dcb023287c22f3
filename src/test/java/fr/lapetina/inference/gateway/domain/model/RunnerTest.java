package fr.lapetina.inference.gateway.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunnerTest {

    private Runner runner;

    @BeforeEach
    void setUp() {
        runner = Runner.builder()
                .id("runner-1")
                .baseUrl("http://localhost:9000")
                .addModel(ServedModel.of("llama3:8b", 4, "llama.cpp"))
                .registeredAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("should start in CONNECTING with heartbeat at registration time")
    void shouldStartConnecting() {
        assertThat(runner.getStatus()).isEqualTo(RunnerStatus.CONNECTING);
        assertThat(runner.isRoutable()).isFalse();
        assertThat(runner.getLastHeartbeatAt()).isEqualTo(runner.getRegisteredAt());
    }

    @Test
    @DisplayName("should require an id and a connection")
    void shouldRequireIdAndConnection() {
        assertThatThrownBy(() -> Runner.builder().baseUrl("http://localhost:9000").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Runner ID");
        assertThatThrownBy(() -> Runner.builder().id("r").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Connection");
    }

    @Nested
    class Status {

        @Test
        @DisplayName("should activate only from CONNECTING")
        void shouldActivateFromConnecting() {
            assertThat(runner.activate()).isTrue();
            assertThat(runner.getStatus()).isEqualTo(RunnerStatus.READY);
            assertThat(runner.activate()).isFalse();
        }

        @Test
        @DisplayName("should not undo a drain when activated late")
        void shouldNotActivateAfterDrain() {
            runner.transitionTo(RunnerStatus.DRAINING);

            assertThat(runner.activate()).isFalse();
            assertThat(runner.getStatus()).isEqualTo(RunnerStatus.DRAINING);
            assertThat(runner.isRoutable()).isFalse();
        }

        @Test
        @DisplayName("should move between live states")
        void shouldTransitionBetweenLiveStates() {
            assertThat(runner.transitionTo(RunnerStatus.READY)).isEqualTo(RunnerStatus.CONNECTING);
            assertThat(runner.isRoutable()).isTrue();

            assertThat(runner.transitionTo(RunnerStatus.DRAINING)).isEqualTo(RunnerStatus.READY);
            assertThat(runner.isRoutable()).isFalse();
        }

        @Test
        @DisplayName("should never leave DISCONNECTED")
        void shouldStayDisconnected() {
            runner.setStatus(RunnerStatus.DISCONNECTED);

            assertThat(runner.transitionTo(RunnerStatus.READY)).isEqualTo(RunnerStatus.DISCONNECTED);
            assertThat(runner.getStatus()).isEqualTo(RunnerStatus.DISCONNECTED);
        }
    }

    @Nested
    class Load {

        @Test
        @DisplayName("should count batch slots and never go below zero")
        void shouldCountBatchSlots() {
            runner.acquireBatchSlot();
            runner.acquireBatchSlot();
            assertThat(runner.getInFlightBatches()).isEqualTo(2);

            runner.releaseBatchSlot();
            runner.releaseBatchSlot();
            runner.releaseBatchSlot();
            assertThat(runner.getInFlightBatches()).isZero();
        }

        @Test
        @DisplayName("should take load and time from heartbeats")
        void shouldRecordHeartbeat() {
            Instant later = Instant.parse("2024-01-01T00:00:05Z");

            runner.recordHeartbeat(later, 3);

            assertThat(runner.getLastHeartbeatAt()).isEqualTo(later);
            assertThat(runner.getInFlightBatches()).isEqualTo(3);
        }

        @Test
        @DisplayName("should clamp a negative reported load to zero")
        void shouldClampNegativeLoad() {
            runner.recordHeartbeat(Instant.now(), -2);

            assertThat(runner.getInFlightBatches()).isZero();
        }
    }

    @Test
    @DisplayName("should replace advertised models")
    void shouldReplaceModels() {
        runner.replaceModels(List.of(ServedModel.of("mistral:7b", 2)));

        assertThat(runner.serves("mistral:7b")).isTrue();
        assertThat(runner.serves("llama3:8b")).isFalse();
    }

    @Test
    @DisplayName("should expose an immutable snapshot")
    void shouldSnapshot() {
        runner.transitionTo(RunnerStatus.READY);
        runner.acquireBatchSlot();

        RunnerSnapshot snapshot = runner.snapshot();
        runner.acquireBatchSlot();

        assertThat(snapshot.id()).isEqualTo("runner-1");
        assertThat(snapshot.status()).isEqualTo(RunnerStatus.READY);
        assertThat(snapshot.inFlightBatches()).isEqualTo(1);
        assertThat(snapshot.maxBatchSize("llama3:8b")).isEqualTo(4);
        assertThat(snapshot.localModelName("llama3:8b")).isEqualTo("llama3:8b");
        assertThatThrownBy(() -> snapshot.maxBatchSize("other"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a served model with zero batch capacity")
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> ServedModel.of("llama3:8b", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBatchSize");
    }
}
