package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A runner connected to the gateway.
 * Thread-safe; owned by the runner registry, everything else works on {@link RunnerSnapshot}s.
 */
public final class Runner {
    private final String id;
    private final RunnerConnection connection;
    private final Instant registeredAt;

    // Mutable state - thread-safe
    private final AtomicReference<Map<String, ServedModel>> models;
    private final AtomicReference<RunnerStatus> status;
    private final AtomicInteger inFlightBatches;
    private volatile Instant lastHeartbeatAt;

    private Runner(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Runner ID is required");
        this.connection = Objects.requireNonNull(builder.connection, "Connection is required");
        this.registeredAt = Objects.requireNonNull(builder.registeredAt, "Registration time is required");
        this.models = new AtomicReference<>(indexModels(builder.models.values()));
        this.status = new AtomicReference<>(builder.initialStatus);
        this.inFlightBatches = new AtomicInteger(0);
        this.lastHeartbeatAt = registeredAt;
    }

    private static Map<String, ServedModel> indexModels(Collection<ServedModel> served) {
        Map<String, ServedModel> index = new LinkedHashMap<>();
        for (ServedModel model : served) {
            index.put(model.modelId(), model);
        }
        return Map.copyOf(index);
    }

    public String getId() {
        return id;
    }

    public RunnerConnection getConnection() {
        return connection;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Map<String, ServedModel> getModels() {
        return models.get();
    }

    public void replaceModels(Collection<ServedModel> served) {
        models.set(indexModels(served));
    }

    public boolean serves(String modelId) {
        return models.get().containsKey(modelId);
    }

    public Optional<ServedModel> servedModel(String modelId) {
        return Optional.ofNullable(models.get().get(modelId));
    }

    public RunnerStatus getStatus() {
        return status.get();
    }

    public RunnerStatus setStatus(RunnerStatus newStatus) {
        return status.getAndSet(newStatus);
    }

    /**
     * Moves to {@code target} unless the runner already reached {@code DISCONNECTED}.
     *
     * @return the previous status
     */
    public RunnerStatus transitionTo(RunnerStatus target) {
        while (true) {
            RunnerStatus current = status.get();
            if (current == RunnerStatus.DISCONNECTED) {
                return current;
            }
            if (status.compareAndSet(current, target)) {
                return current;
            }
        }
    }

    /**
     * Moves a freshly registered runner from {@code CONNECTING} to {@code READY}.
     *
     * @return false if another transition (drain, disconnect) got there first
     */
    public boolean activate() {
        return status.compareAndSet(RunnerStatus.CONNECTING, RunnerStatus.READY);
    }

    public boolean isRoutable() {
        return status.get() == RunnerStatus.READY;
    }

    public int getInFlightBatches() {
        return inFlightBatches.get();
    }

    public int acquireBatchSlot() {
        return inFlightBatches.incrementAndGet();
    }

    /**
     * Releases a batch slot; never drops below zero since heartbeats may
     * have overwritten the count in between.
     */
    public void releaseBatchSlot() {
        inFlightBatches.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public void recordHeartbeat(Instant at, int currentLoad) {
        this.lastHeartbeatAt = at;
        this.inFlightBatches.set(Math.max(0, currentLoad));
    }

    public RunnerSnapshot snapshot() {
        return new RunnerSnapshot(
                id,
                connection,
                status.get(),
                models.get(),
                inFlightBatches.get(),
                lastHeartbeatAt,
                registeredAt
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Runner that = (Runner) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Runner{" +
                "id='" + id + '\'' +
                ", baseUrl=" + connection.baseUrl() +
                ", status=" + status.get() +
                ", models=" + models.get().keySet() +
                ", inFlight=" + inFlightBatches.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private RunnerConnection connection;
        private final Map<String, ServedModel> models = new LinkedHashMap<>();
        private RunnerStatus initialStatus = RunnerStatus.CONNECTING;
        private Instant registeredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder connection(RunnerConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder baseUrl(String url) {
            this.connection = RunnerConnection.of(url);
            return this;
        }

        public Builder addModel(ServedModel model) {
            this.models.put(model.modelId(), model);
            return this;
        }

        public Builder models(Collection<ServedModel> models) {
            for (ServedModel model : models) {
                addModel(model);
            }
            return this;
        }

        public Builder initialStatus(RunnerStatus status) {
            this.initialStatus = status;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Runner build() {
            if (registeredAt == null) {
                registeredAt = Instant.now();
            }
            return new Runner(this);
        }
    }
}
