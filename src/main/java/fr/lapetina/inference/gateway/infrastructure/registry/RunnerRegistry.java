package fr.lapetina.inference.gateway.infrastructure.registry;

import fr.lapetina.inference.gateway.domain.model.Runner;
import fr.lapetina.inference.gateway.domain.model.RunnerConnection;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.domain.model.RunnerStatus;
import fr.lapetina.inference.gateway.domain.model.ServedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of the runners connected to the gateway.
 *
 * Sole owner of runner state: callers get {@link RunnerSnapshot}s and change
 * state only through the methods below. Runner loss is announced to listeners
 * as a {@link RunnerEvent.Type#LOST} event.
 */
public final class RunnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunnerRegistry.class);

    /** Ascending in-flight load, then runner ID. */
    public static final Comparator<RunnerSnapshot> LEAST_LOADED =
            Comparator.comparingInt(RunnerSnapshot::inFlightBatches)
                    .thenComparing(RunnerSnapshot::id);

    private final Map<String, Runner> runners = new ConcurrentHashMap<>();
    private final List<Consumer<RunnerEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public RunnerRegistry(Clock clock) {
        this.clock = clock;
    }

    public RunnerRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Registers a runner; it becomes routable immediately.
     *
     * @throws DuplicateRunnerException if a runner with this ID is already registered
     */
    public RunnerSnapshot register(String runnerId, Collection<ServedModel> models, RunnerConnection connection) {
        if (runnerId == null || runnerId.isBlank()) {
            throw new IllegalArgumentException("Runner ID is required");
        }
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("Runner " + runnerId + " must serve at least one model");
        }

        Runner runner = Runner.builder()
                .id(runnerId)
                .connection(connection)
                .models(models)
                .registeredAt(clock.instant())
                .build();

        Runner existing = runners.putIfAbsent(runnerId, runner);
        if (existing != null) {
            throw new DuplicateRunnerException(runnerId);
        }
        runner.activate();

        log.info("Runner registered: runnerId={}, baseUrl={}, models={}",
                runnerId, connection.baseUrl(), runner.getModels().keySet());
        notifyListeners(new RunnerEvent(RunnerEvent.Type.REGISTERED, runner.snapshot(), null));
        return runner.snapshot();
    }

    /**
     * Records a heartbeat.
     *
     * @return false if the runner is unknown (already evicted) and must re-register
     */
    public boolean heartbeat(String runnerId, int currentLoad) {
        Runner runner = runners.get(runnerId);
        if (runner == null) {
            log.debug("Heartbeat from unknown runner: runnerId={}", runnerId);
            return false;
        }
        runner.recordHeartbeat(clock.instant(), currentLoad);
        log.debug("Heartbeat: runnerId={}, load={}", runnerId, currentLoad);
        return true;
    }

    /**
     * Replaces the models a runner advertises.
     *
     * @return false if the runner is unknown
     */
    public boolean updateModels(String runnerId, Collection<ServedModel> models) {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("Runner " + runnerId + " must serve at least one model");
        }
        Runner runner = runners.get(runnerId);
        if (runner == null) {
            return false;
        }
        runner.replaceModels(models);
        log.info("Runner models updated: runnerId={}, models={}", runnerId, runner.getModels().keySet());
        notifyListeners(new RunnerEvent(RunnerEvent.Type.MODELS_UPDATED, runner.snapshot(), null));
        return true;
    }

    /**
     * Stops routing new work to a runner; its in-flight batches complete normally.
     *
     * @return false if the runner is unknown
     */
    public boolean markDraining(String runnerId) {
        Runner runner = runners.get(runnerId);
        if (runner == null) {
            return false;
        }
        RunnerStatus previous = runner.transitionTo(RunnerStatus.DRAINING);
        if (previous != RunnerStatus.DRAINING && previous != RunnerStatus.DISCONNECTED) {
            log.info("Runner draining: runnerId={}, inFlight={}", runnerId, runner.getInFlightBatches());
            notifyListeners(new RunnerEvent(RunnerEvent.Type.DRAINING, runner.snapshot(), null));
        }
        return true;
    }

    public boolean markDisconnected(String runnerId) {
        return markDisconnected(runnerId, "disconnected");
    }

    /**
     * Removes a runner and announces its loss; batches outstanding on it are
     * failed by the listeners.
     *
     * @return false if the runner is unknown
     */
    public boolean markDisconnected(String runnerId, String reason) {
        Runner runner = runners.remove(runnerId);
        if (runner == null) {
            return false;
        }
        evict(runner, reason);
        return true;
    }

    /**
     * Evicts every runner whose last heartbeat is older than {@code heartbeatTimeout}.
     *
     * @return number of runners evicted
     */
    public int evictStale(Duration heartbeatTimeout) {
        Instant now = clock.instant();
        int evicted = 0;
        for (Runner runner : runners.values()) {
            Duration silence = Duration.between(runner.getLastHeartbeatAt(), now);
            if (silence.compareTo(heartbeatTimeout) > 0 && runners.remove(runner.getId(), runner)) {
                log.warn("Runner heartbeat timed out: runnerId={}, silentForMs={}, timeoutMs={}",
                        runner.getId(), silence.toMillis(), heartbeatTimeout.toMillis());
                evict(runner, "heartbeat timeout after " + silence.toMillis() + "ms");
                evicted++;
            }
        }
        return evicted;
    }

    private void evict(Runner runner, String reason) {
        runner.setStatus(RunnerStatus.DISCONNECTED);
        log.info("Runner lost: runnerId={}, reason={}, inFlight={}",
                runner.getId(), reason, runner.getInFlightBatches());
        notifyListeners(new RunnerEvent(RunnerEvent.Type.LOST, runner.snapshot(), reason));
    }

    /**
     * Ready runners serving the model, least loaded first.
     */
    public List<RunnerSnapshot> candidatesFor(String modelId) {
        return runners.values().stream()
                .filter(runner -> runner.isRoutable() && runner.serves(modelId))
                .map(Runner::snapshot)
                .sorted(LEAST_LOADED)
                .toList();
    }

    /**
     * Batch capacity of the best candidate for the model, empty when no ready runner serves it.
     */
    public OptionalInt batchCapacity(String modelId) {
        List<RunnerSnapshot> candidates = candidatesFor(modelId);
        if (candidates.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(candidates.get(0).maxBatchSize(modelId));
    }

    /**
     * Counts one more batch in flight on the runner.
     *
     * @return the registration the slot was taken on, empty if the runner is no longer registered
     */
    public Optional<Runner> acquire(String runnerId) {
        Runner runner = runners.get(runnerId);
        if (runner == null || runner.getStatus() == RunnerStatus.DISCONNECTED) {
            return Optional.empty();
        }
        runner.acquireBatchSlot();
        return Optional.of(runner);
    }

    /**
     * Gives back a slot taken with {@link #acquire}. The slot belongs to that
     * registration: a runner since re-registered under the same ID keeps its count.
     */
    public void release(Runner acquired) {
        acquired.releaseBatchSlot();
    }

    public boolean isRegistered(String runnerId) {
        return runners.containsKey(runnerId);
    }

    public Optional<RunnerSnapshot> getRunner(String runnerId) {
        return Optional.ofNullable(runners.get(runnerId)).map(Runner::snapshot);
    }

    /**
     * All registered runners, sorted by ID.
     */
    public List<RunnerSnapshot> listRunners() {
        List<RunnerSnapshot> snapshots = new ArrayList<>();
        for (Runner runner : runners.values()) {
            snapshots.add(runner.snapshot());
        }
        snapshots.sort(Comparator.comparing(RunnerSnapshot::id));
        return snapshots;
    }

    /**
     * Models served by at least one ready runner, sorted.
     */
    public Set<String> listModels() {
        Set<String> models = new TreeSet<>();
        for (Runner runner : runners.values()) {
            if (runner.isRoutable()) {
                models.addAll(runner.getModels().keySet());
            }
        }
        return models;
    }

    public long countByStatus(RunnerStatus status) {
        return runners.values().stream()
                .filter(runner -> runner.getStatus() == status)
                .count();
    }

    public int size() {
        return runners.size();
    }

    public void addListener(Consumer<RunnerEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RunnerEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RunnerEvent event) {
        for (Consumer<RunnerEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener: event={}, runnerId={}", event.type(), event.runner().id(), e);
            }
        }
    }

    /**
     * Event for runner lifecycle changes.
     *
     * @param reason why the runner was lost, null for other types
     */
    public record RunnerEvent(Type type, RunnerSnapshot runner, String reason) {
        public enum Type {
            REGISTERED,
            MODELS_UPDATED,
            DRAINING,
            LOST
        }
    }
}
