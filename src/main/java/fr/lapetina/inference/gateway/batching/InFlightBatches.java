package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.Batch;
import fr.lapetina.inference.gateway.domain.model.ErrorType;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry.RunnerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Batches dispatched to a runner and not yet settled, grouped by runner.
 *
 * Registered as a {@link fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry}
 * listener: when a runner is lost every batch outstanding on it is failed with
 * {@link ErrorType#RUNNER_LOST}. A batch leaves the set exactly once, through
 * {@link #settle} or through runner loss, whichever comes first.
 */
public final class InFlightBatches implements Consumer<RunnerEvent> {

    private static final Logger log = LoggerFactory.getLogger(InFlightBatches.class);

    private final Map<String, Set<Batch>> byRunner = new ConcurrentHashMap<>();

    public void track(Batch batch) {
        byRunner.computeIfAbsent(batch.runner().id(), id -> ConcurrentHashMap.newKeySet()).add(batch);
    }

    /**
     * Removes the batch.
     *
     * @return false if the batch was already settled or failed by runner loss
     */
    public boolean settle(Batch batch) {
        Set<Batch> batches = byRunner.get(batch.runner().id());
        return batches != null && batches.remove(batch);
    }

    /**
     * Removes the batch and fails every unresolved member.
     *
     * @return false if the batch was no longer tracked
     */
    public boolean fail(Batch batch, ErrorType errorType, String message) {
        if (!settle(batch)) {
            return false;
        }
        batch.failAll(errorType, message);
        return true;
    }

    @Override
    public void accept(RunnerEvent event) {
        if (event.type() == RunnerEvent.Type.LOST) {
            failRunner(event.runner().id(), "Runner lost: " + event.reason());
        }
    }

    /**
     * Fails every batch outstanding on the runner with {@link ErrorType#RUNNER_LOST}.
     *
     * @return number of batches failed
     */
    public int failRunner(String runnerId, String message) {
        Set<Batch> batches = byRunner.remove(runnerId);
        if (batches == null || batches.isEmpty()) {
            return 0;
        }
        int failed = 0;
        for (Batch batch : List.copyOf(batches)) {
            if (batches.remove(batch)) {
                int resolved = batch.failAll(ErrorType.RUNNER_LOST, message);
                failed++;
                log.warn("Batch failed on runner loss: batchId={}, runnerId={}, model={}, resolved={}",
                        batch.batchId(), runnerId, batch.modelId(), resolved);
            }
        }
        return failed;
    }

    public int count() {
        int total = 0;
        for (Set<Batch> batches : byRunner.values()) {
            total += batches.size();
        }
        return total;
    }

    public int countFor(String runnerId) {
        Set<Batch> batches = byRunner.get(runnerId);
        return batches == null ? 0 : batches.size();
    }
}
