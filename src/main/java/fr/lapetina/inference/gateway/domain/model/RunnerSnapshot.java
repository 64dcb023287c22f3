package fr.lapetina.inference.gateway.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time, immutable view of a {@link Runner}.
 */
public record RunnerSnapshot(
        String id,
        RunnerConnection connection,
        RunnerStatus status,
        Map<String, ServedModel> models,
        int inFlightBatches,
        Instant lastHeartbeatAt,
        Instant registeredAt
) {
    public RunnerSnapshot {
        Objects.requireNonNull(id, "Runner ID is required");
        models = models != null ? Map.copyOf(models) : Map.of();
    }

    public boolean serves(String modelId) {
        return models.containsKey(modelId);
    }

    /**
     * Batch capacity for the given model.
     *
     * @throws IllegalArgumentException if the runner does not serve the model
     */
    public int maxBatchSize(String modelId) {
        return require(modelId).maxBatchSize();
    }

    /**
     * Name to send to the runner for the given model.
     *
     * @throws IllegalArgumentException if the runner does not serve the model
     */
    public String localModelName(String modelId) {
        return require(modelId).localName();
    }

    private ServedModel require(String modelId) {
        ServedModel model = models.get(modelId);
        if (model == null) {
            throw new IllegalArgumentException("Runner " + id + " does not serve model " + modelId);
        }
        return model;
    }
}
