package fr.lapetina.inference.gateway.domain.model;

import java.util.Objects;

/**
 * A model advertised by a runner, with the batch capacity it accepts.
 *
 * @param modelId      canonical model name clients ask for
 * @param maxBatchSize largest batch the runner executes in one call (at least 1)
 * @param engineType   engine hosting the model (e.g. "llama.cpp", "ollama")
 * @param localName    name the runner's engine knows the model by, defaults to {@code modelId}
 */
public record ServedModel(
        String modelId,
        int maxBatchSize,
        String engineType,
        String localName
) {
    public ServedModel {
        Objects.requireNonNull(modelId, "Model ID is required");
        if (modelId.isBlank()) {
            throw new IllegalArgumentException("Model ID must not be blank");
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1, got " + maxBatchSize);
        }
        if (engineType == null) {
            engineType = "unknown";
        }
        if (localName == null || localName.isBlank()) {
            localName = modelId;
        }
    }

    public static ServedModel of(String modelId, int maxBatchSize) {
        return new ServedModel(modelId, maxBatchSize, null, null);
    }

    public static ServedModel of(String modelId, int maxBatchSize, String engineType) {
        return new ServedModel(modelId, maxBatchSize, engineType, null);
    }
}
