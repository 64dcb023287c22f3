package fr.lapetina.inference.gateway.routing;

import fr.lapetina.inference.gateway.domain.model.ModelClass;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves {@code class:big} and {@code class:fast} requests to a concrete model.
 *
 * Among the models configured for the class that some ready runner serves, the
 * one whose best runner is least loaded wins; ties go to the lower model ID.
 * Model names match case-insensitively.
 */
public final class ModelResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private final RunnerRegistry registry;
    private final Map<ModelClass, List<String>> classModels;

    public ModelResolver(RunnerRegistry registry, Map<ModelClass, List<String>> classModels) {
        this.registry = registry;
        this.classModels = new EnumMap<>(ModelClass.class);
        if (classModels != null) {
            classModels.forEach((modelClass, models) -> this.classModels.put(
                    modelClass, models.stream().map(ModelResolver::normalize).toList()));
        }
    }

    /**
     * Whether the requested model names a model class.
     */
    public boolean isClassRequest(String requestedModel) {
        return ModelClass.fromRequestedModel(requestedModel).isPresent();
    }

    /**
     * Resolves the requested model.
     *
     * @return the concrete model to route to; the input itself for a concrete
     *         model, empty for a class with no served member
     */
    public Optional<String> resolve(String requestedModel) {
        Optional<ModelClass> modelClass = ModelClass.fromRequestedModel(requestedModel);
        if (modelClass.isEmpty()) {
            return Optional.ofNullable(requestedModel);
        }

        List<String> members = classModels.getOrDefault(modelClass.get(), List.of());
        String best = null;
        RunnerSnapshot bestRunner = null;
        for (String servedModel : registry.listModels()) {
            if (!members.contains(normalize(servedModel))) {
                continue;
            }
            List<RunnerSnapshot> candidates = registry.candidatesFor(servedModel);
            if (candidates.isEmpty()) {
                continue;
            }
            RunnerSnapshot runner = candidates.get(0);
            if (bestRunner == null
                    || runner.inFlightBatches() < bestRunner.inFlightBatches()
                    || (runner.inFlightBatches() == bestRunner.inFlightBatches() && servedModel.compareTo(best) < 0)) {
                best = servedModel;
                bestRunner = runner;
            }
        }

        if (best == null) {
            log.debug("No served model for class: class={}, members={}", modelClass.get().label(), members);
            return Optional.empty();
        }
        log.debug("Model class resolved: class={}, model={}, runnerId={}",
                modelClass.get().label(), best, bestRunner.id());
        return Optional.of(best);
    }

    /**
     * The class a concrete model is configured under, if any.
     */
    public Optional<ModelClass> classify(String modelId) {
        String normalized = normalize(modelId);
        for (Map.Entry<ModelClass, List<String>> entry : classModels.entrySet()) {
            if (entry.getValue().contains(normalized)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private static String normalize(String model) {
        return model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
    }
}
