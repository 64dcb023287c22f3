package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.InferenceRequest;
import fr.lapetina.inference.gateway.domain.model.InferenceResponse;
import fr.lapetina.inference.gateway.domain.model.RunnerSnapshot;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Carries work to a runner.
 *
 * Implementations never block the calling thread. A returned future completes
 * exceptionally with a {@link BatchExecutionException}, an {@link java.io.IOException}
 * when the runner cannot be reached, or any other exception; see
 * {@link BatchExecutionException#classify(Throwable)}.
 */
public interface BatchExecutor {

    /**
     * Executes a batch on the runner.
     *
     * @param localModel name the runner knows the model by
     * @return one response per request, in request order
     */
    CompletableFuture<List<InferenceResponse>> executeBatch(
            RunnerSnapshot runner,
            String localModel,
            List<InferenceRequest> requests
    );

    /**
     * Executes a single request on the runner, bypassing batching.
     */
    CompletableFuture<InferenceResponse> execute(
            RunnerSnapshot runner,
            String localModel,
            InferenceRequest request
    );
}
