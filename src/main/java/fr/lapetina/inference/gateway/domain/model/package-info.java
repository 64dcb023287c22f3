/**
 * Domain model of the gateway.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.Runner} - Thread-safe state of a connected runner, owned by the registry</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.RunnerSnapshot} - Immutable view of a runner handed to everyone else</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.QueuedRequest} - A caller's request with its single-use result sink</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.Batch} - Requests for one model assigned to one runner</li>
 *   <li>{@link fr.lapetina.inference.gateway.domain.model.ErrorType} - Error kinds every failed request resolves with</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code InferenceRequest}, {@code InferenceResponse}, {@code ServedModel} and
 * {@code RunnerSnapshot} are immutable records. {@code Runner} keeps its mutable state in
 * atomics. {@code QueuedRequest} relies on {@code CompletableFuture} completing at most once.
 */
package fr.lapetina.inference.gateway.domain.model;
