/**
 * Per-model request queues and the dispatcher that turns them into runner batches.
 *
 * <p>A batch holds requests for a single model, never more than the target runner's
 * {@code maxBatchSize}, taken in enqueue order. Batch results are mapped back to the
 * requests by position.
 */
package fr.lapetina.inference.gateway.batching;
