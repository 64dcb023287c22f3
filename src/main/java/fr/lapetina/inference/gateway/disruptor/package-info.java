/**
 * LMAX Disruptor ingress for submitted requests.
 *
 * <p>Every request goes through a pre-allocated ring buffer before it reaches a queue or a runner.
 * A full ring buffer rejects the submission with a
 * {@link fr.lapetina.inference.gateway.disruptor.exception.BackpressureException}.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Validation → Admission (batch queue or immediate dispatch)
 * </pre>
 *
 * @see fr.lapetina.inference.gateway.disruptor.IngressPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.inference.gateway.disruptor;
