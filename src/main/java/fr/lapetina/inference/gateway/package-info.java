/**
 * Inference Gateway - request batching and routing in front of a pool of inference runners.
 *
 * <p>Runners connect to the gateway, advertise the models they serve and the largest batch
 * each accepts, and keep themselves alive with heartbeats. Client requests are queued per
 * model and dispatched in batches to the least-loaded runner serving the model.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.gateway.GatewayFactory} - Wires the gateway core from
 *       YAML configuration</li>
 *   <li>{@link fr.lapetina.inference.gateway.InferenceGatewayApplication} - Standalone HTTP server
 *       with an OpenAI-style chat API and the runner control plane</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     Router router = factory.getRouter();
 *
 *     InferenceRequest request = InferenceRequest.ofUserMessage("llama3:8b", "Hello!");
 *     InferenceResponse response = router.submit(request).get();
 *     System.out.println(response.content());
 * }
 * }</pre>
 *
 * @see fr.lapetina.inference.gateway.routing.Router
 * @see fr.lapetina.inference.gateway.batching.BatchDispatcher
 */
package fr.lapetina.inference.gateway;
