/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration into {@link
 * fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig}. Configuration is read
 * once at startup.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, caller timeout)</li>
 *   <li>{@code batching} - Batch formation (timeout, minimum size, tick, no-runner timeout)</li>
 *   <li>{@code runners} - Heartbeat timeout, sweep interval, registration token</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code timeouts} - Runner execution and connection timeouts</li>
 *   <li>{@code validation} - Request limits and model whitelist</li>
 *   <li>{@code models} - Concrete models behind {@code class:big} and {@code class:fast}</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader
 */
package fr.lapetina.inference.gateway.infrastructure.config;
