package fr.lapetina.inference.gateway.domain.model;

/**
 * Lifecycle status of a connected runner.
 *
 * CONNECTING: Registration in progress, not yet routable
 * READY: Accepting new work
 * DRAINING: Finishing in-flight work, receives nothing new
 * DISCONNECTED: Removed from the registry (explicitly or by heartbeat timeout)
 */
public enum RunnerStatus {
    CONNECTING,
    READY,
    DRAINING,
    DISCONNECTED
}
