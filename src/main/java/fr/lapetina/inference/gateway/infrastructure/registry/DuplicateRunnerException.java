package fr.lapetina.inference.gateway.infrastructure.registry;

/**
 * Thrown when a runner registers with an ID that is already connected.
 */
public final class DuplicateRunnerException extends RuntimeException {

    private final String runnerId;

    public DuplicateRunnerException(String runnerId) {
        super("Runner already registered: " + runnerId);
        this.runnerId = runnerId;
    }

    public String getRunnerId() {
        return runnerId;
    }
}
