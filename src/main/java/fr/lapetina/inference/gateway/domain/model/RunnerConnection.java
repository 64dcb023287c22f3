package fr.lapetina.inference.gateway.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * Transport handle for reaching a runner. The core only passes it through
 * to the {@code BatchExecutor}.
 */
public record RunnerConnection(URI baseUrl) {
    public RunnerConnection {
        Objects.requireNonNull(baseUrl, "Base URL is required");
    }

    public static RunnerConnection of(String baseUrl) {
        return new RunnerConnection(URI.create(baseUrl));
    }
}
