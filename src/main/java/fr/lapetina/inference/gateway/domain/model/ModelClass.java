package fr.lapetina.inference.gateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse model families a client can ask for instead of a concrete model,
 * written {@code class:big} or {@code class:fast}.
 */
public enum ModelClass {
    BIG,
    FAST;

    public static final String PREFIX = "class:";

    public static Optional<ModelClass> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "big" -> Optional.of(BIG);
            case "fast" -> Optional.of(FAST);
            default -> Optional.empty();
        };
    }

    /**
     * Parses a requested model; only {@code class:<name>} with a known name is a class request.
     */
    public static Optional<ModelClass> fromRequestedModel(String model) {
        if (model == null || !model.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        return fromName(model.substring(PREFIX.length()));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
