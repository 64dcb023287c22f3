package fr.lapetina.inference.gateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the gateway configuration from YAML.
 *
 * Tries the file system first, then the classpath. Configuration is read once
 * at startup.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public GatewayConfig load() {
        GatewayConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private GatewayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private GatewayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        GatewayConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private GatewayConfig parse(InputStream is, String source) {
        try {
            GatewayConfig config = yaml.load(is);
            return config != null ? config : new GatewayConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private void validate(GatewayConfig config) {
        int ringBufferSize = config.getDisruptor().getRingBufferSize();
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("disruptor.ringBufferSize must be a power of 2, got " + ringBufferSize);
        }
        if (config.getBatching().getMinBatchSize() < 1) {
            throw new ConfigurationException("batching.minBatchSize must be >= 1");
        }
        if (config.getBatching().getBatchTimeoutMs() < 0) {
            throw new ConfigurationException("batching.batchTimeoutMs must not be negative");
        }
        if (config.getBatching().getTickIntervalMs() <= 0) {
            throw new ConfigurationException("batching.tickIntervalMs must be positive");
        }
        if (config.getRunners().getHeartbeatTimeoutMs() <= 0 || config.getRunners().getSweepIntervalMs() <= 0) {
            throw new ConfigurationException("runners.heartbeatTimeoutMs and runners.sweepIntervalMs must be positive");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static GatewayConfig createDefault() {
        return new GatewayConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
