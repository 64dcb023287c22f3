package fr.lapetina.inference.gateway.infrastructure.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private BatchingConfig batching = new BatchingConfig();
    private RunnersConfig runners = new RunnersConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private ValidationConfig validation = new ValidationConfig();
    private ModelsConfig models = new ModelsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public BatchingConfig getBatching() { return batching; }
    public void setBatching(BatchingConfig batching) { this.batching = batching; }

    public RunnersConfig getRunners() { return runners; }
    public void setRunners(RunnersConfig runners) { this.runners = runners; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public ModelsConfig getModels() { return models; }
    public void setModels(ModelsConfig models) { this.models = models; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private long requestTimeoutMs = 300_000;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        /** How long an HTTP caller waits for its result before the request is cancelled. */
        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public Duration getRequestTimeout() { return Duration.ofMillis(requestTimeoutMs); }
    }

    /**
     * Batch formation settings.
     */
    public static class BatchingConfig {
        private boolean enabled = true;
        private long batchTimeoutMs = 50;
        private int minBatchSize = 1;
        private long tickIntervalMs = 10;
        private long noRunnerTimeoutMs = 30_000;

        /** When false, every request takes the immediate path. */
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getBatchTimeoutMs() { return batchTimeoutMs; }
        public void setBatchTimeoutMs(long batchTimeoutMs) { this.batchTimeoutMs = batchTimeoutMs; }

        public int getMinBatchSize() { return minBatchSize; }
        public void setMinBatchSize(int minBatchSize) { this.minBatchSize = minBatchSize; }

        public long getTickIntervalMs() { return tickIntervalMs; }
        public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }

        /** How long a request may wait for a runner serving its model to appear. */
        public long getNoRunnerTimeoutMs() { return noRunnerTimeoutMs; }
        public void setNoRunnerTimeoutMs(long noRunnerTimeoutMs) { this.noRunnerTimeoutMs = noRunnerTimeoutMs; }

        public Duration getBatchTimeout() { return Duration.ofMillis(batchTimeoutMs); }
        public Duration getTickInterval() { return Duration.ofMillis(tickIntervalMs); }
        public Duration getNoRunnerTimeout() { return Duration.ofMillis(noRunnerTimeoutMs); }
    }

    /**
     * Runner connection settings.
     */
    public static class RunnersConfig {
        private long heartbeatTimeoutMs = 90_000;
        private long sweepIntervalMs = 5_000;
        private String authToken;
        private int protocolVersion = 1;

        public long getHeartbeatTimeoutMs() { return heartbeatTimeoutMs; }
        public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) { this.heartbeatTimeoutMs = heartbeatTimeoutMs; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }

        /** Bearer token runners must present to register; null disables the check. */
        public String getAuthToken() { return authToken; }
        public void setAuthToken(String authToken) { this.authToken = authToken; }

        public int getProtocolVersion() { return protocolVersion; }
        public void setProtocolVersion(int protocolVersion) { this.protocolVersion = protocolVersion; }

        public Duration getHeartbeatTimeout() { return Duration.ofMillis(heartbeatTimeoutMs); }
        public Duration getSweepInterval() { return Duration.ofMillis(sweepIntervalMs); }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Runner call timeouts.
     */
    public static class TimeoutsConfig {
        private long executionTimeoutMs = 300_000;
        private long connectTimeoutMs = 10_000;

        public long getExecutionTimeoutMs() { return executionTimeoutMs; }
        public void setExecutionTimeoutMs(long executionTimeoutMs) { this.executionTimeoutMs = executionTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public Duration getExecutionTimeout() { return Duration.ofMillis(executionTimeoutMs); }
        public Duration getConnectTimeout() { return Duration.ofMillis(connectTimeoutMs); }
    }

    /**
     * Request validation settings.
     */
    public static class ValidationConfig {
        private int maxMessageLength = 100_000;
        private int maxMessages = 256;
        private Set<String> allowedModels = new HashSet<>();

        public int getMaxMessageLength() { return maxMessageLength; }
        public void setMaxMessageLength(int maxMessageLength) { this.maxMessageLength = maxMessageLength; }

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }

        public Set<String> getAllowedModels() { return allowedModels; }
        public void setAllowedModels(Set<String> allowedModels) { this.allowedModels = allowedModels; }
    }

    /**
     * Concrete models behind each model class.
     */
    public static class ModelsConfig {
        private List<String> big = new ArrayList<>();
        private List<String> fast = new ArrayList<>();

        public List<String> getBig() { return big; }
        public void setBig(List<String> big) { this.big = big; }

        public List<String> getFast() { return fast; }
        public void setFast(List<String> fast) { this.fast = fast; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "inference_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
