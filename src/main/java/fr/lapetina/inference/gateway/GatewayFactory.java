package fr.lapetina.inference.gateway;

import fr.lapetina.inference.gateway.batching.BatchDispatcher;
import fr.lapetina.inference.gateway.batching.BatchExecutor;
import fr.lapetina.inference.gateway.batching.BatchQueue;
import fr.lapetina.inference.gateway.batching.InFlightBatches;
import fr.lapetina.inference.gateway.domain.model.ModelClass;
import fr.lapetina.inference.gateway.domain.model.RunnerStatus;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.infrastructure.http.RunnerHttpClient;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.infrastructure.registry.LivenessSweeper;
import fr.lapetina.inference.gateway.infrastructure.registry.RunnerRegistry;
import fr.lapetina.inference.gateway.routing.ModelResolver;
import fr.lapetina.inference.gateway.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating a fully-wired gateway core from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     Router router = factory.getRouter();
 *     // register runners, submit requests...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final GatewayConfig config;
    private final MetricsRegistry metricsRegistry;
    private final RunnerRegistry runnerRegistry;
    private final LivenessSweeper livenessSweeper;
    private final BatchQueue batchQueue;
    private final InFlightBatches inFlightBatches;
    private final BatchExecutor executor;
    private final BatchDispatcher dispatcher;
    private final Router router;

    protected GatewayFactory(String configPath, BatchExecutor executorOverride) {
        log.info("Initializing GatewayFactory from config: {}", configPath);

        this.config = new ConfigLoader(configPath).load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.runnerRegistry = new RunnerRegistry();
        this.livenessSweeper = new LivenessSweeper(
                runnerRegistry,
                config.getRunners().getHeartbeatTimeout(),
                config.getRunners().getSweepInterval()
        );

        this.batchQueue = new BatchQueue(
                config.getBatching().getBatchTimeout(),
                config.getBatching().getMinBatchSize()
        );

        // Fails outstanding batches when a runner is lost
        this.inFlightBatches = new InFlightBatches();
        runnerRegistry.addListener(inFlightBatches);

        // Allow override for testing
        this.executor = executorOverride != null
                ? executorOverride
                : new RunnerHttpClient(config.getTimeouts().getConnectTimeout());

        this.dispatcher = BatchDispatcher.builder()
                .batchQueue(batchQueue)
                .registry(runnerRegistry)
                .executor(executor)
                .inFlight(inFlightBatches)
                .metrics(metricsRegistry)
                .tickInterval(config.getBatching().getTickInterval())
                .noRunnerTimeout(config.getBatching().getNoRunnerTimeout())
                .executionTimeout(config.getTimeouts().getExecutionTimeout())
                .build();

        this.router = Router.builder()
                .fromConfig(config)
                .registry(runnerRegistry)
                .batchQueue(batchQueue)
                .executor(executor)
                .inFlight(inFlightBatches)
                .metrics(metricsRegistry)
                .modelResolver(new ModelResolver(runnerRegistry, classModels(config)))
                .build();

        if (config.getMetrics().isEnabled()) {
            registerGauges();
        }

        log.info("GatewayFactory initialized: batching={}, minBatchSize={}, batchTimeoutMs={}",
                config.getBatching().isEnabled(),
                config.getBatching().getMinBatchSize(),
                config.getBatching().getBatchTimeoutMs());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static GatewayFactory create(String configPath) {
        return new GatewayFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static GatewayFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the router, dispatcher and liveness sweeper.
     */
    public GatewayFactory start() {
        router.start();
        dispatcher.start();
        livenessSweeper.start();
        log.info("Gateway core started");
        return this;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public Router getRouter() {
        return router;
    }

    public RunnerRegistry getRunnerRegistry() {
        return runnerRegistry;
    }

    public BatchQueue getBatchQueue() {
        return batchQueue;
    }

    public BatchDispatcher getDispatcher() {
        return dispatcher;
    }

    public InFlightBatches getInFlightBatches() {
        return inFlightBatches;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public LivenessSweeper getLivenessSweeper() {
        return livenessSweeper;
    }

    private static Map<ModelClass, List<String>> classModels(GatewayConfig config) {
        Map<ModelClass, List<String>> classModels = new EnumMap<>(ModelClass.class);
        classModels.put(ModelClass.BIG, config.getModels().getBig());
        classModels.put(ModelClass.FAST, config.getModels().getFast());
        return classModels;
    }

    private void registerGauges() {
        metricsRegistry.registerGauge("pending_requests", "Requests submitted and not yet resolved",
                router::pendingCount);
        metricsRegistry.registerGauge("queued_requests", "Requests waiting in batch queues",
                batchQueue::pendingCount);
        metricsRegistry.registerGauge("inflight_batches", "Batches dispatched and not yet settled",
                inFlightBatches::count);
        metricsRegistry.registerGauge("ready_runners", "Runners accepting work",
                () -> runnerRegistry.countByStatus(RunnerStatus.READY));
        metricsRegistry.registerGauge("ringbuffer_remaining", "Remaining capacity in the ingress ring buffer",
                router::getRemainingCapacity);
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            router.close();
        } catch (Exception e) {
            log.warn("Error closing router", e);
        }

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher", e);
        }

        try {
            livenessSweeper.close();
        } catch (Exception e) {
            log.warn("Error closing liveness sweeper", e);
        }

        if (executor instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing executor", e);
            }
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("GatewayFactory shut down");
    }
}
