package fr.lapetina.inference.gateway.infrastructure.metrics;

import fr.lapetina.inference.gateway.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Gateway metrics on Micrometer, exposed in Prometheus format.
 *
 * Provides:
 * - Requests per model and path (batched or immediate)
 * - Outcomes per model and error type
 * - Request latency and queue wait per model
 * - Batch size distribution and batches per runner
 * - Gauges for pending requests, runners, in-flight batches and ring buffer capacity
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    static final String OUTCOME_SUCCESS = "success";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> queueWaitTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> batchSizes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> batchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> batchFailureCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("inference_gateway");
    }

    /**
     * Counts an admitted request.
     *
     * @param path "batched" or "immediate"
     */
    public void incrementRequestCount(String model, String path) {
        String key = model + ":" + path;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Requests admitted")
                        .tag("model", model)
                        .tag("path", path)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a resolved request.
     *
     * @param errorType null for a success
     */
    public void recordOutcome(String model, ErrorType errorType) {
        String outcome = errorType == null ? OUTCOME_SUCCESS : errorType.name();
        String key = model + ":" + outcome;
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_results_total")
                        .description("Requests resolved, by outcome")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordLatency(String model, Duration latency) {
        latencyTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Time from submission to resolution")
                        .tag("model", model)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records how long a request waited in its queue before being batched.
     */
    public void recordQueueWait(String model, Duration wait) {
        queueWaitTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_queue_wait")
                        .description("Time spent queued before dispatch")
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(wait);
    }

    /**
     * Records a dispatched batch.
     */
    public void recordBatch(String model, String runnerId, int size) {
        batchSizes.computeIfAbsent(model, k ->
                DistributionSummary.builder(prefix + "_batch_size")
                        .description("Requests per dispatched batch")
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(size);

        String key = model + ":" + runnerId;
        batchCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_batches_total")
                        .description("Batches dispatched")
                        .tag("model", model)
                        .tag("runner", runnerId)
                        .register(registry)
        ).increment();
    }

    public void recordBatchFailure(String model, String runnerId, ErrorType errorType) {
        String key = model + ":" + runnerId + ":" + errorType.name();
        batchFailureCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_batch_failures_total")
                        .description("Batches that failed as a whole")
                        .tag("model", model)
                        .tag("runner", runnerId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge sampled from the supplier at scrape time.
     *
     * @param name suffix appended to the prefix
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
