package fr.lapetina.inference.gateway.infrastructure.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background liveness check for connected runners.
 *
 * Periodically evicts runners whose last heartbeat is older than the heartbeat timeout.
 * The only source of truth for liveness; never performs network I/O.
 */
public final class LivenessSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LivenessSweeper.class);

    private final RunnerRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration heartbeatTimeout;
    private final Duration sweepInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public LivenessSweeper(RunnerRegistry registry, Duration heartbeatTimeout, Duration sweepInterval) {
        if (heartbeatTimeout.isNegative() || heartbeatTimeout.isZero()) {
            throw new IllegalArgumentException("Heartbeat timeout must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        this.registry = registry;
        this.heartbeatTimeout = heartbeatTimeout;
        this.sweepInterval = sweepInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "liveness-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic sweep.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::sweep,
                    sweepInterval.toMillis(),
                    sweepInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Liveness sweeper started: heartbeatTimeout={}, interval={}", heartbeatTimeout, sweepInterval);
        }
    }

    /**
     * Runs one sweep immediately.
     *
     * @return number of runners evicted
     */
    public int sweep() {
        try {
            int evicted = registry.evictStale(heartbeatTimeout);
            if (evicted > 0) {
                log.info("Liveness sweep evicted {} runner(s), {} remaining", evicted, registry.size());
            } else {
                log.debug("Liveness sweep: runnerCount={}", registry.size());
            }
            return evicted;
        } catch (RuntimeException e) {
            // Keeps the scheduled task alive
            log.error("Liveness sweep failed", e);
            return 0;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Liveness sweeper stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
