package org.agentranker.engine.scheduler;

import org.agentranker.engine.cache.MetricSnapshotCache;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically reloads the metric snapshot so rankings follow the store.
 * A failed cycle keeps the previous snapshot.
 */
public final class SnapshotRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(SnapshotRefreshScheduler.class.getName());

    private final ScheduledExecutorService executor;
    private final MetricSnapshotCache cache;
    private final int intervalSeconds;
    private volatile boolean running = false;

    public SnapshotRefreshScheduler(MetricSnapshotCache cache, int intervalSeconds) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");

        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler. The first cycle runs after one interval.
     */
    public synchronized void start() {
        if (running) {
            LOG.warning("Snapshot refresh scheduler already running");
            return;
        }

        LOG.info(() -> "Starting snapshot refresh scheduler with interval: " + intervalSeconds + "s");
        executor.scheduleAtFixedRate(this::runRefreshCycle, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        running = true;
    }

    /**
     * Stop the scheduler, waiting briefly for a running cycle to finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping snapshot refresh scheduler");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run a single refresh cycle.
     */
    void runRefreshCycle() {
        try {
            LOG.fine("Running snapshot refresh cycle");
            cache.refresh();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Error in snapshot refresh cycle", e);
        }
    }
}
