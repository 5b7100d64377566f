package org.agentranker.engine.cache;

import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.ScoringConfig;

/**
 * Holds the current metric snapshot and scoring configuration loaded from the metric store.
 */
public interface MetricSnapshotCache {

    /**
     * Load or refresh the snapshot and configuration from the store.
     *
     * @throws org.agentranker.engine.domain.exception.ConfigurationException if the store
     *         supplies an unusable configuration and no valid one has been loaded before
     */
    void refresh();

    /**
     * Get the current snapshot. Never null; empty until the first successful refresh.
     */
    MetricSnapshot getSnapshot();

    /**
     * Get the current scoring configuration.
     */
    ScoringConfig getScoringConfig();

    /**
     * Check if a snapshot has been loaded.
     */
    boolean isInitialized();
}
