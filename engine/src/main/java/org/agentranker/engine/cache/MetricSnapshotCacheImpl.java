package org.agentranker.engine.cache;

import org.agentranker.engine.api.MetricStoreClient;
import org.agentranker.engine.api.dto.ConfigItemDto;
import org.agentranker.engine.api.dto.SnapshotDocumentDto;
import org.agentranker.engine.domain.exception.ConfigurationException;
import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.ScoringConfig;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe implementation of MetricSnapshotCache.
 * Snapshots are immutable and swapped whole under the write lock, so a reader always
 * sees either the previous or the next snapshot, never a mix.
 */
public final class MetricSnapshotCacheImpl implements MetricSnapshotCache {

    private static final Logger LOG = Logger.getLogger(MetricSnapshotCacheImpl.class.getName());

    private final MetricStoreClient client;
    private final SnapshotMapper mapper = new SnapshotMapper();
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean initialized = false;
    private MetricSnapshot snapshot = MetricSnapshot.empty();
    private ScoringConfig scoringConfig;

    public MetricSnapshotCacheImpl(MetricStoreClient client, Clock clock) {
        this(client, clock, ScoringConfig.defaults());
    }

    /**
     * @param baseConfig configuration used until the store supplies one
     */
    public MetricSnapshotCacheImpl(MetricStoreClient client, Clock clock, ScoringConfig baseConfig) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scoringConfig = Objects.requireNonNull(baseConfig, "baseConfig must not be null");
    }

    @Override
    public void refresh() {
        LOG.info("Refreshing metric snapshot from store...");

        SnapshotDocumentDto document = client.fetchDocument();
        if (document == null || document.getAgents() == null || document.getAssignments() == null) {
            LOG.warning("Metric store unavailable, keeping existing snapshot");
            return;
        }
        ScoringConfig config = loadScoringConfig(document.getConfig());

        MetricSnapshot loaded = new MetricSnapshot(
                mapper.toAgents(document.getAgents()), mapper.toAssignments(document.getAssignments()),
                clock.instant());

        lock.writeLock().lock();
        try {
            this.snapshot = loaded;
            if (config != null) {
                this.scoringConfig = config;
            }
            this.initialized = true;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info(() -> "Metric snapshot refresh complete: " + loaded);
    }

    /**
     * Scoring configuration from the store, or null to keep the current one.
     * An unusable configuration is fatal only while nothing has been loaded yet.
     */
    private ScoringConfig loadScoringConfig(List<ConfigItemDto> items) {
        if (items == null) {
            LOG.warning("Scoring configuration unavailable, keeping current configuration");
            return null;
        }
        try {
            ScoringConfig config = ScoringConfig.fromMap(mapper.toConfigMap(items));
            LOG.info(() -> "Loaded " + items.size() + " scoring config values: " + config);
            return config;
        } catch (ConfigurationException e) {
            if (!initialized) {
                throw e;
            }
            LOG.log(Level.SEVERE, "Rejected scoring configuration, keeping previous one", e);
            return null;
        }
    }

    @Override
    public MetricSnapshot getSnapshot() {
        lock.readLock().lock();
        try {
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ScoringConfig getScoringConfig() {
        lock.readLock().lock();
        try {
            return scoringConfig;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }
}
