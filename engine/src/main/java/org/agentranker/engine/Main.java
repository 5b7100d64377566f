package org.agentranker.engine;

import org.agentranker.engine.api.JsonFileMetricStoreClient;
import org.agentranker.engine.api.MetricStoreClient;
import org.agentranker.engine.api.MetricStoreClientImpl;
import org.agentranker.engine.api.TokenManager;
import org.agentranker.engine.cache.MetricSnapshotCache;
import org.agentranker.engine.cache.MetricSnapshotCacheImpl;
import org.agentranker.engine.config.EngineConfig;
import org.agentranker.engine.domain.service.AgentRankingService;
import org.agentranker.engine.domain.service.AgentRankingServiceImpl;
import org.agentranker.engine.domain.service.Normalizer;
import org.agentranker.engine.domain.service.PerformanceAggregatorImpl;
import org.agentranker.engine.domain.service.Ranker;
import org.agentranker.engine.domain.service.ScoringServiceImpl;
import org.agentranker.engine.http.RankingServer;
import org.agentranker.engine.scheduler.SnapshotRefreshScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the Agent Ranking Engine.
 *
 * The engine ranks the service agent pool against an incoming customer profile using
 * conditioned historical performance, normalized volume metrics and a cancellation
 * risk penalty.
 *
 * Snapshot sources:
 * - HTTP metric store at METRIC_STORE_URL (optionally Keycloak-authenticated)
 * - JSON snapshot file at METRIC_STORE_FILE
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Agent Ranking Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        configureLogging(config);

        MetricStoreClient client = createClient(config);
        Clock clock = Clock.systemUTC();

        // Initial load; an invalid scoring configuration aborts startup here
        MetricSnapshotCache cache = new MetricSnapshotCacheImpl(client, clock);
        LOG.info("Loading metric snapshot...");
        cache.refresh();

        if (!cache.isInitialized()) {
            LOG.warning("Metric snapshot not loaded yet, rank requests return 503 until a refresh succeeds");
        }

        AgentRankingService rankingService = new AgentRankingServiceImpl(cache, new PerformanceAggregatorImpl(),
                new ScoringServiceImpl(new Normalizer()), new Ranker(), clock);

        RankingServer server = new RankingServer(config.getServerPort(), cache, rankingService);
        server.start();
        LOG.info(() -> "Ranking server started on port " + server.getPort());

        SnapshotRefreshScheduler scheduler = null;
        if (config.isRefreshEnabled()) {
            scheduler = new SnapshotRefreshScheduler(cache, config.getRefreshIntervalSeconds());
            scheduler.start();
        } else {
            LOG.info("Snapshot refresh scheduler disabled");
        }

        final SnapshotRefreshScheduler finalScheduler = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            server.stop();
            if (finalScheduler != null) {
                finalScheduler.stop();
            }
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Agent Ranking Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: http://localhost:" + server.getPort() + "/health");
        LOG.info(() -> "  - Refresh: POST http://localhost:" + server.getPort() + "/refresh");
        LOG.info(() -> "  - Rank: POST http://localhost:" + server.getPort() + "/rank");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    private MetricStoreClient createClient(EngineConfig config) {
        if (config.isFileMetricStore()) {
            Path file = Paths.get(config.getMetricStoreFile()).toAbsolutePath();
            LOG.info(() -> "Using metric snapshot file: " + file);
            return new JsonFileMetricStoreClient(file);
        }

        TokenManager tokenManager = null;
        if (config.isAuthEnabled()) {
            tokenManager = new TokenManager(
                    TokenManager.tokenUrl(config.getKeycloakUrl(), config.getKeycloakRealm()),
                    config.getClientId(), config.getClientSecret());
            LOG.info(() -> "Metric store calls authenticated via realm " + config.getKeycloakRealm());
        }
        LOG.info(() -> "Metric store client configured for: " + config.getMetricStoreUrl());
        return new MetricStoreClientImpl(config.getMetricStoreUrl(), tokenManager);
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
