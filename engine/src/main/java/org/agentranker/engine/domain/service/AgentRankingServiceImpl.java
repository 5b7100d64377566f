package org.agentranker.engine.domain.service;

import org.agentranker.engine.cache.MetricSnapshotCache;
import org.agentranker.engine.domain.exception.SnapshotUnavailableException;
import org.agentranker.engine.domain.exception.ValidationException;
import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.CustomerProfile;
import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.agentranker.engine.domain.model.ScoringConfig;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of AgentRankingService.
 * Runs aggregation, scoring and ranking against a single snapshot per request.
 */
public final class AgentRankingServiceImpl implements AgentRankingService {

    private static final Logger LOG = Logger.getLogger(AgentRankingServiceImpl.class.getName());

    private final MetricSnapshotCache cache;
    private final PerformanceAggregator aggregator;
    private final ScoringService scoringService;
    private final Ranker ranker;
    private final Clock clock;

    public AgentRankingServiceImpl(MetricSnapshotCache cache, PerformanceAggregator aggregator,
                                   ScoringService scoringService, Ranker ranker, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public RankingResult rank(CustomerProfile profile) {
        requireProfile(profile);
        if (!cache.isInitialized()) {
            throw new SnapshotUnavailableException("No metric snapshot has been loaded yet");
        }
        return rank(profile, cache.getSnapshot(), cache.getScoringConfig());
    }

    @Override
    public RankingResult rank(CustomerProfile profile, MetricSnapshot snapshot, ScoringConfig config) {
        requireProfile(profile);
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(config, "config must not be null");

        LOG.info(() -> "Ranking agents for " + profile + " against " + snapshot);

        List<AgentPerformanceProfile> profiles = aggregator.aggregate(profile, snapshot);
        List<ScoredAgent> scored = scoringService.score(profiles, config);
        List<ScoredAgent> ranked = ranker.rank(scored, config.getTieTolerance());

        if (!ranked.isEmpty()) {
            ScoredAgent best = ranked.get(0);
            LOG.info(() -> String.format("Ranked %d agents for %s, best: %s (final=%.4f)",
                    ranked.size(), profile.getCustomerName(), best.getProfile().getName(), best.getFinalScore()));
        } else {
            LOG.warning(() -> "No agents available to rank for " + profile.getCustomerName());
        }

        return new RankingResult(profile, ranked, clock.instant(), snapshot.getTakenAt());
    }

    private static void requireProfile(CustomerProfile profile) {
        if (profile == null) {
            throw new ValidationException("customer_profile", "customer profile must not be null");
        }
    }
}
