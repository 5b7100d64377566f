package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.CustomerProfile;
import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.model.ScoringConfig;

/**
 * Service for ranking the agent pool against a customer profile.
 */
public interface AgentRankingService {

    /**
     * Rank every agent against the profile using the currently cached snapshot and config.
     *
     * @param profile the validated customer profile
     * @return ranked agents, best first, with the profile and timestamps echoed
     * @throws org.agentranker.engine.domain.exception.ValidationException if the profile is missing
     * @throws org.agentranker.engine.domain.exception.SnapshotUnavailableException if nothing is loaded yet
     */
    RankingResult rank(CustomerProfile profile);

    /**
     * Rank every agent against the profile using an explicit snapshot and config.
     * Pure with respect to its arguments apart from the computation timestamp.
     */
    RankingResult rank(CustomerProfile profile, MetricSnapshot snapshot, ScoringConfig config);
}
