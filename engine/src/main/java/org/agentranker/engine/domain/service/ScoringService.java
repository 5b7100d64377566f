package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.agentranker.engine.domain.model.ScoringConfig;

import java.util.List;

/**
 * Service for calculating ranking scores for agents.
 */
public interface ScoringService {

    /**
     * Score every profile of a pool.
     * Higher score = better agent. The pool is needed because the trip volume
     * domain can be derived from it.
     *
     * @param profiles the aggregated profiles of the whole pool
     * @param config the validated scoring configuration
     * @return one unranked scored agent per profile, in input order
     */
    List<ScoredAgent> score(List<AgentPerformanceProfile> profiles, ScoringConfig config);
}
