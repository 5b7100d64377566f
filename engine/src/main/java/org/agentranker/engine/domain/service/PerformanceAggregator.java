package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.CustomerProfile;
import org.agentranker.engine.domain.model.MetricSnapshot;

import java.util.List;

/**
 * Builds per-agent performance profiles from historical records.
 */
public interface PerformanceAggregator {

    /**
     * Aggregate the snapshot for one customer profile.
     * Every valid agent yields exactly one profile, whether or not it has any history.
     *
     * @param customer the profile the conditional ratings are matched against
     * @param snapshot consistent view of agents, assignments and bookings
     * @return one profile per agent, ordered by agent id
     */
    List<AgentPerformanceProfile> aggregate(CustomerProfile customer, MetricSnapshot snapshot);
}
