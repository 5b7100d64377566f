package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.ScoredAgent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders scored agents best first and assigns ranks 1..N.
 *
 * Final scores within the tie tolerance of each other are tied and ordered by agent id
 * ascending. Ties chain: after sorting by raw score, each run of neighbours whose gap is
 * within the tolerance forms one tie group.
 */
public final class Ranker {

    /**
     * Rank a pool. No agent is dropped.
     *
     * @param scored unranked agents
     * @param tieTolerance largest gap between neighbouring final scores that still counts as a tie
     * @return new ranked instances, best first
     */
    public List<ScoredAgent> rank(List<ScoredAgent> scored, double tieTolerance) {
        Objects.requireNonNull(scored, "scored must not be null");
        if (tieTolerance < 0.0) {
            throw new IllegalArgumentException("tieTolerance must not be negative");
        }

        List<ScoredAgent> ordered = new ArrayList<>(scored);
        ordered.sort(Comparator.comparingDouble(ScoredAgent::getFinalScore).reversed()
                .thenComparingInt(ScoredAgent::getAgentId));
        orderTieGroupsById(ordered, tieTolerance);

        List<ScoredAgent> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ranked.add(ordered.get(i).withRank(i + 1));
        }
        return ranked;
    }

    /**
     * Re-sort each run of neighbours no further apart than the tolerance by agent id.
     */
    private static void orderTieGroupsById(List<ScoredAgent> ordered, double tieTolerance) {
        int groupStart = 0;
        for (int i = 1; i <= ordered.size(); i++) {
            boolean groupEnds = i == ordered.size()
                    || ordered.get(i - 1).getFinalScore() - ordered.get(i).getFinalScore() > tieTolerance;
            if (groupEnds) {
                if (i - groupStart > 1) {
                    ordered.subList(groupStart, i).sort(Comparator.comparingInt(ScoredAgent::getAgentId));
                }
                groupStart = i;
            }
        }
    }
}
