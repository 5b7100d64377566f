package org.agentranker.engine.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ranked agents together with the exact input and snapshot that produced them.
 */
public final class RankingResult {

    private final CustomerProfile customerProfile;
    private final List<ScoredAgent> rankedAgents;
    private final Instant computedAt;
    private final Instant snapshotTakenAt;

    public RankingResult(CustomerProfile customerProfile, List<ScoredAgent> rankedAgents,
                         Instant computedAt, Instant snapshotTakenAt) {
        this.customerProfile = Objects.requireNonNull(customerProfile, "customerProfile must not be null");
        this.rankedAgents = List.copyOf(Objects.requireNonNull(rankedAgents, "rankedAgents must not be null"));
        this.computedAt = Objects.requireNonNull(computedAt, "computedAt must not be null");
        this.snapshotTakenAt = Objects.requireNonNull(snapshotTakenAt, "snapshotTakenAt must not be null");
    }

    public CustomerProfile getCustomerProfile() {
        return customerProfile;
    }

    /**
     * Agents ordered best first.
     */
    public List<ScoredAgent> getRankedAgents() {
        return rankedAgents;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    public Instant getSnapshotTakenAt() {
        return snapshotTakenAt;
    }

    /**
     * The best {@code limit} agents, or all of them when the pool is smaller.
     */
    public List<ScoredAgent> top(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return rankedAgents.subList(0, Math.min(limit, rankedAgents.size()));
    }
}
