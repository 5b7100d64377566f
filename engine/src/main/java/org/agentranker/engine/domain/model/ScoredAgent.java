package org.agentranker.engine.domain.model;

import java.util.Objects;

/**
 * Immutable performance profile enriched with normalized metrics, scores and rank.
 * Rank is 0 until the ranker has placed the agent.
 */
public final class ScoredAgent {

    private final AgentPerformanceProfile profile;
    private final double normalizedServiceYears;
    private final double normalizedTripVolume;
    private final double baseScore;
    private final double finalScore;
    private final int rank;

    private ScoredAgent(Builder builder) {
        this.profile = Objects.requireNonNull(builder.profile, "profile must not be null");
        this.normalizedServiceYears = builder.normalizedServiceYears;
        this.normalizedTripVolume = builder.normalizedTripVolume;
        this.baseScore = builder.baseScore;
        this.finalScore = builder.finalScore;
        this.rank = builder.rank;
    }

    public AgentPerformanceProfile getProfile() {
        return profile;
    }

    public int getAgentId() {
        return profile.getAgentId();
    }

    public double getNormalizedServiceYears() {
        return normalizedServiceYears;
    }

    public double getNormalizedTripVolume() {
        return normalizedTripVolume;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Copy of this agent placed at the given rank.
     */
    public ScoredAgent withRank(int rank) {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be at least 1");
        }
        return new Builder()
                .profile(profile)
                .normalizedServiceYears(normalizedServiceYears)
                .normalizedTripVolume(normalizedTripVolume)
                .baseScore(baseScore)
                .finalScore(finalScore)
                .rank(rank)
                .build();
    }

    @Override
    public String toString() {
        return String.format("ScoredAgent{id=%d, name='%s', base=%.4f, final=%.4f, rank=%d}",
                profile.getAgentId(), profile.getName(), baseScore, finalScore, rank);
    }

    /**
     * Builder for ScoredAgent.
     */
    public static final class Builder {
        private AgentPerformanceProfile profile;
        private double normalizedServiceYears;
        private double normalizedTripVolume;
        private double baseScore;
        private double finalScore;
        private int rank;

        public Builder profile(AgentPerformanceProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder normalizedServiceYears(double normalizedServiceYears) {
            this.normalizedServiceYears = normalizedServiceYears;
            return this;
        }

        public Builder normalizedTripVolume(double normalizedTripVolume) {
            this.normalizedTripVolume = normalizedTripVolume;
            return this;
        }

        public Builder baseScore(double baseScore) {
            this.baseScore = baseScore;
            return this;
        }

        public Builder finalScore(double finalScore) {
            this.finalScore = finalScore;
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public ScoredAgent build() {
            return new ScoredAgent(this);
        }
    }
}
