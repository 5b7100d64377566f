package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.NormalizationDomain;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.agentranker.engine.domain.model.ScoringConfig;
import org.agentranker.engine.domain.model.WeightEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using a weighted sum and a multiplicative risk penalty.
 *
 * Score formula (higher = better):
 *   base_score  = sum over weight entries of weight * signal value
 *   final_score = base_score * (1 - cancellation_rate)
 *
 * Conditional ratings missing for an agent take the configured baseline rating.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    private final Normalizer normalizer;

    public ScoringServiceImpl(Normalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    @Override
    public List<ScoredAgent> score(List<AgentPerformanceProfile> profiles, ScoringConfig config) {
        Objects.requireNonNull(profiles, "profiles must not be null");
        Objects.requireNonNull(config, "config must not be null");

        NormalizationDomain tripVolumeDomain = resolveTripVolumeDomain(profiles, config);

        List<ScoredAgent> scored = new ArrayList<>(profiles.size());
        for (AgentPerformanceProfile profile : profiles) {
            scored.add(scoreAgent(profile, tripVolumeDomain, config));
        }
        return scored;
    }

    private ScoredAgent scoreAgent(AgentPerformanceProfile profile, NormalizationDomain tripVolumeDomain,
                                   ScoringConfig config) {
        double serviceYears = normalizer.normalize(profile.getYearsOfService(), config.getServiceYearsDomain());
        double tripVolume = normalizer.normalize(profile.getConfirmedBookings(), tripVolumeDomain);

        double baseScore = 0.0;
        for (WeightEntry entry : config.getWeights()) {
            baseScore += entry.getWeight() * signalValue(entry, profile, serviceYears, tripVolume, config);
        }
        double finalScore = baseScore * (1.0 - profile.getCancellationRate());

        final double base = baseScore;
        LOG.fine(() -> String.format(
                "Scored agent %d: years=%.2f, volume=%.2f, cancellation=%.3f, base=%.4f, final=%.4f",
                profile.getAgentId(), serviceYears, tripVolume, profile.getCancellationRate(), base, finalScore));

        return new ScoredAgent.Builder()
                .profile(profile)
                .normalizedServiceYears(serviceYears)
                .normalizedTripVolume(tripVolume)
                .baseScore(baseScore)
                .finalScore(finalScore)
                .build();
    }

    /**
     * Value of the signal a weight entry reads for one agent.
     */
    private double signalValue(WeightEntry entry, AgentPerformanceProfile profile,
                               double serviceYears, double tripVolume, ScoringConfig config) {
        switch (entry.getSignal()) {
            case RATING:
                return profile.getRating();
            case LEAD_SOURCE_RATING:
                return orBaseline(profile.getLeadSourceRating(), config);
            case DESTINATION_RATING:
                return orBaseline(profile.getDestinationRating(), config);
            case COMMUNICATION_RATING:
                return orBaseline(profile.getCommunicationRating(), config);
            case SERVICE_YEARS:
                return serviceYears;
            case TRIP_VOLUME:
                return tripVolume;
            default:
                throw new IllegalStateException("Unhandled signal: " + entry.getSignal());
        }
    }

    private double orBaseline(Double rating, ScoringConfig config) {
        return rating != null ? rating : config.getBaselineRating();
    }

    /**
     * Trip volume domain for this pool. Falls back to the configured static domain when the
     * pool is empty or every agent has the same confirmed booking count.
     */
    NormalizationDomain resolveTripVolumeDomain(List<AgentPerformanceProfile> profiles, ScoringConfig config) {
        if (!config.isTripVolumeFromPool() || profiles.isEmpty()) {
            return config.getTripVolumeDomain();
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (AgentPerformanceProfile profile : profiles) {
            min = Math.min(min, profile.getConfirmedBookings());
            max = Math.max(max, profile.getConfirmedBookings());
        }
        if (max == min) {
            final int flat = min;
            LOG.fine(() -> "All agents have " + flat + " confirmed bookings, using static trip volume domain "
                    + config.getTripVolumeDomain());
            return config.getTripVolumeDomain();
        }
        return NormalizationDomain.of(min, max);
    }
}
