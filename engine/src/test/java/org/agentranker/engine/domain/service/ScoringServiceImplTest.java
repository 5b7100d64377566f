package org.agentranker.engine.domain.service;

import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.NormalizationDomain;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.agentranker.engine.domain.model.ScoringConfig;
import org.agentranker.engine.domain.model.ScoringSignal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.agentranker.engine.support.TestRecords.profile;

public class ScoringServiceImplTest {

    private final ScoringServiceImpl scoringService = new ScoringServiceImpl(new Normalizer());

    @Test
    public void shouldUseBaselineForMissingConditionalRatings() {
        AgentPerformanceProfile newcomer = profile(1, 4.0).build();

        ScoredAgent scored = scoringService.score(List.of(newcomer), ScoringConfig.defaults()).get(0);

        // 0.3*4 + (0.2 + 0.2 + 0.1)*3 + 0.2*1
        Assertions.assertEquals(2.9, scored.getBaseScore(), 1e-9);
        Assertions.assertEquals(2.9, scored.getFinalScore(), 1e-9);
    }

    @Test
    public void shouldFollowConfiguredBaseline() {
        AgentPerformanceProfile newcomer = profile(1, 4.0).build();
        ScoringConfig config = ScoringConfig.defaultsBuilder().baselineRating(2.0).build();

        ScoredAgent scored = scoringService.score(List.of(newcomer), config).get(0);

        Assertions.assertEquals(2.4, scored.getBaseScore(), 1e-9);
    }

    @Test
    public void shouldPreferConditionalRatingsOverBaseline() {
        AgentPerformanceProfile experienced = profile(1, 4.0)
                .leadSourceRating(4.0)
                .destinationRating(4.0)
                .communicationRating(4.0)
                .build();

        ScoredAgent scored = scoringService.score(List.of(experienced), ScoringConfig.defaults()).get(0);

        // 0.8*4 + 0.2*1
        Assertions.assertEquals(3.4, scored.getBaseScore(), 1e-9);
    }

    @Test
    public void shouldPenalizeCancellations() {
        AgentPerformanceProfile risky = profile(1, 4.0)
                .totalBookings(4)
                .confirmedBookings(3)
                .cancelledBookings(1)
                .build();

        ScoredAgent scored = scoringService.score(List.of(risky), ScoringConfig.defaults()).get(0);

        Assertions.assertTrue(scored.getFinalScore() <= scored.getBaseScore());
        Assertions.assertEquals(scored.getBaseScore() * 0.75, scored.getFinalScore(), 1e-12);
    }

    @Test
    public void shouldDeriveTripVolumeDomainFromPool() {
        List<AgentPerformanceProfile> pool = List.of(
                profile(1, 4.0).totalBookings(2).confirmedBookings(2).build(),
                profile(2, 4.0).totalBookings(6).confirmedBookings(6).build(),
                profile(3, 4.0).totalBookings(4).confirmedBookings(4).build());

        Assertions.assertEquals(NormalizationDomain.of(2, 6),
                scoringService.resolveTripVolumeDomain(pool, ScoringConfig.defaults()));

        List<ScoredAgent> scored = scoringService.score(pool, ScoringConfig.defaults());
        Assertions.assertEquals(1.0, scored.get(0).getNormalizedTripVolume());
        Assertions.assertEquals(5.0, scored.get(1).getNormalizedTripVolume());
        Assertions.assertEquals(3.0, scored.get(2).getNormalizedTripVolume());
    }

    @Test
    public void shouldFallBackToStaticDomainForFlatPool() {
        List<AgentPerformanceProfile> pool = List.of(
                profile(1, 4.0).totalBookings(5).confirmedBookings(5).build(),
                profile(2, 3.0).totalBookings(5).confirmedBookings(5).build());

        Assertions.assertEquals(NormalizationDomain.of(0, 10),
                scoringService.resolveTripVolumeDomain(pool, ScoringConfig.defaults()));
        Assertions.assertEquals(3.0, scoringService.score(pool, ScoringConfig.defaults()).get(0).getNormalizedTripVolume());
    }

    @Test
    public void shouldUseStaticDomainWhenPoolDerivationDisabled() {
        ScoringConfig config = ScoringConfig.defaultsBuilder()
                .tripVolumeFromPool(false)
                .tripVolumeDomain(0, 20)
                .build();
        List<AgentPerformanceProfile> pool = List.of(
                profile(1, 4.0).totalBookings(10).confirmedBookings(10).build(),
                profile(2, 4.0).totalBookings(2).confirmedBookings(2).build());

        List<ScoredAgent> scored = scoringService.score(pool, config);

        Assertions.assertEquals(3.0, scored.get(0).getNormalizedTripVolume());
        Assertions.assertEquals(1.4, scored.get(1).getNormalizedTripVolume(), 1e-9);
    }

    @Test
    public void shouldIgnoreTenureUnlessWeighted() {
        List<AgentPerformanceProfile> pool = List.of(
                profile(1, 4.0).yearsOfService(0).build(),
                profile(2, 4.0).yearsOfService(20).build());

        List<ScoredAgent> byDefault = scoringService.score(pool, ScoringConfig.defaults());
        Assertions.assertEquals(byDefault.get(0).getFinalScore(), byDefault.get(1).getFinalScore(), 1e-12);
        Assertions.assertEquals(1.0, byDefault.get(0).getNormalizedServiceYears());
        Assertions.assertEquals(5.0, byDefault.get(1).getNormalizedServiceYears());

        ScoringConfig tenureWeighted = new ScoringConfig.Builder()
                .weight("rating", ScoringSignal.RATING, 0.5)
                .weight("service_years", ScoringSignal.SERVICE_YEARS, 0.5)
                .build();
        List<ScoredAgent> weighted = scoringService.score(pool, tenureWeighted);
        Assertions.assertEquals(2.5, weighted.get(0).getFinalScore(), 1e-9);
        Assertions.assertEquals(4.5, weighted.get(1).getFinalScore(), 1e-9);
    }

    @Test
    public void shouldScoreEmptyPool() {
        Assertions.assertTrue(scoringService.score(List.of(), ScoringConfig.defaults()).isEmpty());
    }
}
