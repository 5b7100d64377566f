package org.agentranker.engine.domain.service;

import org.agentranker.engine.api.JsonFileMetricStoreClient;
import org.agentranker.engine.cache.MetricSnapshotCacheImpl;
import org.agentranker.engine.domain.model.AgentPerformanceProfile;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.agentranker.engine.support.TestRecords.sarahJohnson;

/**
 * End-to-end ranking of the three-agent fixture for an organic Europa customer
 * who prefers phone calls.
 */
public class GoldenRankingScenarioTest {

    private static final Instant NOW = Instant.parse("2026-05-04T09:30:00Z");
    private static final double EPS = 1e-9;

    private RankingResult result;

    @BeforeEach
    public void setUp() throws Exception {
        Path fixture = Paths.get(getClass().getResource("/fixtures/three-agent-snapshot.json").toURI());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        MetricSnapshotCacheImpl cache = new MetricSnapshotCacheImpl(new JsonFileMetricStoreClient(fixture), clock);
        cache.refresh();

        AgentRankingServiceImpl service = new AgentRankingServiceImpl(cache, new PerformanceAggregatorImpl(),
                new ScoringServiceImpl(new Normalizer()), new Ranker(), clock);
        result = service.rank(sarahJohnson());
    }

    @Test
    public void shouldRankReliableSpecialistFirst() {
        List<ScoredAgent> ranked = result.getRankedAgents();

        Assertions.assertEquals(3, ranked.size());
        Assertions.assertEquals(3, ranked.get(0).getAgentId());
        Assertions.assertEquals(1, ranked.get(1).getAgentId());
        Assertions.assertEquals(2, ranked.get(2).getAgentId());
        Assertions.assertEquals(1, ranked.get(0).getRank());
        Assertions.assertEquals(3, ranked.get(2).getRank());
    }

    @Test
    public void shouldComputeExpectedScores() {
        ScoredAgent priya = result.getRankedAgents().get(0);
        ScoredAgent ava = result.getRankedAgents().get(1);
        ScoredAgent marcus = result.getRankedAgents().get(2);

        Assertions.assertEquals(3.4, priya.getBaseScore(), EPS);
        Assertions.assertEquals(3.4, priya.getFinalScore(), EPS);
        Assertions.assertEquals(4.6, ava.getBaseScore(), EPS);
        Assertions.assertEquals(4.6 * 2.0 / 3.0, ava.getFinalScore(), EPS);
        Assertions.assertEquals(3.94, marcus.getBaseScore(), EPS);
        Assertions.assertEquals(1.97, marcus.getFinalScore(), EPS);
    }

    @Test
    public void shouldFallBackToBaselineForAgentWithoutMatchingHistory() {
        AgentPerformanceProfile marcus = result.getRankedAgents().get(2).getProfile();

        Assertions.assertEquals("Marcus Reed", marcus.getName());
        Assertions.assertNull(marcus.getLeadSourceRating());
        Assertions.assertNull(marcus.getDestinationRating());
        Assertions.assertNull(marcus.getCommunicationRating());
        Assertions.assertEquals(0.5, marcus.getCancellationRate(), EPS);
    }

    @Test
    public void shouldNormalizeVolumeAndTenure() {
        ScoredAgent priya = result.getRankedAgents().get(0);
        ScoredAgent ava = result.getRankedAgents().get(1);
        ScoredAgent marcus = result.getRankedAgents().get(2);

        Assertions.assertEquals(1.0, priya.getNormalizedTripVolume(), EPS);
        Assertions.assertEquals(5.0, ava.getNormalizedTripVolume(), EPS);
        Assertions.assertEquals(5.0, marcus.getNormalizedTripVolume(), EPS);
        Assertions.assertEquals(5.0, priya.getNormalizedServiceYears(), EPS);
        Assertions.assertEquals(3.0, ava.getNormalizedServiceYears(), EPS);
        Assertions.assertEquals(1.0, marcus.getNormalizedServiceYears(), EPS);
    }

    @Test
    public void shouldStampResultWithClockAndSnapshotTime() {
        Assertions.assertEquals(NOW, result.getComputedAt());
        Assertions.assertEquals(NOW, result.getSnapshotTakenAt());
        Assertions.assertEquals("Sarah Johnson", result.getCustomerProfile().getCustomerName());
    }
}
