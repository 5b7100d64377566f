package org.agentranker.engine.domain.service;

import org.agentranker.engine.cache.MetricSnapshotCache;
import org.agentranker.engine.domain.exception.SnapshotUnavailableException;
import org.agentranker.engine.domain.exception.ValidationException;
import org.agentranker.engine.domain.model.BookingStatus;
import org.agentranker.engine.domain.model.CommunicationMethod;
import org.agentranker.engine.domain.model.Destination;
import org.agentranker.engine.domain.model.LeadSource;
import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.agentranker.engine.domain.model.ScoringConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.agentranker.engine.support.TestRecords.agent;
import static org.agentranker.engine.support.TestRecords.booked;
import static org.agentranker.engine.support.TestRecords.sarahJohnson;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AgentRankingServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant TAKEN_AT = Instant.parse("2026-03-01T11:59:00Z");

    private final MetricSnapshotCache cache = mock(MetricSnapshotCache.class);
    private final PerformanceAggregator aggregator = spy(new PerformanceAggregatorImpl());

    private final AgentRankingServiceImpl service = new AgentRankingServiceImpl(cache, aggregator,
            new ScoringServiceImpl(new Normalizer()), new Ranker(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static MetricSnapshot snapshot() {
        return new MetricSnapshot(
                List.of(agent(1, 4.5, 10), agent(2, 3.0, 3), agent(3, 4.5, 10)),
                List.of(
                        booked(10, 1, LeadSource.ORGANIC, CommunicationMethod.PHONE_CALL, Destination.EUROPA, BookingStatus.CONFIRMED),
                        booked(30, 3, LeadSource.ORGANIC, CommunicationMethod.PHONE_CALL, Destination.EUROPA, BookingStatus.CONFIRMED),
                        booked(20, 2, LeadSource.BOUGHT, CommunicationMethod.TEXT, Destination.MARS, BookingStatus.CANCELLED)),
                TAKEN_AT);
    }

    @Test
    public void shouldRejectMissingProfileBeforeReadingSnapshot() {
        ValidationException error = Assertions.assertThrows(ValidationException.class, () -> service.rank(null));

        Assertions.assertEquals("customer_profile", error.getField());
        verify(cache, never()).getSnapshot();
        verify(aggregator, never()).aggregate(any(), any());
    }

    @Test
    public void shouldFailWhenNoSnapshotLoaded() {
        when(cache.isInitialized()).thenReturn(false);

        Assertions.assertThrows(SnapshotUnavailableException.class, () -> service.rank(sarahJohnson()));
        verify(aggregator, never()).aggregate(any(), any());
    }

    @Test
    public void shouldRankAgainstCachedSnapshot() {
        when(cache.isInitialized()).thenReturn(true);
        when(cache.getSnapshot()).thenReturn(snapshot());
        when(cache.getScoringConfig()).thenReturn(ScoringConfig.defaults());

        RankingResult result = service.rank(sarahJohnson());

        Assertions.assertEquals(NOW, result.getComputedAt());
        Assertions.assertEquals(TAKEN_AT, result.getSnapshotTakenAt());
        Assertions.assertEquals(sarahJohnson(), result.getCustomerProfile());
        List<ScoredAgent> ranked = result.getRankedAgents();
        Assertions.assertEquals(3, ranked.size());
        // agents 1 and 3 are identical, so the lower id wins the tie
        Assertions.assertEquals(1, ranked.get(0).getAgentId());
        Assertions.assertEquals(3, ranked.get(1).getAgentId());
        Assertions.assertEquals(2, ranked.get(2).getAgentId());
        Assertions.assertEquals(0.0, ranked.get(2).getFinalScore());
    }

    @Test
    public void shouldReturnSameRankingForRepeatedRequests() {
        MetricSnapshot snapshot = snapshot();
        ScoringConfig config = ScoringConfig.defaults();

        RankingResult first = service.rank(sarahJohnson(), snapshot, config);
        RankingResult second = service.rank(sarahJohnson(), snapshot, config);

        Assertions.assertEquals(first.getRankedAgents().size(), second.getRankedAgents().size());
        for (int i = 0; i < first.getRankedAgents().size(); i++) {
            ScoredAgent a = first.getRankedAgents().get(i);
            ScoredAgent b = second.getRankedAgents().get(i);
            Assertions.assertEquals(a.getAgentId(), b.getAgentId());
            Assertions.assertEquals(a.getRank(), b.getRank());
            Assertions.assertEquals(a.getFinalScore(), b.getFinalScore());
        }
    }

    @Test
    public void shouldReturnEmptyRankingForEmptyPool() {
        RankingResult result = service.rank(sarahJohnson(), MetricSnapshot.empty(), ScoringConfig.defaults());

        Assertions.assertTrue(result.getRankedAgents().isEmpty());
        Assertions.assertTrue(result.top(5).isEmpty());
    }
}
