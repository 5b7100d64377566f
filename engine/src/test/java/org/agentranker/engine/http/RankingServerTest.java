package org.agentranker.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.agentranker.engine.cache.MetricSnapshotCache;
import org.agentranker.engine.domain.exception.SnapshotUnavailableException;
import org.agentranker.engine.domain.model.MetricSnapshot;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.model.ScoredAgent;
import org.agentranker.engine.domain.service.AgentRankingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.agentranker.engine.support.TestRecords.profile;
import static org.agentranker.engine.support.TestRecords.sarahJohnson;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RankingServerTest {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SARAH = "{\"communication_method\":\"Phone Call\",\"lead_source\":\"Organic\","
            + "\"destination\":\"Europa\",\"launch_location\":\"Kennedy Space Center\","
            + "\"customer_name\":\"Sarah Johnson\"}";

    private final MetricSnapshotCache cache = mock(MetricSnapshotCache.class);
    private final AgentRankingService rankingService = mock(AgentRankingService.class);
    private final OkHttpClient http = new OkHttpClient();

    private RankingServer server;

    @BeforeEach
    public void startServer() throws IOException {
        server = new RankingServer(0, cache, rankingService);
        server.start();
    }

    @AfterEach
    public void stopServer() {
        server.stop();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getPort() + path;
    }

    private Response post(String path, String body) throws IOException {
        return http.newCall(new Request.Builder().url(url(path)).post(RequestBody.create(body, JSON)).build())
                .execute();
    }

    private static ScoredAgent scored(int id, double score, int rank) {
        return new ScoredAgent.Builder()
                .profile(profile(id, 4.0).departmentName("Luxury Voyages").build())
                .normalizedServiceYears(3.0)
                .normalizedTripVolume(5.0)
                .baseScore(score)
                .finalScore(score)
                .rank(rank)
                .build();
    }

    private static RankingResult result() {
        return new RankingResult(sarahJohnson(), List.of(scored(3, 3.4, 1), scored(1, 3.1, 2)),
                Instant.parse("2026-05-04T09:30:00Z"), Instant.parse("2026-05-04T09:00:00Z"));
    }

    @Test
    public void shouldReportHealth() throws IOException {
        when(cache.isInitialized()).thenReturn(true);

        try (Response response = http.newCall(new Request.Builder().url(url("/health")).build()).execute()) {
            Assertions.assertEquals(200, response.code());
            Assertions.assertEquals("healthy", MAPPER.readTree(response.body().string()).path("status").asText());
        }
    }

    @Test
    public void shouldRankCustomerProfile() throws IOException {
        when(rankingService.rank(sarahJohnson())).thenReturn(result());

        try (Response response = post("/rank", SARAH)) {
            Assertions.assertEquals(200, response.code());
            JsonNode body = MAPPER.readTree(response.body().string());
            Assertions.assertEquals("2026-05-04T09:30:00Z", body.path("computed_at").asText());
            Assertions.assertEquals("Europa", body.path("customer_profile").path("destination").asText());
            JsonNode agents = body.path("agents");
            Assertions.assertEquals(2, agents.size());
            Assertions.assertEquals(3, agents.get(0).path("agent_id").asInt());
            Assertions.assertEquals(1, agents.get(0).path("rank").asInt());
            Assertions.assertEquals(3.4, agents.get(0).path("final_score").asDouble(), 1e-12);
            Assertions.assertTrue(agents.get(0).path("lead_source_rating").isNull());
        }
    }

    @Test
    public void shouldApplyLimit() throws IOException {
        when(rankingService.rank(sarahJohnson())).thenReturn(result());

        try (Response response = post("/rank?limit=1", SARAH)) {
            Assertions.assertEquals(200, response.code());
            JsonNode agents = MAPPER.readTree(response.body().string()).path("agents");
            Assertions.assertEquals(1, agents.size());
            Assertions.assertEquals(3, agents.get(0).path("agent_id").asInt());
        }
    }

    @Test
    public void shouldRejectUnknownDestinationBeforeRanking() throws IOException {
        String pluto = SARAH.replace("Europa", "Pluto");

        try (Response response = post("/rank", pluto)) {
            Assertions.assertEquals(400, response.code());
            Assertions.assertTrue(response.body().string().contains("Pluto"));
        }
        verify(rankingService, never()).rank(any());
    }

    @Test
    public void shouldRejectMalformedBody() throws IOException {
        try (Response response = post("/rank", "{not json")) {
            Assertions.assertEquals(400, response.code());
        }
        verify(rankingService, never()).rank(any());
    }

    @Test
    public void shouldRejectNullBody() throws IOException {
        try (Response response = post("/rank", "null")) {
            Assertions.assertEquals(400, response.code());
            Assertions.assertEquals("malformed request body",
                    MAPPER.readTree(response.body().string()).path("error").asText());
        }
        verify(rankingService, never()).rank(any());
    }

    @Test
    public void shouldRejectInvalidLimit() throws IOException {
        try (Response response = post("/rank?limit=-2", SARAH)) {
            Assertions.assertEquals(400, response.code());
        }
    }

    @Test
    public void shouldReturnServiceUnavailableBeforeFirstSnapshot() throws IOException {
        when(rankingService.rank(any())).thenThrow(new SnapshotUnavailableException("No metric snapshot has been loaded yet"));

        try (Response response = post("/rank", SARAH)) {
            Assertions.assertEquals(503, response.code());
        }
    }

    @Test
    public void shouldReturnServerErrorOnUnexpectedFailure() throws IOException {
        when(rankingService.rank(any())).thenThrow(new IllegalStateException("boom"));

        try (Response response = post("/rank", SARAH)) {
            Assertions.assertEquals(500, response.code());
        }
    }

    @Test
    public void shouldRejectWrongMethod() throws IOException {
        try (Response response = http.newCall(new Request.Builder().url(url("/rank")).build()).execute()) {
            Assertions.assertEquals(405, response.code());
        }
    }

    @Test
    public void shouldRefreshSnapshot() throws IOException {
        when(cache.getSnapshot()).thenReturn(MetricSnapshot.empty());

        try (Response response = post("/refresh", "")) {
            Assertions.assertEquals(200, response.code());
        }
        verify(cache).refresh();
    }

    @Test
    public void shouldReportRefreshFailure() throws IOException {
        doThrow(new IllegalStateException("store down")).when(cache).refresh();

        try (Response response = post("/refresh", "")) {
            Assertions.assertEquals(500, response.code());
        }
    }
}
