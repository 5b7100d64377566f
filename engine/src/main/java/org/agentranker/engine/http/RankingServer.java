package org.agentranker.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.agentranker.engine.cache.MetricSnapshotCache;
import org.agentranker.engine.domain.exception.SnapshotUnavailableException;
import org.agentranker.engine.domain.exception.ValidationException;
import org.agentranker.engine.domain.model.CustomerProfile;
import org.agentranker.engine.domain.model.RankingResult;
import org.agentranker.engine.domain.service.AgentRankingService;
import org.agentranker.engine.http.dto.RankRequestDto;
import org.agentranker.engine.http.dto.RankingResponseDto;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP server exposing the ranking engine.
 * Endpoints: GET /health, POST /refresh, POST /rank.
 */
public final class RankingServer {

    private static final Logger LOG = Logger.getLogger(RankingServer.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final HttpServer server;
    private final ExecutorService executor;
    private final MetricSnapshotCache cache;
    private final AgentRankingService rankingService;

    /**
     * @param port listening port, 0 to pick a free one
     */
    public RankingServer(int port, MetricSnapshotCache cache, AgentRankingService rankingService) throws IOException {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.rankingService = Objects.requireNonNull(rankingService, "rankingService must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "Ranking server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/refresh", this::handleRefresh);
        server.createContext("/rank", this::handleRank);
    }

    /**
     * Start the ranking server.
     */
    public void start() {
        server.start();
        LOG.info("Ranking server started");
    }

    /**
     * Stop the ranking server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdown();
        LOG.info("Ranking server stopped");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        String status = cache.isInitialized() ? "healthy" : "initializing";
        sendJson(exchange, 200, Collections.singletonMap("status", status));
    }

    /**
     * Reload the metric snapshot and scoring configuration.
     * POST /refresh
     */
    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        LOG.info("Received refresh request");
        try {
            cache.refresh();
            sendJson(exchange, 200, Map.of(
                    "status", "refreshed",
                    "agents", cache.getSnapshot().getAgents().size()));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Refresh failed", e);
            sendError(exchange, 500, "refresh failed");
        }
    }

    /**
     * Rank the agent pool for a customer profile.
     * POST /rank[?limit=N]
     */
    private void handleRank(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        RankRequestDto request;
        int limit;
        try (InputStream body = exchange.getRequestBody()) {
            request = MAPPER.readValue(body, RankRequestDto.class);
            limit = parseLimit(exchange.getRequestURI().getRawQuery());
        } catch (JsonProcessingException e) {
            LOG.log(Level.FINE, "Malformed rank request", e);
            sendError(exchange, 400, "malformed request body");
            return;
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
            return;
        }
        if (request == null) {
            sendError(exchange, 400, "malformed request body");
            return;
        }

        try {
            CustomerProfile profile = CustomerProfile.fromLabels(request.getCommunicationMethod(),
                    request.getLeadSource(), request.getDestination(), request.getLaunchLocation(),
                    request.getCustomerName());
            RankingResult result = rankingService.rank(profile);
            sendJson(exchange, 200, RankingResponseDto.from(result, limit));
        } catch (ValidationException e) {
            LOG.info(() -> "Rejected rank request: " + e.getMessage());
            sendError(exchange, 400, e.getMessage());
        } catch (SnapshotUnavailableException e) {
            LOG.warning(() -> "Rank request before snapshot load: " + e.getMessage());
            sendError(exchange, 503, e.getMessage());
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Ranking failed", e);
            sendError(exchange, 500, "ranking failed");
        }
    }

    /**
     * Extract the limit query parameter; unlimited when absent.
     */
    private int parseLimit(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return Integer.MAX_VALUE;
        }
        for (String pair : rawQuery.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0 && "limit".equals(pair.substring(0, idx))) {
                try {
                    int limit = Integer.parseInt(pair.substring(idx + 1));
                    if (limit < 0) {
                        throw new IllegalArgumentException("limit must not be negative");
                    }
                    return limit;
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("limit must be an integer");
                }
            }
        }
        return Integer.MAX_VALUE;
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Collections.singletonMap("error", message));
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = MAPPER.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
