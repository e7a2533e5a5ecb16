package org.estateranker.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.estateranker.engine.api.dto.RankRequestDto;
import org.estateranker.engine.api.dto.RankResponseDto;
import org.estateranker.engine.api.dto.ScoreRequestDto;
import org.estateranker.engine.api.dto.ScoringResultDto;
import org.estateranker.engine.cache.ScoringConfigCache;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.RankingResponse;
import org.estateranker.engine.domain.model.ScoringResult;
import org.estateranker.engine.domain.service.RankingService;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP server exposing the scoring engine.
 * Endpoints for health, configuration reload, single-listing scoring and pool ranking.
 */
public final class RankingServer {

    private static final Logger LOG = Logger.getLogger(RankingServer.class.getName());

    private final HttpServer server;
    private final ExecutorService executor;
    private final ScoringConfigCache cache;
    private final RankingService rankingService;
    private final ObjectMapper mapper;

    public RankingServer(int port, ScoringConfigCache cache, RankingService rankingService) throws IOException {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.rankingService = Objects.requireNonNull(rankingService, "rankingService must not be null");
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "Ranking server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/refresh", this::handleRefresh);
        server.createContext("/score", this::handleScore);
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

    /**
     * Bound port, useful when constructed with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        String status = cache.isInitialized() ? "healthy" : "initializing";
        sendResponse(exchange, 200, String.format("{\"status\":\"%s\",\"poi_keys\":%d}",
                status, cache.getConfig().getCatalog().size()));
    }

    /**
     * Reload scoring configuration.
     * POST /refresh
     */
    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        LOG.info("Received refresh request");
        try {
            if (cache.refresh()) {
                sendResponse(exchange, 200, "{\"status\":\"refreshed\"}");
            } else {
                sendResponse(exchange, 500, "{\"error\":\"refresh failed, previous configuration kept\"}");
            }
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Refresh failed", e);
            sendResponse(exchange, 500, "{\"error\":\"refresh failed\"}");
        }
    }

    /**
     * Score a single listing.
     * POST /score
     */
    private void handleScore(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        ScoreRequestDto request;
        Intent intent;
        CandidateAttributes attributes;
        GeoPoint target;
        GeoPoint avoid;
        try {
            request = readBody(exchange, ScoreRequestDto.class);
            if (request == null || request.getListing() == null) {
                sendResponse(exchange, 400, "{\"error\":\"missing listing\"}");
                return;
            }
            intent = request.getIntent() != null ? request.getIntent().toIntent() : Intent.empty();
            attributes = request.getListing().toAttributes();
            target = request.getTargetCoords() != null ? request.getTargetCoords().toGeoPoint() : null;
            avoid = request.getAvoidCoords() != null ? request.getAvoidCoords().toGeoPoint() : null;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "Rejected malformed score request", e);
            sendResponse(exchange, 400, errorBody("malformed request: " + e.getMessage()));
            return;
        }

        try {
            ScoringResult result = cache.getEngine().evaluate(attributes, intent, target, avoid);
            sendResponse(exchange, 200, mapper.writeValueAsString(ScoringResultDto.from(result)));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Scoring failed for " + attributes.getId(), e);
            sendResponse(exchange, 500, "{\"error\":\"scoring failed\"}");
        }
    }

    /**
     * Rank a retrieved candidate pool.
     * POST /rank
     */
    private void handleRank(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        RankingRequest request;
        try {
            RankRequestDto body = readBody(exchange, RankRequestDto.class);
            if (body == null) {
                sendResponse(exchange, 400, "{\"error\":\"missing body\"}");
                return;
            }
            request = body.toRankingRequest();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "Rejected malformed rank request", e);
            sendResponse(exchange, 400, errorBody("malformed request: " + e.getMessage()));
            return;
        }

        LOG.info(() -> "Received rank request for " + request.getPool().size() + " candidates");
        try {
            RankingResponse response = rankingService.rank(request);
            sendResponse(exchange, 200, mapper.writeValueAsString(RankResponseDto.from(response)));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Ranking failed", e);
            sendResponse(exchange, 500, "{\"error\":\"ranking failed\"}");
        }
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            return mapper.readValue(bytes, type);
        }
    }

    private String errorBody(String message) throws JsonProcessingException {
        return mapper.writeValueAsString(Collections.singletonMap("error", message));
    }

    /**
     * Send HTTP response.
     */
    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
