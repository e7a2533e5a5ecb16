package org.estateranker.engine;

import org.estateranker.engine.api.GeocodingClient;
import org.estateranker.engine.api.GoogleGeocodingClient;
import org.estateranker.engine.cache.ScoringConfigCache;
import org.estateranker.engine.cache.ScoringConfigCacheImpl;
import org.estateranker.engine.config.ConfigurationException;
import org.estateranker.engine.config.EngineConfig;
import org.estateranker.engine.config.ScoringConfigLoader;
import org.estateranker.engine.domain.service.RankingService;
import org.estateranker.engine.domain.service.RankingServiceImpl;
import org.estateranker.engine.http.RankingServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the Estate Ranker engine.
 *
 * The engine ranks retrieved real-estate listings against a parsed search intent
 * using constraint-gated multi-factor scoring.
 *
 * Endpoints:
 * - GET /health
 * - POST /refresh to reload the scoring configuration
 * - POST /score to score one listing
 * - POST /rank to rank a retrieved pool
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Estate Ranker Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        // Configure logging
        configureLogging(config);

        // Load scoring configuration, failure here is fatal
        ScoringConfigLoader loader = new ScoringConfigLoader(config.getScoringConfigFile());
        ScoringConfigCache cache = new ScoringConfigCacheImpl(loader::load);
        if (!cache.refresh()) {
            throw new ConfigurationException("Scoring configuration could not be loaded");
        }

        // Create geocoding client
        GeocodingClient geocodingClient;
        if (config.isGeocodingEnabled()) {
            geocodingClient = new GoogleGeocodingClient(config.getGeocodingBaseUrl(), config.getGoogleMapsApiKey(),
                    config.getGeocodingRegion(), config.getGeocodingLanguage());
            LOG.info(() -> "Geocoding enabled via " + config.getGeocodingBaseUrl());
        } else {
            geocodingClient = GeocodingClient.disabled();
            LOG.warning("GOOGLE_MAPS_API_KEY not set, place names will not be geocoded");
        }

        // Create services
        ExecutorService scoringPool = Executors.newFixedThreadPool(config.getScoringThreads());
        RankingService rankingService = new RankingServiceImpl(cache, geocodingClient, scoringPool);

        // Start ranking server
        RankingServer server = new RankingServer(config.getHttpPort(), cache, rankingService);
        server.start();
        LOG.info(() -> "Ranking server started on port " + config.getHttpPort());

        // Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            server.stop();
            scoringPool.shutdownNow();
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Estate Ranker started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: http://localhost:" + config.getHttpPort() + "/health");
        LOG.info(() -> "  - Refresh: POST http://localhost:" + config.getHttpPort() + "/refresh");
        LOG.info(() -> "  - Score: POST http://localhost:" + config.getHttpPort() + "/score");
        LOG.info(() -> "  - Rank: POST http://localhost:" + config.getHttpPort() + "/rank");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
