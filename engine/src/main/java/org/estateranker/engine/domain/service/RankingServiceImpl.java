package org.estateranker.engine.domain.service;

import org.estateranker.engine.api.GeocodingClient;
import org.estateranker.engine.cache.ScoringConfigCache;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.RankedListing;
import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.RankingResponse;
import org.estateranker.engine.domain.model.RankingSettings;
import org.estateranker.engine.domain.model.RetrievedListing;
import org.estateranker.engine.domain.model.ScoringResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of RankingService.
 * Scores candidates concurrently, one task per candidate, and joins before sorting.
 *
 * Final score formula (higher = better):
 *   final = w_structured * structured_score
 *         + w_semantic * semantic_score
 *         + w_lifestyle * lifestyle_score
 */
public final class RankingServiceImpl implements RankingService {

    private static final Logger LOG = Logger.getLogger(RankingServiceImpl.class.getName());

    static final String NO_CANDIDATES_MESSAGE = "No candidates to rank";
    static final String ALL_DISQUALIFIED_MESSAGE = "No listing satisfies the required conditions";
    static final String LOW_SCORE_MESSAGE = "No listing matches closely enough (low matching score)";
    static final String FAILED_MESSAGE = "Ranking failed";

    private final ScoringConfigCache cache;
    private final GeocodingClient geocodingClient;
    private final ExecutorService executor;

    public RankingServiceImpl(ScoringConfigCache cache, GeocodingClient geocodingClient, ExecutorService executor) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.geocodingClient = Objects.requireNonNull(geocodingClient, "geocodingClient must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public RankingResponse rank(RankingRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        LOG.info(() -> "Ranking " + request.getPool().size() + " candidates");

        try {
            // One engine for the whole call, even if a reload happens meanwhile
            ScoringEngine engine = cache.getEngine();
            RankingSettings settings = engine.getConfig().getRanking();

            List<RetrievedListing> pool = request.getPool();
            if (pool.isEmpty()) {
                return RankingResponse.empty(NO_CANDIDATES_MESSAGE, 0, 0);
            }
            if (pool.size() > settings.getMaxPoolSize()) {
                LOG.fine(() -> String.format("Truncating pool from %d to %d", pool.size(), settings.getMaxPoolSize()));
            }
            List<RetrievedListing> candidates = pool.subList(0, Math.min(pool.size(), settings.getMaxPoolSize()));

            Intent intent = request.getIntent();
            GeoPoint target = resolveLocation(request.getTargetLocation(), intent.getTargetLocation());
            GeoPoint avoid = resolveLocation(request.getAvoidLocation(), intent.getAvoidLocation());

            List<Future<ScoringResult>> futures = new ArrayList<>(candidates.size());
            for (RetrievedListing candidate : candidates) {
                futures.add(executor.submit(() -> engine.evaluate(candidate.getAttributes(), intent, target, avoid)));
            }

            int scored = 0;
            int disqualified = 0;
            List<RankedListing> ranked = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                RetrievedListing candidate = candidates.get(i);
                ScoringResult result = await(futures.get(i), candidate);
                if (result == null) {
                    continue;
                }
                scored++;
                if (result.isDisqualified()) {
                    disqualified++;
                    continue;
                }
                if (result.getDataQuality() != null
                        && result.getDataQuality().getQualityScore() < settings.getMinQualityForInclusion()) {
                    LOG.fine(() -> "Dropping low-quality candidate " + candidate.getId());
                    continue;
                }
                ranked.add(toRankedListing(candidate, result, settings));
            }

            final int scoredCount = scored;
            final int disqualifiedCount = disqualified;
            LOG.info(() -> String.format("Scored %d candidates, %d disqualified, %d eligible",
                    scoredCount, disqualifiedCount, ranked.size()));

            if (ranked.isEmpty()) {
                return RankingResponse.empty(ALL_DISQUALIFIED_MESSAGE, scored, disqualified);
            }

            Collections.sort(ranked);

            if (ranked.get(0).getFinalScore() < settings.getMinFinalScore()) {
                LOG.info(() -> String.format("Best final score %.3f below %.2f, returning no results",
                        ranked.get(0).getFinalScore(), settings.getMinFinalScore()));
                return RankingResponse.empty(LOW_SCORE_MESSAGE, scored, disqualified);
            }

            int topN = request.getTopN() != null ? request.getTopN() : settings.getDefaultTopN();
            return RankingResponse.of(ranked.subList(0, Math.min(topN, ranked.size())), scored, disqualified);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warning("Ranking interrupted");
            return RankingResponse.empty(FAILED_MESSAGE, 0, 0);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Error ranking candidates", e);
            return RankingResponse.empty(FAILED_MESSAGE, 0, 0);
        }
    }

    private ScoringResult await(Future<ScoringResult> future, RetrievedListing candidate) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.log(Level.SEVERE, e.getCause(), () -> "Scoring failed for candidate " + candidate.getId());
            return null;
        }
    }

    /**
     * Explicit coordinates win; otherwise geocode the place name. A failed lookup skips the step.
     */
    private GeoPoint resolveLocation(GeoPoint coordinates, String placeName) {
        if (coordinates != null) {
            return coordinates;
        }
        if (placeName == null) {
            return null;
        }
        try {
            GeoPoint resolved = geocodingClient.geocode(placeName).orElse(null);
            if (resolved == null) {
                LOG.warning(() -> "Could not geocode '" + placeName + "', skipping location scoring");
            }
            return resolved;
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Geocoding failed for '" + placeName + "'");
            return null;
        }
    }

    private static RankedListing toRankedListing(RetrievedListing candidate, ScoringResult result,
                                                 RankingSettings settings) {
        double lifestyle = candidate.getAttributes().getLifestyleScore();
        return new RankedListing.Builder()
                .listingId(candidate.getId())
                .structuredScore(result.getScore())
                .semanticScore(candidate.getSemanticScore())
                .lifestyleScore(lifestyle)
                .finalScore(settings.combine(result.getScore(), candidate.getSemanticScore(), lifestyle))
                .scoringResult(result)
                .build();
    }
}
