package org.estateranker.engine.domain.service;

import org.estateranker.engine.TestFixtures;
import org.estateranker.engine.api.GeocodingClient;
import org.estateranker.engine.cache.ScoringConfigCache;
import org.estateranker.engine.domain.model.GeoPoint;
import org.estateranker.engine.domain.model.Intent;
import org.estateranker.engine.domain.model.RankedListing;
import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.RankingResponse;
import org.estateranker.engine.domain.model.RankingSettings;
import org.estateranker.engine.domain.model.RetrievedListing;
import org.estateranker.engine.domain.model.ScoringConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.estateranker.engine.TestFixtures.BANGKOK_LAT;
import static org.estateranker.engine.TestFixtures.BANGKOK_LON;
import static org.estateranker.engine.TestFixtures.retrieved;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RankingServiceImplTest {

    @Mock
    private ScoringConfigCache cache;

    @Mock
    private GeocodingClient geocodingClient;

    private ExecutorService executor;
    private RankingServiceImpl rankingService;

    private final Intent condoIntent = new Intent.Builder()
            .assetTypes(Collections.singletonList("condo"))
            .build();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        rankingService = new RankingServiceImpl(cache, geocodingClient, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void givenConfig(ScoringConfig config) {
        when(cache.getEngine()).thenReturn(ScoringEngine.create(config));
    }

    private static ScoringConfig withRanking(RankingSettings.Builder ranking) {
        return TestFixtures.bundledConfig().toBuilder().ranking(ranking.build()).build();
    }

    @Test
    void ranksEligibleCandidatesByFinalScore() {
        givenConfig(TestFixtures.bundledConfig());
        List<RetrievedListing> pool = Arrays.asList(
                retrieved(0.9, "A", "asset_type_id", 3),
                retrieved(0.5, "B", "asset_type_id", 12, "lifestyle_score", 2.0),
                retrieved(0.99, "C", "asset_type_id", 4));

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(condoIntent).pool(pool).build());

        assertThat(response.isEmpty()).isFalse();
        assertThat(response.getCandidatesScored()).isEqualTo(3);
        assertThat(response.getCandidatesDisqualified()).isEqualTo(1);
        assertThat(response.getResults()).extracting(RankedListing::getListingId).containsExactly("B", "A");

        RankedListing best = response.getResults().get(0);
        // 0.7 * 2.0 + 0.2 * 0.5 + 0.05 * 2.0
        assertThat(best.getFinalScore()).isCloseTo(1.6, within(1e-9));
        assertThat(best.getStructuredScore()).isEqualTo(2.0);
        assertThat(best.getScoringResult().isDisqualified()).isFalse();
    }

    @Test
    void emptyPoolReportsNoCandidates() {
        givenConfig(TestFixtures.bundledConfig());

        RankingResponse response = rankingService.rank(new RankingRequest.Builder().build());

        assertThat(response.getResults()).isEmpty();
        assertThat(response.getMessage()).isEqualTo(RankingServiceImpl.NO_CANDIDATES_MESSAGE);
    }

    @Test
    void allDisqualifiedExplainsWhy() {
        givenConfig(TestFixtures.bundledConfig());

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(condoIntent)
                .pool(Collections.singletonList(retrieved(0.9, "H", "asset_type_id", 4)))
                .build());

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.getMessage()).isEqualTo(RankingServiceImpl.ALL_DISQUALIFIED_MESSAGE);
        assertThat(response.getCandidatesDisqualified()).isEqualTo(1);
    }

    @Test
    void weakBestMatchReturnsNothing() {
        givenConfig(TestFixtures.bundledConfig());

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .pool(Arrays.asList(retrieved(0.3, "W1"), retrieved(0.2, "W2")))
                .build());

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.getMessage()).isEqualTo(RankingServiceImpl.LOW_SCORE_MESSAGE);
        assertThat(response.getCandidatesScored()).isEqualTo(2);
    }

    @Test
    void topNLimitsResults() {
        givenConfig(TestFixtures.bundledConfig());
        List<RetrievedListing> pool = Arrays.asList(
                retrieved(0.9, "A", "asset_type_id", 3),
                retrieved(0.8, "B", "asset_type_id", 3),
                retrieved(0.7, "C", "asset_type_id", 3));

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(condoIntent).pool(pool).topN(2).build());

        assertThat(response.getResults()).extracting(RankedListing::getListingId).containsExactly("A", "B");
    }

    @Test
    void poolIsTruncatedToConfiguredMaximum() {
        givenConfig(withRanking(new RankingSettings.Builder().maxPoolSize(2)));
        List<RetrievedListing> pool = Arrays.asList(
                retrieved(0.9, "A", "asset_type_id", 3),
                retrieved(0.8, "B", "asset_type_id", 3),
                retrieved(0.99, "C", "asset_type_id", 3));

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(condoIntent).pool(pool).build());

        assertThat(response.getCandidatesScored()).isEqualTo(2);
        assertThat(response.getResults()).extracting(RankedListing::getListingId).doesNotContain("C");
    }

    @Test
    void lowQualityCandidatesAreDroppedWhenConfigured() {
        givenConfig(withRanking(new RankingSettings.Builder().minQualityForInclusion(0.5)));
        List<RetrievedListing> pool = Arrays.asList(
                retrieved(0.9, "sparse", "asset_type_id", 3),
                retrieved(0.6, "complete", "asset_type_id", 3, "asset_details_selling_price", 4_000_000,
                        "latitude", BANGKOK_LAT, "longitude", BANGKOK_LON));

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(condoIntent).pool(pool).build());

        assertThat(response.getResults()).extracting(RankedListing::getListingId).containsExactly("complete");
        assertThat(response.getResults().get(0).getQualityScore()).isGreaterThanOrEqualTo(0.5);
    }

    @Test
    void targetPlaceNameIsGeocoded() {
        givenConfig(TestFixtures.bundledConfig());
        when(geocodingClient.geocode("Siam Paragon")).thenReturn(Optional.of(GeoPoint.of(BANGKOK_LAT, BANGKOK_LON)));
        Intent intent = new Intent.Builder().targetLocation("Siam Paragon").build();

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(intent)
                .pool(Collections.singletonList(
                        retrieved(0.5, "G1", "latitude", BANGKOK_LAT, "longitude", BANGKOK_LON)))
                .build());

        assertThat(response.getResults()).hasSize(1);
        assertThat(response.getResults().get(0).getScoringResult().getScoreBreakdown())
                .containsEntry("target_location", 3.0);
    }

    @Test
    void explicitCoordinatesSkipGeocoding() {
        givenConfig(TestFixtures.bundledConfig());
        Intent intent = new Intent.Builder().targetLocation("Siam Paragon").build();

        rankingService.rank(new RankingRequest.Builder()
                .intent(intent)
                .targetLocation(GeoPoint.of(BANGKOK_LAT, BANGKOK_LON))
                .pool(Collections.singletonList(retrieved(0.5, "G1")))
                .build());

        verify(geocodingClient, never()).geocode(anyString());
    }

    @Test
    void unresolvablePlaceSkipsLocationScoring() {
        givenConfig(TestFixtures.bundledConfig());
        when(geocodingClient.geocode("Atlantis")).thenReturn(Optional.empty());
        Intent intent = new Intent.Builder()
                .assetTypes(Collections.singletonList("condo"))
                .targetLocation("Atlantis")
                .build();

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(intent)
                .pool(Collections.singletonList(retrieved(0.5, "G1", "asset_type_id", 3,
                        "latitude", BANGKOK_LAT, "longitude", BANGKOK_LON)))
                .build());

        assertThat(response.getResults()).hasSize(1);
        assertThat(response.getResults().get(0).getScoringResult().getScoreBreakdown())
                .doesNotContainKey("target_location");
    }

    @Test
    void geocoderFailureIsNotFatal() {
        givenConfig(TestFixtures.bundledConfig());
        when(geocodingClient.geocode("Somewhere")).thenThrow(new IllegalStateException("quota exceeded"));
        Intent intent = new Intent.Builder()
                .assetTypes(Collections.singletonList("condo"))
                .avoidLocation("Somewhere")
                .build();

        RankingResponse response = rankingService.rank(new RankingRequest.Builder()
                .intent(intent)
                .pool(Collections.singletonList(retrieved(0.5, "G1", "asset_type_id", 3)))
                .build());

        assertThat(response.getResults()).hasSize(1);
    }
}
