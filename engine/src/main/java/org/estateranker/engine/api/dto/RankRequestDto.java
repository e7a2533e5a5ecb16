package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.RankingRequest;
import org.estateranker.engine.domain.model.RetrievedListing;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for ranking a retrieved candidate pool.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RankRequestDto {

    @JsonProperty("intent")
    private IntentDto intent;

    @JsonProperty("candidates")
    private List<ListingDto> candidates;

    @JsonProperty("target_coords")
    private GeoPointDto targetCoords;

    @JsonProperty("avoid_coords")
    private GeoPointDto avoidCoords;

    @JsonProperty("top_n")
    private Integer topN;

    public IntentDto getIntent() {
        return intent;
    }

    public void setIntent(IntentDto intent) {
        this.intent = intent;
    }

    public List<ListingDto> getCandidates() {
        return candidates;
    }

    public void setCandidates(List<ListingDto> candidates) {
        this.candidates = candidates;
    }

    public GeoPointDto getTargetCoords() {
        return targetCoords;
    }

    public void setTargetCoords(GeoPointDto targetCoords) {
        this.targetCoords = targetCoords;
    }

    public GeoPointDto getAvoidCoords() {
        return avoidCoords;
    }

    public void setAvoidCoords(GeoPointDto avoidCoords) {
        this.avoidCoords = avoidCoords;
    }

    public Integer getTopN() {
        return topN;
    }

    public void setTopN(Integer topN) {
        this.topN = topN;
    }

    /**
     * Convert to the domain request.
     *
     * @throws IllegalArgumentException when coordinates or top_n are invalid
     */
    public RankingRequest toRankingRequest() {
        List<RetrievedListing> pool = new ArrayList<>();
        if (candidates != null) {
            for (ListingDto candidate : candidates) {
                if (candidate != null) {
                    pool.add(candidate.toRetrievedListing());
                }
            }
        }
        return new RankingRequest.Builder()
                .intent(intent != null ? intent.toIntent() : new IntentDto().toIntent())
                .pool(pool)
                .targetLocation(targetCoords != null ? targetCoords.toGeoPoint() : null)
                .avoidLocation(avoidCoords != null ? avoidCoords.toGeoPoint() : null)
                .topN(topN)
                .build();
    }
}
