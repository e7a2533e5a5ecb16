package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for scoring a single listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScoreRequestDto {

    @JsonProperty("intent")
    private IntentDto intent;

    @JsonProperty("listing")
    private ListingDto listing;

    @JsonProperty("target_coords")
    private GeoPointDto targetCoords;

    @JsonProperty("avoid_coords")
    private GeoPointDto avoidCoords;

    public IntentDto getIntent() {
        return intent;
    }

    public void setIntent(IntentDto intent) {
        this.intent = intent;
    }

    public ListingDto getListing() {
        return listing;
    }

    public void setListing(ListingDto listing) {
        this.listing = listing;
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
}
