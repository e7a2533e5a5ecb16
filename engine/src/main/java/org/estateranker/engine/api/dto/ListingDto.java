package org.estateranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.estateranker.engine.domain.model.CandidateAttributes;
import org.estateranker.engine.domain.model.RetrievedListing;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DTO for one retrieved listing: the similarity score plus the flat attribute map
 * (POI distances, asset type, price, coordinates, locality fields).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ListingDto {

    @JsonProperty("semantic_score")
    private double semanticScore;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public double getSemanticScore() {
        return semanticScore;
    }

    public void setSemanticScore(double semanticScore) {
        this.semanticScore = semanticScore;
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public CandidateAttributes toAttributes() {
        return CandidateAttributes.of(attributes);
    }

    public RetrievedListing toRetrievedListing() {
        return RetrievedListing.of(semanticScore, toAttributes());
    }
}
